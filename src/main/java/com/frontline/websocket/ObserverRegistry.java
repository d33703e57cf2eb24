package com.frontline.websocket;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks connected observer sessions, the player behind each session and the country
 * room each session sits in. A session is in at most one room.
 */
@Component
@Slf4j
public class ObserverRegistry {

    private final Map<String, String> sessionPlayers = new ConcurrentHashMap<>();
    private final Map<String, String> sessionRooms = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> rooms = new ConcurrentHashMap<>();

    public void connect(String sessionId, String playerId) {
        sessionPlayers.put(sessionId, playerId);
        log.debug("Session {} connected for player {}", sessionId, playerId);
    }

    /**
     * Put the session into a country room, leaving any previous room.
     */
    public void joinRoom(String sessionId, String countryId) {
        leaveRoom(sessionId);
        rooms.compute(countryId, (id, members) -> {
            Set<String> updated = members != null ? members : ConcurrentHashMap.newKeySet();
            updated.add(sessionId);
            return updated;
        });
        sessionRooms.put(sessionId, countryId);
    }

    public void leaveRoom(String sessionId) {
        String countryId = sessionRooms.remove(sessionId);
        if (countryId == null) {
            return;
        }
        rooms.computeIfPresent(countryId, (id, members) -> {
            members.remove(sessionId);
            return members.isEmpty() ? null : members;
        });
    }

    /**
     * Move every session of a player into {@code countryId}; a null country only leaves.
     */
    public void movePlayer(String playerId, String countryId) {
        for (String sessionId : sessionsOfPlayer(playerId)) {
            if (countryId == null) {
                leaveRoom(sessionId);
            } else {
                joinRoom(sessionId, countryId);
            }
        }
    }

    /**
     * Forget a session entirely.
     *
     * @return what the session was attached to, empty if it was never connected
     */
    public Optional<DisconnectedSession> disconnect(String sessionId) {
        String countryId = sessionRooms.get(sessionId);
        leaveRoom(sessionId);
        String playerId = sessionPlayers.remove(sessionId);
        if (playerId == null) {
            return Optional.empty();
        }
        log.debug("Session {} of player {} disconnected", sessionId, playerId);
        return Optional.of(new DisconnectedSession(sessionId, playerId, countryId));
    }

    public Set<String> membersOf(String countryId) {
        Set<String> members = rooms.get(countryId);
        return members == null ? Set.of() : Set.copyOf(members);
    }

    public Set<String> allSessions() {
        return Set.copyOf(sessionPlayers.keySet());
    }

    public List<String> sessionsOfPlayer(String playerId) {
        return sessionPlayers.entrySet().stream()
                .filter(e -> e.getValue().equals(playerId))
                .map(Map.Entry::getKey)
                .toList();
    }

    public Optional<String> playerOf(String sessionId) {
        return Optional.ofNullable(sessionPlayers.get(sessionId));
    }

    public Optional<String> roomOf(String sessionId) {
        return Optional.ofNullable(sessionRooms.get(sessionId));
    }

    public int connectedCount() {
        return sessionPlayers.size();
    }

    public int activeRoomCount() {
        return rooms.size();
    }

    @PreDestroy
    public void clear() {
        sessionPlayers.clear();
        sessionRooms.clear();
        rooms.clear();
    }

    public record DisconnectedSession(String sessionId, String playerId, String countryId) {
    }
}
