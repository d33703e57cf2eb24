package com.frontline.websocket;

import com.frontline.model.Player;
import com.frontline.service.ConflictTickScheduler;
import com.frontline.service.PlayerService;
import com.frontline.websocket.ConflictBroadcaster.ConflictEvent;
import com.frontline.websocket.ConflictBroadcaster.EventType;
import com.frontline.websocket.ConflictBroadcaster.PresenceMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.messaging.SessionConnectEvent;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

import java.util.Optional;

/**
 * Keeps the observer registry in step with STOMP sessions. Clients identify themselves
 * with a {@value #PLAYER_HEADER} header on CONNECT.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PresenceEventListener {

    static final String PLAYER_HEADER = "playerId";

    private final ObserverRegistry observerRegistry;
    private final ConflictBroadcaster broadcaster;
    private final PlayerService playerService;
    private final ConflictTickScheduler tickScheduler;

    @EventListener
    public void handleConnect(SessionConnectEvent event) {
        StompHeaderAccessor accessor = StompHeaderAccessor.wrap(event.getMessage());
        String sessionId = accessor.getSessionId();
        String playerId = accessor.getFirstNativeHeader(PLAYER_HEADER);
        if (sessionId == null || playerId == null) {
            log.warn("Rejecting presence for session {} without a {} header", sessionId, PLAYER_HEADER);
            return;
        }
        Optional<Player> player = playerService.getPlayer(playerId);
        if (player.isEmpty()) {
            log.warn("Session {} connected for unknown player {}", sessionId, playerId);
            return;
        }

        observerRegistry.connect(sessionId, playerId);
        playerService.markOnline(playerId, true);
        String countryId = player.get().getCountryId();
        if (countryId != null) {
            observerRegistry.joinRoom(sessionId, countryId);
            broadcaster.broadcast(countryId, ConflictEvent.presence(EventType.PLAYER_CONNECTED,
                    new PresenceMessage(playerId, countryId)));
        }
        log.info("Player {} connected (session {})", playerId, sessionId);
    }

    @EventListener
    public void handleDisconnect(SessionDisconnectEvent event) {
        observerRegistry.disconnect(event.getSessionId()).ifPresent(session -> {
            if (observerRegistry.sessionsOfPlayer(session.playerId()).isEmpty()) {
                playerService.markOnline(session.playerId(), false);
            }
            if (session.countryId() != null) {
                broadcaster.broadcast(session.countryId(), ConflictEvent.presence(EventType.PLAYER_DISCONNECTED,
                        new PresenceMessage(session.playerId(), session.countryId())));
            }
            broadcaster.broadcastGlobal(ConflictEvent.serverStats(tickScheduler.currentStats()));
            log.info("Player {} disconnected (session {})", session.playerId(), session.sessionId());
        });
    }
}
