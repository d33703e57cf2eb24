package com.frontline.websocket;

import com.frontline.dto.BorderPushDTO;
import com.frontline.dto.PlayerDTO;
import com.frontline.dto.PushProgress;
import com.frontline.dto.ServerStatsDTO;
import com.frontline.dto.WarDTO;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.messaging.MessageHeaders;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.SimpMessageType;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

import java.util.Collection;

/**
 * Fan-out of conflict events to observer sessions.
 * <p>
 * Delivery is per session on {@value #USER_QUEUE}, best-effort, and runs on the
 * broadcast executor so callers (request threads, ticks) never wait on a slow observer.
 */
@Component
@Slf4j
public class ConflictBroadcaster {

    static final String USER_QUEUE = "/queue/events";

    private final SimpMessagingTemplate messagingTemplate;
    private final ObserverRegistry observerRegistry;
    private final TaskExecutor broadcastExecutor;

    public ConflictBroadcaster(SimpMessagingTemplate messagingTemplate,
                               ObserverRegistry observerRegistry,
                               @Qualifier("broadcastExecutor") TaskExecutor broadcastExecutor) {
        this.messagingTemplate = messagingTemplate;
        this.observerRegistry = observerRegistry;
        this.broadcastExecutor = broadcastExecutor;
    }

    /**
     * Deliver to every session currently in the country's room.
     */
    public void broadcast(String countryId, ConflictEvent event) {
        deliverAll(observerRegistry.membersOf(countryId), event);
        log.debug("Broadcast {} to room {}", event.getType(), countryId);
    }

    public void broadcastGlobal(ConflictEvent event) {
        deliverAll(observerRegistry.allSessions(), event);
        log.debug("Broadcast {} globally", event.getType());
    }

    public void sendToSession(String sessionId, ConflictEvent event) {
        deliver(sessionId, event);
    }

    public void sendError(String sessionId, String error, String message) {
        log.warn("Error for session {}: {}", sessionId, message);
        deliver(sessionId, ConflictEvent.error(new ErrorMessage(error, message)));
    }

    private void deliverAll(Collection<String> sessionIds, ConflictEvent event) {
        for (String sessionId : sessionIds) {
            deliver(sessionId, event);
        }
    }

    private void deliver(String sessionId, ConflictEvent event) {
        broadcastExecutor.execute(() -> {
            try {
                messagingTemplate.convertAndSendToUser(sessionId, USER_QUEUE, event, headersFor(sessionId));
            } catch (RuntimeException e) {
                log.error("Error delivering {} to session {}", event.getType(), sessionId, e);
            }
        });
    }

    private static MessageHeaders headersFor(String sessionId) {
        SimpMessageHeaderAccessor accessor = SimpMessageHeaderAccessor.create(SimpMessageType.MESSAGE);
        accessor.setSessionId(sessionId);
        accessor.setLeaveMutable(true);
        return accessor.getMessageHeaders();
    }

    public enum EventType {
        WAR_DECLARED,
        WAR_ENDED,
        PUSH_STARTED,
        PUSH_INCOMING,
        PUSH_PROGRESS,
        SUPPORT_ADDED,
        DEFENSE_ADDED,
        PUSH_COMPLETED,
        PUSH_LOST,
        PUSH_CANCELLED,
        RESOURCES_GENERATED,
        SERVER_STATS,
        PLAYER_CONNECTED,
        PLAYER_DISCONNECTED,
        PLAYER_JOINED_COUNTRY,
        PLAYER_LEFT_COUNTRY,
        PLAYER_MOVED,
        PONG,
        ERROR
    }

    /**
     * Generic conflict event wrapper.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class ConflictEvent {
        private EventType type;
        private Object payload;
        private long timestamp;

        public static ConflictEvent of(EventType type, Object payload) {
            return ConflictEvent.builder()
                    .type(type)
                    .payload(payload)
                    .timestamp(System.currentTimeMillis())
                    .build();
        }

        public static ConflictEvent warDeclared(WarDTO war) {
            return of(EventType.WAR_DECLARED, war);
        }

        public static ConflictEvent warEnded(WarDTO war) {
            return of(EventType.WAR_ENDED, war);
        }

        public static ConflictEvent push(EventType type, BorderPushDTO push) {
            return of(type, push);
        }

        public static ConflictEvent progress(PushProgress progress) {
            return of(EventType.PUSH_PROGRESS, progress);
        }

        public static ConflictEvent resourcesGenerated(ResourcesGeneratedMessage message) {
            return of(EventType.RESOURCES_GENERATED, message);
        }

        public static ConflictEvent serverStats(ServerStatsDTO stats) {
            return of(EventType.SERVER_STATS, stats);
        }

        public static ConflictEvent presence(EventType type, PresenceMessage message) {
            return of(type, message);
        }

        public static ConflictEvent membership(EventType type, MembershipMessage message) {
            return of(type, message);
        }

        public static ConflictEvent playerMoved(PlayerDTO player) {
            return of(EventType.PLAYER_MOVED, player);
        }

        public static ConflictEvent pong() {
            return of(EventType.PONG, null);
        }

        public static ConflictEvent error(ErrorMessage error) {
            return of(EventType.ERROR, error);
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ResourcesGeneratedMessage {
        private String countryId;
        private int amount;
        private int total;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PresenceMessage {
        private String playerId;
        private String countryId;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class MembershipMessage {
        private String playerId;
        private String countryId;
        private int soldierCount;
        private boolean becameOwner;
        private boolean wasOwner;
        private boolean countryUnclaimed;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ErrorMessage {
        private String error;
        private String message;
    }
}
