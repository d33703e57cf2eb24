package com.frontline.websocket;

import com.frontline.dto.PushProgress;
import com.frontline.model.MovementType;
import com.frontline.service.BorderPushService;
import com.frontline.service.OperationResult;
import com.frontline.service.PlayerService;
import com.frontline.websocket.ConflictBroadcaster.ConflictEvent;
import lombok.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.handler.annotation.*;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.stereotype.Controller;

import java.util.Optional;

/**
 * WebSocket controller for real-time player actions. The acting player is the one bound
 * to the STOMP session at CONNECT.
 */
@Controller
@RequiredArgsConstructor
@Slf4j
public class ConflictWebSocketController {

    private final PlayerService playerService;
    private final BorderPushService borderPushService;
    private final ObserverRegistry observerRegistry;
    private final ConflictBroadcaster broadcaster;

    /**
     * Handle a movement update.
     */
    @MessageMapping("/player/move")
    public void handleMove(@Payload MoveMessage message, SimpMessageHeaderAccessor headerAccessor) {
        String sessionId = headerAccessor.getSessionId();
        Optional<String> playerId = observerRegistry.playerOf(sessionId);
        if (playerId.isEmpty()) {
            sendError(sessionId, "UNAUTHENTICATED", "Session is not bound to a player");
            return;
        }
        if (!validCoordinates(message.getLat(), message.getLng())) {
            sendError(sessionId, "INVALID_COORDINATES", "Latitude must be within [-90, 90] and longitude within [-180, 180]");
            return;
        }
        log.debug("Move request from player {} to ({}, {})", playerId.get(), message.getLat(), message.getLng());

        try {
            OperationResult<?> result = playerService.move(playerId.get(), message.getLat(), message.getLng(),
                    message.getMovementType());
            if (!result.isSuccess()) {
                sendError(sessionId, result.getErrorKind().name(), result.getMessage());
            }
        } catch (RuntimeException e) {
            log.error("Error processing move", e);
            sendError(sessionId, "INTERNAL_ERROR", "Failed to update position");
        }
    }

    /**
     * Reply to the requesting session with the push's current progress.
     */
    @MessageMapping("/push/{pushId}/progress")
    public void handleProgress(@DestinationVariable String pushId, SimpMessageHeaderAccessor headerAccessor) {
        String sessionId = headerAccessor.getSessionId();
        OperationResult<PushProgress> progress = borderPushService.peekProgress(pushId);
        if (!progress.isSuccess()) {
            sendError(sessionId, progress.getErrorKind().name(), progress.getMessage());
            return;
        }
        broadcaster.sendToSession(sessionId, ConflictEvent.progress(progress.getValue()));
    }

    @MessageMapping("/ping")
    public void handlePing(SimpMessageHeaderAccessor headerAccessor) {
        broadcaster.sendToSession(headerAccessor.getSessionId(), ConflictEvent.pong());
    }

    private void sendError(String sessionId, String error, String message) {
        broadcaster.sendError(sessionId, error, message);
    }

    private static boolean validCoordinates(double lat, double lng) {
        return lat >= -90 && lat <= 90 && lng >= -180 && lng <= 180;
    }

    // Message DTOs
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MoveMessage {
        private double lat;
        private double lng;
        private MovementType movementType;
    }
}
