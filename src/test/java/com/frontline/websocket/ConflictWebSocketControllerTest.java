package com.frontline.websocket;

import com.frontline.dto.PushProgress;
import com.frontline.model.MovementType;
import com.frontline.model.Player;
import com.frontline.model.PushStatus;
import com.frontline.service.BorderPushService;
import com.frontline.service.ErrorKind;
import com.frontline.service.OperationResult;
import com.frontline.service.PlayerService;
import com.frontline.websocket.ConflictBroadcaster.ConflictEvent;
import com.frontline.websocket.ConflictBroadcaster.EventType;
import com.frontline.websocket.ConflictWebSocketController.MoveMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for ConflictWebSocketController message handlers.
 */
@ExtendWith(MockitoExtension.class)
class ConflictWebSocketControllerTest {

    @Mock private PlayerService playerService;
    @Mock private BorderPushService borderPushService;
    @Mock private ObserverRegistry observerRegistry;
    @Mock private ConflictBroadcaster broadcaster;

    private ConflictWebSocketController controller;
    private SimpMessageHeaderAccessor headers;

    @BeforeEach
    void setUp() {
        controller = new ConflictWebSocketController(playerService, borderPushService, observerRegistry, broadcaster);
        headers = SimpMessageHeaderAccessor.create();
        headers.setSessionId("session-1");
    }

    @Nested
    @DisplayName("handleMove")
    class MoveTests {

        @Test
        @DisplayName("should move the player bound to the session")
        void shouldMove() {
            when(observerRegistry.playerOf("session-1")).thenReturn(Optional.of("alice"));
            when(playerService.move("alice", 48.0, 2.0, MovementType.RUN))
                    .thenReturn(OperationResult.ok(Player.builder().id("alice").build()));

            controller.handleMove(new MoveMessage(48.0, 2.0, MovementType.RUN), headers);

            verify(playerService).move("alice", 48.0, 2.0, MovementType.RUN);
            verify(broadcaster, never()).sendError(any(), any(), any());
        }

        @Test
        @DisplayName("should reject sessions without a player")
        void shouldRejectUnboundSession() {
            when(observerRegistry.playerOf("session-1")).thenReturn(Optional.empty());

            controller.handleMove(new MoveMessage(48.0, 2.0, null), headers);

            verify(broadcaster).sendError(eq("session-1"), eq("UNAUTHENTICATED"), anyString());
            verifyNoInteractions(playerService);
        }

        @Test
        @DisplayName("should reject coordinates off the globe")
        void shouldRejectInvalidCoordinates() {
            when(observerRegistry.playerOf("session-1")).thenReturn(Optional.of("alice"));

            controller.handleMove(new MoveMessage(91.0, 2.0, null), headers);

            verify(broadcaster).sendError(eq("session-1"), eq("INVALID_COORDINATES"), anyString());
            verifyNoInteractions(playerService);
        }

        @Test
        @DisplayName("should report rule failures to the session")
        void shouldReportFailure() {
            when(observerRegistry.playerOf("session-1")).thenReturn(Optional.of("alice"));
            when(playerService.move(anyString(), anyDouble(), anyDouble(), any()))
                    .thenReturn(OperationResult.cooldown("Movement is on cooldown", 400));

            controller.handleMove(new MoveMessage(48.0, 2.0, null), headers);

            verify(broadcaster).sendError("session-1", "COOLDOWN", "Movement is on cooldown");
        }

        @Test
        @DisplayName("should report unexpected errors without rethrowing")
        void shouldHandleUnexpectedError() {
            when(observerRegistry.playerOf("session-1")).thenReturn(Optional.of("alice"));
            when(playerService.move(anyString(), anyDouble(), anyDouble(), any()))
                    .thenThrow(new IllegalStateException("boom"));

            assertDoesNotThrow(() -> controller.handleMove(new MoveMessage(48.0, 2.0, null), headers));

            verify(broadcaster).sendError("session-1", "INTERNAL_ERROR", "Failed to update position");
        }
    }

    @Nested
    @DisplayName("handleProgress")
    class ProgressTests {

        @Test
        @DisplayName("should send the current progress to the requesting session only")
        void shouldSendProgress() {
            PushProgress progress = PushProgress.builder()
                    .pushId("push-1").status(PushStatus.ACTIVE).candidateDistance(42.0).build();
            when(borderPushService.peekProgress("push-1")).thenReturn(OperationResult.ok(progress));

            controller.handleProgress("push-1", headers);

            ArgumentCaptor<ConflictEvent> event = ArgumentCaptor.forClass(ConflictEvent.class);
            verify(broadcaster).sendToSession(eq("session-1"), event.capture());
            assertEquals(EventType.PUSH_PROGRESS, event.getValue().getType());
            assertSame(progress, event.getValue().getPayload());
            verify(broadcaster, never()).broadcast(any(), any());
        }

        @Test
        @DisplayName("should report unknown pushes")
        void shouldReportUnknownPush() {
            when(borderPushService.peekProgress("missing"))
                    .thenReturn(OperationResult.failure(ErrorKind.NOT_FOUND, "Border push not found: missing"));

            controller.handleProgress("missing", headers);

            verify(broadcaster).sendError("session-1", "NOT_FOUND", "Border push not found: missing");
        }
    }

    @Test
    @DisplayName("handlePing should answer with PONG")
    void shouldPong() {
        controller.handlePing(headers);

        verify(broadcaster).sendToSession(eq("session-1"), argThat(e -> e.getType() == EventType.PONG));
    }
}
