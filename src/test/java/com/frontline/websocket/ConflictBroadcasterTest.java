package com.frontline.websocket;

import com.frontline.websocket.ConflictBroadcaster.ConflictEvent;
import com.frontline.websocket.ConflictBroadcaster.ErrorMessage;
import com.frontline.websocket.ConflictBroadcaster.EventType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.messaging.MessageDeliveryException;
import org.springframework.messaging.MessageHeaders;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for ConflictBroadcaster.
 */
@ExtendWith(MockitoExtension.class)
class ConflictBroadcasterTest {

    @Mock private SimpMessagingTemplate messagingTemplate;

    private ObserverRegistry observerRegistry;
    private ConflictBroadcaster broadcaster;

    @BeforeEach
    void setUp() {
        observerRegistry = new ObserverRegistry();
        broadcaster = new ConflictBroadcaster(messagingTemplate, observerRegistry, new SyncTaskExecutor());

        observerRegistry.connect("s-fr-1", "alice");
        observerRegistry.joinRoom("s-fr-1", "FR");
        observerRegistry.connect("s-fr-2", "erin");
        observerRegistry.joinRoom("s-fr-2", "FR");
        observerRegistry.connect("s-de", "bob");
        observerRegistry.joinRoom("s-de", "DE");
        observerRegistry.connect("s-lobby", "carol");
    }

    @Nested
    @DisplayName("broadcast()")
    class RoomBroadcastTests {

        @Test
        @DisplayName("should deliver only to sessions in the country room")
        void shouldDeliverToRoomMembers() {
            ConflictEvent event = ConflictEvent.pong();

            broadcaster.broadcast("FR", event);

            verify(messagingTemplate).convertAndSendToUser(eq("s-fr-1"), eq("/queue/events"), eq(event), any(MessageHeaders.class));
            verify(messagingTemplate).convertAndSendToUser(eq("s-fr-2"), eq("/queue/events"), eq(event), any(MessageHeaders.class));
            verifyNoMoreInteractions(messagingTemplate);
        }

        @Test
        @DisplayName("an empty room delivers nothing")
        void emptyRoom() {
            broadcaster.broadcast("JP", ConflictEvent.pong());

            verifyNoInteractions(messagingTemplate);
        }

        @Test
        @DisplayName("headers address the target session")
        void headersCarrySessionId() {
            broadcaster.broadcast("DE", ConflictEvent.pong());

            ArgumentCaptor<MessageHeaders> headers = ArgumentCaptor.forClass(MessageHeaders.class);
            verify(messagingTemplate).convertAndSendToUser(eq("s-de"), anyString(), any(), headers.capture());
            assertEquals("s-de", SimpMessageHeaderAccessor.getSessionId(headers.getValue()));
        }

        @Test
        @DisplayName("a failing session does not stop delivery to the others")
        void failingSessionIsIsolated() {
            lenient().doThrow(new MessageDeliveryException("socket closed"))
                    .when(messagingTemplate).convertAndSendToUser(eq("s-fr-1"), anyString(), any(), any(MessageHeaders.class));

            assertDoesNotThrow(() -> broadcaster.broadcast("FR", ConflictEvent.pong()));

            verify(messagingTemplate).convertAndSendToUser(eq("s-fr-2"), anyString(), any(), any(MessageHeaders.class));
        }
    }

    @Test
    @DisplayName("broadcastGlobal reaches every connected session, including those outside rooms")
    void globalReachesEveryone() {
        broadcaster.broadcastGlobal(ConflictEvent.pong());

        verify(messagingTemplate, times(4)).convertAndSendToUser(anyString(), eq("/queue/events"), any(), any(MessageHeaders.class));
        verify(messagingTemplate).convertAndSendToUser(eq("s-lobby"), anyString(), any(), any(MessageHeaders.class));
    }

    @Test
    @DisplayName("sendError wraps the error in an ERROR event for one session")
    void sendError() {
        broadcaster.sendError("s-de", "COOLDOWN", "Movement is on cooldown");

        ArgumentCaptor<Object> payload = ArgumentCaptor.forClass(Object.class);
        verify(messagingTemplate).convertAndSendToUser(eq("s-de"), eq("/queue/events"), payload.capture(), any(MessageHeaders.class));

        ConflictEvent event = (ConflictEvent) payload.getValue();
        assertEquals(EventType.ERROR, event.getType());
        assertTrue(event.getTimestamp() > 0);
        ErrorMessage error = (ErrorMessage) event.getPayload();
        assertEquals("COOLDOWN", error.getError());
        assertEquals("Movement is on cooldown", error.getMessage());
    }
}
