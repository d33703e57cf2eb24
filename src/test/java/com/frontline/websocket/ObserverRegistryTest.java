package com.frontline.websocket;

import com.frontline.websocket.ObserverRegistry.DisconnectedSession;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ObserverRegistryTest {

    private ObserverRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ObserverRegistry();
    }

    @Test
    @DisplayName("a session sits in at most one room")
    void oneRoomPerSession() {
        registry.connect("s1", "alice");
        registry.joinRoom("s1", "FR");

        registry.joinRoom("s1", "DE");

        assertEquals(Set.of(), registry.membersOf("FR"));
        assertEquals(Set.of("s1"), registry.membersOf("DE"));
        assertEquals(Optional.of("DE"), registry.roomOf("s1"));
        assertEquals(1, registry.activeRoomCount());
    }

    @Test
    @DisplayName("movePlayer moves every session of the player")
    void movePlayer() {
        registry.connect("s1", "alice");
        registry.connect("s2", "alice");
        registry.connect("s3", "bob");

        registry.movePlayer("alice", "FR");

        assertEquals(Set.of("s1", "s2"), registry.membersOf("FR"));
        assertTrue(registry.roomOf("s3").isEmpty());

        registry.movePlayer("alice", null);

        assertEquals(Set.of(), registry.membersOf("FR"));
        assertEquals(0, registry.activeRoomCount());
    }

    @Test
    @DisplayName("disconnect reports the player and room the session was attached to")
    void disconnect() {
        registry.connect("s1", "alice");
        registry.joinRoom("s1", "FR");

        Optional<DisconnectedSession> session = registry.disconnect("s1");

        assertEquals(Optional.of(new DisconnectedSession("s1", "alice", "FR")), session);
        assertEquals(0, registry.connectedCount());
        assertTrue(registry.playerOf("s1").isEmpty());
        assertEquals(Set.of(), registry.membersOf("FR"));
        assertTrue(registry.disconnect("s1").isEmpty());
    }

    @Test
    @DisplayName("membersOf returns a snapshot")
    void membersSnapshot() {
        registry.connect("s1", "alice");
        registry.joinRoom("s1", "FR");

        Set<String> members = registry.membersOf("FR");
        registry.leaveRoom("s1");

        assertEquals(Set.of("s1"), members);
        assertThrows(UnsupportedOperationException.class, () -> members.add("s2"));
    }

    @Test
    @DisplayName("allSessions and sessionsOfPlayer track connections")
    void sessionQueries() {
        registry.connect("s1", "alice");
        registry.connect("s2", "bob");
        registry.connect("s3", "alice");

        assertEquals(Set.of("s1", "s2", "s3"), registry.allSessions());
        assertEquals(Set.of("s1", "s3"), Set.copyOf(registry.sessionsOfPlayer("alice")));

        registry.clear();

        assertEquals(0, registry.connectedCount());
    }
}
