package com.frontline.service;

import com.frontline.dto.MembershipResult;
import com.frontline.model.Country;
import com.frontline.model.CountryHistoryEntry;
import com.frontline.model.GeoPoint;
import com.frontline.model.HistoryEventType;
import com.frontline.model.Player;
import com.frontline.support.ConflictFixture;
import com.frontline.websocket.ConflictBroadcaster.EventType;
import com.frontline.websocket.ConflictBroadcaster.MembershipMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;

/**
 * Unit tests for CountryService.
 */
class CountryServiceTest {

    private ConflictFixture fx;
    private CountryService countryService;

    @BeforeEach
    void setUp() {
        fx = new ConflictFixture();
        countryService = fx.countryService;
        fx.country("FR");
        fx.player("alice", null, 100);
        fx.player("bob", null, 100);
    }

    private Country country(String id) {
        return fx.countryRepository.findById(id).orElseThrow();
    }

    private Player player(String id) {
        return fx.playerRepository.findById(id).orElseThrow();
    }

    @Nested
    @DisplayName("joinCountry()")
    class JoinTests {

        @Test
        @DisplayName("the first soldier claims the country and becomes its owner")
        void firstSoldierClaims() {
            GeoPoint spawn = new GeoPoint(48.85, 2.35);

            OperationResult<MembershipResult> result = countryService.joinCountry("alice", "FR", spawn);

            assertTrue(result.isSuccess());
            assertTrue(result.getValue().isBecameOwner());
            Country fr = country("FR");
            assertTrue(fr.isClaimed());
            assertEquals("alice", fr.getOwnerId());
            assertEquals(1, fr.getSoldierCount());
            assertEquals(ConflictFixture.START, fr.getClaimedAt());
            assertEquals("FR", player("alice").getCountryId());
            assertEquals(spawn, player("alice").getPosition());
            verify(fx.broadcaster).broadcast(eq("FR"), argThat(e -> e.getType() == EventType.PLAYER_JOINED_COUNTRY
                    && ((MembershipMessage) e.getPayload()).isBecameOwner()));
        }

        @Test
        @DisplayName("later soldiers join without changing the owner")
        void laterSoldierJoins() {
            countryService.joinCountry("alice", "FR", null);

            MembershipResult result = countryService.joinCountry("bob", "FR", null).getValue();

            assertFalse(result.isBecameOwner());
            assertEquals(2, result.getCountry().getSoldierCount());
            assertEquals("alice", country("FR").getOwnerId());
        }

        @Test
        @DisplayName("a full country rejects new soldiers")
        void capacity() {
            fx.countryRepository.update("FR", c -> c.setMaxSoldiers(1));
            countryService.joinCountry("alice", "FR", null);

            OperationResult<MembershipResult> result = countryService.joinCountry("bob", "FR", null);

            assertEquals(ErrorKind.INVALID_STATE, result.getErrorKind());
            assertEquals(1, country("FR").getSoldierCount());
            assertNull(player("bob").getCountryId());
        }

        @Test
        @DisplayName("a player must leave before joining another country")
        void mustLeaveFirst() {
            fx.country("DE");
            countryService.joinCountry("alice", "FR", null);

            assertEquals(ErrorKind.CONFLICT, countryService.joinCountry("alice", "DE", null).getErrorKind());
            assertEquals(0, country("DE").getSoldierCount());
        }

        @Test
        @DisplayName("unknown players and countries are NOT_FOUND")
        void notFound() {
            assertEquals(ErrorKind.NOT_FOUND, countryService.joinCountry("ghost", "FR", null).getErrorKind());
            assertEquals(ErrorKind.NOT_FOUND, countryService.joinCountry("alice", "XX", null).getErrorKind());
        }

        @Test
        @DisplayName("open observer sessions follow the player into the country room")
        void movesSessionsIntoRoom() {
            fx.observerRegistry.connect("session-1", "alice");

            countryService.joinCountry("alice", "FR", null);

            assertEquals(Optional.of("FR"), fx.observerRegistry.roomOf("session-1"));
        }
    }

    @Nested
    @DisplayName("leaveCountry()")
    class LeaveTests {

        @BeforeEach
        void joinBoth() {
            countryService.joinCountry("alice", "FR", new GeoPoint(1, 1));
            countryService.joinCountry("bob", "FR", null);
        }

        @Test
        @DisplayName("the owner keeps ownership while soldiers remain")
        void ownerLeavesButCountryStaysClaimed() {
            MembershipResult result = countryService.leaveCountry("alice").getValue();

            assertTrue(result.isWasOwner());
            assertFalse(result.isCountryUnclaimed());
            assertTrue(country("FR").isClaimed());
            assertEquals(1, country("FR").getSoldierCount());
            assertNull(player("alice").getCountryId());
            assertNull(player("alice").getPosition());
        }

        @Test
        @DisplayName("the last soldier leaving unclaims the country")
        void lastSoldierUnclaims() {
            countryService.leaveCountry("alice");

            MembershipResult result = countryService.leaveCountry("bob").getValue();

            assertTrue(result.isCountryUnclaimed());
            Country fr = country("FR");
            assertFalse(fr.isClaimed());
            assertNull(fr.getOwnerId());
            assertEquals(0, fr.getSoldierCount());
            verify(fx.broadcaster).broadcast(eq("FR"), argThat(e -> e.getType() == EventType.PLAYER_LEFT_COUNTRY
                    && ((MembershipMessage) e.getPayload()).isCountryUnclaimed()));
        }

        @Test
        @DisplayName("the next soldier after unclaiming becomes the new owner")
        void reclaim() {
            countryService.leaveCountry("alice");
            countryService.leaveCountry("bob");

            assertTrue(countryService.joinCountry("bob", "FR", null).getValue().isBecameOwner());
            assertEquals("bob", country("FR").getOwnerId());
        }

        @Test
        @DisplayName("a stateless player cannot leave")
        void statelessCannotLeave() {
            countryService.leaveCountry("alice");

            assertEquals(ErrorKind.INVALID_STATE, countryService.leaveCountry("alice").getErrorKind());
        }

        @Test
        @DisplayName("observer sessions leave the room")
        void sessionsLeaveRoom() {
            fx.observerRegistry.connect("session-1", "bob");
            fx.observerRegistry.joinRoom("session-1", "FR");

            countryService.leaveCountry("bob");

            assertTrue(fx.observerRegistry.roomOf("session-1").isEmpty());
        }
    }

    @Nested
    @DisplayName("history and soldiers")
    class HistoryTests {

        @Test
        @DisplayName("membership changes are recorded in the country's timeline, newest first")
        void recordsMembershipTimeline() {
            countryService.joinCountry("alice", "FR", null);
            fx.clock.advanceSeconds(1);
            countryService.joinCountry("bob", "FR", null);
            fx.clock.advanceSeconds(1);
            countryService.leaveCountry("alice");
            fx.clock.advanceSeconds(1);
            countryService.leaveCountry("bob");

            List<CountryHistoryEntry> history = countryService.getHistory("FR", 50).getValue();

            assertEquals(List.of(HistoryEventType.UNCLAIMED, HistoryEventType.SOLDIER_LEFT,
                            HistoryEventType.SOLDIER_LEFT, HistoryEventType.SOLDIER_JOINED, HistoryEventType.CLAIMED),
                    history.stream().map(CountryHistoryEntry::getEventType).toList());
            assertEquals("alice", history.get(4).getPlayerId());
            assertEquals("bob", history.get(0).getPlayerId());
            assertEquals(2, countryService.getHistory("FR", 2).getValue().size());
        }

        @Test
        @DisplayName("history and soldiers of unknown countries are NOT_FOUND")
        void unknownCountry() {
            assertEquals(ErrorKind.NOT_FOUND, countryService.getHistory("XX", 10).getErrorKind());
            assertEquals(ErrorKind.NOT_FOUND, countryService.findSoldiers("XX").getErrorKind());
        }

        @Test
        @DisplayName("soldiers are listed online first, then by username")
        void listsSoldiers() {
            fx.player("carol", null, 100);
            countryService.joinCountry("bob", "FR", null);
            countryService.joinCountry("alice", "FR", null);
            countryService.joinCountry("carol", "FR", null);
            fx.playerRepository.update("carol", p -> p.setOnline(true));

            List<Player> soldiers = countryService.findSoldiers("FR").getValue();

            assertEquals(List.of("carol", "alice", "bob"), soldiers.stream().map(Player::getId).toList());
        }
    }

    @Test
    @DisplayName("findCountries sorts by name and can filter to claimed countries")
    void findCountries() {
        fx.countryRepository.save(Country.builder().id("AT").name("Austria").build());
        fx.countryRepository.update("FR", c -> c.setName("France"));
        countryService.joinCountry("alice", "FR", null);

        List<Country> all = countryService.findCountries(false);
        List<Country> claimed = countryService.findCountries(true);

        assertEquals(List.of("Austria", "France"), all.stream().map(Country::getName).toList());
        assertEquals(List.of("FR"), claimed.stream().map(Country::getId).toList());
        assertTrue(countryService.getCountry("AT").isPresent());
    }
}
