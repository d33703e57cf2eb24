package com.frontline.service;

import com.frontline.dto.CountryDTO;
import com.frontline.dto.MembershipResult;
import com.frontline.model.Country;
import com.frontline.model.CountryHistoryEntry;
import com.frontline.model.GeoPoint;
import com.frontline.model.Player;
import com.frontline.repository.CountryRepository;
import com.frontline.repository.PlayerRepository;
import com.frontline.websocket.ConflictBroadcaster;
import com.frontline.websocket.ConflictBroadcaster.ConflictEvent;
import com.frontline.websocket.ConflictBroadcaster.EventType;
import com.frontline.websocket.ConflictBroadcaster.MembershipMessage;
import com.frontline.websocket.ObserverRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Service for country membership: joining, leaving and the claim lifecycle.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CountryService {

    private final CountryRepository countryRepository;
    private final PlayerRepository playerRepository;
    private final EntityLockRegistry lockRegistry;
    private final ObserverRegistry observerRegistry;
    private final ConflictBroadcaster broadcaster;
    private final CountryHistoryService historyService;
    private final Clock clock;

    /**
     * Join a country as a soldier. The first soldier of an unclaimed country becomes its owner.
     */
    public OperationResult<MembershipResult> joinCountry(String playerId, String countryId, GeoPoint spawn) {
        OperationResult<MembershipResult> joined = lockRegistry.withLock(EntityLockRegistry.PLAYER + playerId, () -> {
            Optional<Player> player = playerRepository.findById(playerId);
            if (player.isEmpty()) {
                return OperationResult.failure(ErrorKind.NOT_FOUND, "Player not found: " + playerId);
            }
            if (!countryRepository.existsById(countryId)) {
                return OperationResult.failure(ErrorKind.NOT_FOUND, "Country not found: " + countryId);
            }
            if (player.get().getCountryId() != null) {
                return OperationResult.failure(ErrorKind.CONFLICT,
                        "You must leave your current country before joining another");
            }
            return lockRegistry.withLock(EntityLockRegistry.COUNTRY + countryId, () -> {
                Country country = countryRepository.findById(countryId).orElseThrow();
                if (!country.canAcceptNewSoldier()) {
                    return OperationResult.failure(ErrorKind.INVALID_STATE, "Country has reached maximum soldier capacity");
                }
                Instant now = clock.instant();
                boolean becameOwner = !country.isClaimed();
                Country updated = countryRepository.update(countryId, c -> {
                    if (becameOwner) {
                        c.claim(playerId, now);
                    } else {
                        c.addSoldier(now);
                    }
                }).orElseThrow();
                playerRepository.update(playerId, p -> {
                    p.setCountryId(countryId);
                    if (spawn != null) {
                        p.setPosition(spawn);
                    }
                });
                return OperationResult.ok(MembershipResult.builder()
                        .country(CountryDTO.fromCountry(updated))
                        .becameOwner(becameOwner)
                        .build());
            });
        });

        if (joined.isSuccess()) {
            MembershipResult result = joined.getValue();
            log.info("Player {} joined country {}{}", playerId, countryId, result.isBecameOwner() ? " as owner" : "");
            if (result.isBecameOwner()) {
                historyService.recordClaimed(countryId, playerId);
            } else {
                historyService.recordSoldierJoined(countryId, playerId);
            }
            observerRegistry.movePlayer(playerId, countryId);
            broadcaster.broadcast(countryId, ConflictEvent.membership(EventType.PLAYER_JOINED_COUNTRY,
                    MembershipMessage.builder()
                            .playerId(playerId)
                            .countryId(countryId)
                            .soldierCount(result.getCountry().getSoldierCount())
                            .becameOwner(result.isBecameOwner())
                            .build()));
        }
        return joined;
    }

    /**
     * Leave the player's current country. Ownership stays with the owner until the last
     * soldier leaves, at which point the country is unclaimed.
     */
    public OperationResult<MembershipResult> leaveCountry(String playerId) {
        OperationResult<MembershipResult> left = lockRegistry.withLock(EntityLockRegistry.PLAYER + playerId, () -> {
            Optional<Player> player = playerRepository.findById(playerId);
            if (player.isEmpty()) {
                return OperationResult.failure(ErrorKind.NOT_FOUND, "Player not found: " + playerId);
            }
            String countryId = player.get().getCountryId();
            if (countryId == null) {
                return OperationResult.failure(ErrorKind.INVALID_STATE, "You are not a member of any country");
            }
            return lockRegistry.withLock(EntityLockRegistry.COUNTRY + countryId, () -> {
                Optional<Country> country = countryRepository.findById(countryId);
                if (country.isEmpty()) {
                    return OperationResult.failure(ErrorKind.NOT_FOUND, "Country not found: " + countryId);
                }
                boolean wasOwner = country.get().isOwnedBy(playerId);
                Instant now = clock.instant();
                Country updated = countryRepository.update(countryId, c -> c.removeSoldier(now)).orElseThrow();
                playerRepository.update(playerId, p -> {
                    p.setCountryId(null);
                    p.setPosition(null);
                });
                return OperationResult.ok(MembershipResult.builder()
                        .country(CountryDTO.fromCountry(updated))
                        .wasOwner(wasOwner)
                        .countryUnclaimed(!updated.isClaimed())
                        .build());
            });
        });

        if (left.isSuccess()) {
            MembershipResult result = left.getValue();
            String countryId = result.getCountry().getId();
            log.info("Player {} left country {}{}", playerId, countryId,
                    result.isCountryUnclaimed() ? "; country is unclaimed again" : "");
            historyService.recordSoldierLeft(countryId, playerId);
            if (result.isCountryUnclaimed()) {
                historyService.recordUnclaimed(countryId, playerId);
            }
            observerRegistry.movePlayer(playerId, null);
            broadcaster.broadcast(countryId, ConflictEvent.membership(EventType.PLAYER_LEFT_COUNTRY,
                    MembershipMessage.builder()
                            .playerId(playerId)
                            .countryId(countryId)
                            .soldierCount(result.getCountry().getSoldierCount())
                            .wasOwner(result.isWasOwner())
                            .countryUnclaimed(result.isCountryUnclaimed())
                            .build()));
        }
        return left;
    }

    public Optional<Country> getCountry(String countryId) {
        return countryRepository.findById(countryId);
    }

    /**
     * Soldiers of a country, online players first, then by username.
     */
    public OperationResult<List<Player>> findSoldiers(String countryId) {
        if (!countryRepository.existsById(countryId)) {
            return OperationResult.failure(ErrorKind.NOT_FOUND, "Country not found: " + countryId);
        }
        return OperationResult.ok(playerRepository.findByCountryId(countryId).stream()
                .sorted(Comparator.comparing(Player::isOnline).reversed()
                        .thenComparing(Player::getUsername, Comparator.nullsLast(String.CASE_INSENSITIVE_ORDER)))
                .toList());
    }

    /**
     * The country's timeline, newest first.
     */
    public OperationResult<List<CountryHistoryEntry>> getHistory(String countryId, int limit) {
        if (!countryRepository.existsById(countryId)) {
            return OperationResult.failure(ErrorKind.NOT_FOUND, "Country not found: " + countryId);
        }
        return OperationResult.ok(historyService.timeline(countryId, limit));
    }

    /**
     * Countries sorted by name, optionally only the claimed ones.
     */
    public List<Country> findCountries(boolean claimedOnly) {
        List<Country> countries = claimedOnly ? countryRepository.findByClaimed(true) : countryRepository.findAll();
        return countries.stream()
                .sorted(Comparator.comparing(Country::getName, Comparator.nullsLast(Comparator.naturalOrder())))
                .toList();
    }
}
