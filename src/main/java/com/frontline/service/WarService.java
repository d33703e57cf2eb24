package com.frontline.service;

import com.frontline.dto.WarDTO;
import com.frontline.model.BorderPush;
import com.frontline.model.Country;
import com.frontline.model.Player;
import com.frontline.model.PushStatus;
import com.frontline.model.War;
import com.frontline.model.WarStatus;
import com.frontline.repository.BorderPushRepository;
import com.frontline.repository.CountryRepository;
import com.frontline.repository.PlayerRepository;
import com.frontline.repository.WarRepository;
import com.frontline.websocket.ConflictBroadcaster;
import com.frontline.websocket.ConflictBroadcaster.ConflictEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Service for declaring and ending wars.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WarService {

    private final WarRepository warRepository;
    private final CountryRepository countryRepository;
    private final PlayerRepository playerRepository;
    private final BorderPushRepository pushRepository;
    private final BorderPushService borderPushService;
    private final EntityLockRegistry lockRegistry;
    private final ConflictBroadcaster broadcaster;
    private final CountryHistoryService historyService;
    private final Clock clock;

    @Value("${game.war.declaration-cooldown-ms:300000}")
    private long declarationCooldownMs;

    /**
     * Declare war from {@code aggressorCountryId} on {@code targetCountryId}. A null
     * aggressor means the declarer's own country.
     */
    public OperationResult<War> declareWar(String declarerId, String aggressorCountryId,
                                           String targetCountryId, String reason) {
        OperationResult<War> declared = lockRegistry.withLock(EntityLockRegistry.PLAYER + declarerId, () -> {
            Optional<Player> declarer = playerRepository.findById(declarerId);
            if (declarer.isEmpty()) {
                return OperationResult.failure(ErrorKind.NOT_FOUND, "Player not found: " + declarerId);
            }
            String sourceId = aggressorCountryId != null ? aggressorCountryId : declarer.get().getCountryId();
            if (sourceId == null) {
                return OperationResult.failure(ErrorKind.FORBIDDEN, "You must own a country to declare war");
            }
            Optional<Country> source = countryRepository.findById(sourceId);
            if (source.isEmpty()) {
                return OperationResult.failure(ErrorKind.NOT_FOUND, "Country not found: " + sourceId);
            }
            if (!source.get().isOwnedBy(declarerId)) {
                return OperationResult.failure(ErrorKind.FORBIDDEN, "Only country owners can declare war");
            }
            Optional<Country> target = countryRepository.findById(targetCountryId);
            if (target.isEmpty()) {
                return OperationResult.failure(ErrorKind.NOT_FOUND, "Target country not found: " + targetCountryId);
            }
            if (!target.get().isClaimed()) {
                return OperationResult.failure(ErrorKind.INVALID_TARGET, "Cannot declare war on unclaimed countries");
            }
            if (sourceId.equals(targetCountryId)) {
                return OperationResult.failure(ErrorKind.INVALID_TARGET, "Cannot declare war on your own country");
            }

            String pairKey = War.pairKey(sourceId, targetCountryId);
            return lockRegistry.withLock(EntityLockRegistry.PAIR + pairKey, () -> {
                if (warRepository.findActiveBetween(sourceId, targetCountryId).isPresent()) {
                    return OperationResult.failure(ErrorKind.CONFLICT, "War already exists between these countries");
                }
                Instant now = clock.instant();
                Instant lastDeclared = declarer.get().getLastWarDeclaredAt();
                if (lastDeclared != null) {
                    long elapsed = Duration.between(lastDeclared, now).toMillis();
                    if (elapsed < declarationCooldownMs) {
                        return OperationResult.cooldown("War declaration is on cooldown", declarationCooldownMs - elapsed);
                    }
                }
                War war = War.builder()
                        .id(UUID.randomUUID().toString())
                        .aggressorCountryId(sourceId)
                        .defenderCountryId(targetCountryId)
                        .declaredBy(declarerId)
                        .declaredAt(now)
                        .reason(reason != null && !reason.isBlank()
                                ? reason
                                : "War declared by " + declarer.get().getUsername())
                        .build();
                warRepository.save(war);
                playerRepository.update(declarerId, p -> {
                    p.setLastWarDeclaredAt(now);
                    p.setWarsDeclared(p.getWarsDeclared() + 1);
                });
                updateCountry(sourceId, Country::enterWar);
                updateCountry(targetCountryId, Country::enterWar);
                return OperationResult.ok(war);
            });
        });

        if (declared.isSuccess()) {
            War war = declared.getValue();
            log.info("War {} declared by {}: {} -> {}", war.getId(), declarerId,
                    war.getAggressorCountryId(), war.getDefenderCountryId());
            historyService.recordWarDeclared(war.getAggressorCountryId(), war.getId(), declarerId,
                    war.getDefenderCountryId());
            broadcaster.broadcastGlobal(ConflictEvent.warDeclared(WarDTO.fromWar(war)));
        }
        return declared;
    }

    /**
     * End an active war. Only the declaring player may end it; the winner is optional.
     */
    public OperationResult<War> endWar(String warId, String requestorId, String winnerCountryId) {
        OperationResult<War> ended = lockRegistry.withLock(EntityLockRegistry.WAR + warId, () -> {
            Optional<War> found = warRepository.findById(warId);
            if (found.isEmpty()) {
                return OperationResult.failure(ErrorKind.NOT_FOUND, "War not found: " + warId);
            }
            War war = found.get();
            if (!war.isActive()) {
                return OperationResult.failure(ErrorKind.INVALID_STATE, "War is not active");
            }
            if (!war.getDeclaredBy().equals(requestorId)) {
                return OperationResult.failure(ErrorKind.FORBIDDEN, "Only the declaring player can end this war");
            }
            if (winnerCountryId != null && !war.involves(winnerCountryId)) {
                return OperationResult.failure(ErrorKind.INVALID_TARGET, "Winner must be one of the belligerents");
            }
            Instant now = clock.instant();
            War updated = warRepository.update(warId, w -> {
                w.setStatus(WarStatus.ENDED);
                w.setEndedAt(now);
                w.setEndedBy(requestorId);
                w.setWinnerCountryId(winnerCountryId);
                w.setDurationMinutes(w.minutesSinceDeclared(now));
            }).orElseThrow(() -> new IllegalStateException("War vanished while ending: " + warId));
            return OperationResult.ok(updated);
        });

        if (!ended.isSuccess()) {
            return ended;
        }

        War war = ended.getValue();
        updateCountry(war.getAggressorCountryId(), Country::leaveWar);
        updateCountry(war.getDefenderCountryId(), Country::leaveWar);
        if (war.getWinnerCountryId() != null) {
            String loserId = war.opponentOf(war.getWinnerCountryId());
            updateCountry(war.getWinnerCountryId(), c -> c.setWarsWon(c.getWarsWon() + 1));
            updateCountry(loserId, c -> c.setWarsLost(c.getWarsLost() + 1));
        }

        cancelActivePushes(warId);
        historyService.recordWarEnded(war.getAggressorCountryId(), warId, war.getDefenderCountryId(),
                war.getWinnerCountryId());
        historyService.recordWarEnded(war.getDefenderCountryId(), warId, war.getAggressorCountryId(),
                war.getWinnerCountryId());

        log.info("War {} ended by {} (winner: {})", warId, requestorId,
                war.getWinnerCountryId() != null ? war.getWinnerCountryId() : "none");
        War latest = warRepository.findById(warId).orElse(war);
        broadcaster.broadcastGlobal(ConflictEvent.warEnded(WarDTO.fromWar(latest)));
        return OperationResult.ok(latest);
    }

    private void cancelActivePushes(String warId) {
        List<BorderPush> active = pushRepository.findByWarIdAndStatus(warId, PushStatus.ACTIVE);
        for (BorderPush push : active) {
            try {
                OperationResult<BorderPush> result = borderPushService.stopPush(push.getId(), PushStatus.CANCELLED);
                if (!result.isSuccess()) {
                    log.debug("Push {} already resolved while ending war {}: {}", push.getId(), warId, result.getMessage());
                }
            } catch (RuntimeException e) {
                log.error("Error cancelling push {} of war {}", push.getId(), warId, e);
            }
        }
    }

    public Optional<War> getWar(String warId) {
        return warRepository.findById(warId);
    }

    /**
     * Wars with the given status, newest first; all wars when status is null.
     */
    public List<War> findWars(WarStatus status) {
        if (status != null) {
            return warRepository.findByStatus(status);
        }
        return warRepository.findAll().stream()
                .sorted((a, b) -> b.getDeclaredAt().compareTo(a.getDeclaredAt()))
                .toList();
    }

    private void updateCountry(String countryId, Consumer<Country> mutation) {
        lockRegistry.withLock(EntityLockRegistry.COUNTRY + countryId, () -> {
            countryRepository.update(countryId, mutation);
        });
    }
}
