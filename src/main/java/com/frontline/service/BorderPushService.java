package com.frontline.service;

import com.frontline.dto.BorderPushDTO;
import com.frontline.dto.PushProgress;
import com.frontline.exception.InvariantViolationException;
import com.frontline.model.BorderPush;
import com.frontline.model.Country;
import com.frontline.model.GeoPoint;
import com.frontline.model.Player;
import com.frontline.model.PushStatus;
import com.frontline.model.War;
import com.frontline.repository.BorderPushRepository;
import com.frontline.repository.CountryRepository;
import com.frontline.repository.PlayerRepository;
import com.frontline.repository.WarRepository;
import com.frontline.websocket.ConflictBroadcaster;
import com.frontline.websocket.ConflictBroadcaster.ConflictEvent;
import com.frontline.websocket.ConflictBroadcaster.EventType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Lifecycle and progress of border pushes.
 * <p>
 * Every mutation of a push runs under that push's lock, so joins, defends, ticks and
 * stops on one push observe a total order. Ledger calls happen before or after the
 * conflict locks, never inside them.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BorderPushService {

    private final BorderPushRepository pushRepository;
    private final WarRepository warRepository;
    private final PlayerRepository playerRepository;
    private final CountryRepository countryRepository;
    private final ResourceLedger ledger;
    private final EntityLockRegistry lockRegistry;
    private final ConflictBroadcaster broadcaster;
    private final CountryHistoryService historyService;
    private final Clock clock;

    private final Set<String> quarantinedPushes = ConcurrentHashMap.newKeySet();

    @Value("${game.push.cost:10}")
    private int pushCost;

    @Value("${game.push.join-cost:0}")
    private int joinCost;

    @Value("${game.push.cooldown-ms:5000}")
    private long pushCooldownMs;

    @Value("${game.push.success-distance-m:10000}")
    private double successDistanceMeters;

    /**
     * Outcome of one tick evaluation of a push.
     */
    public enum TickOutcome {
        PROGRESSED,
        COMPLETED,
        CANCELLED,
        SKIPPED
    }

    /**
     * Start a push into the war's defender on behalf of an aggressor soldier.
     */
    public OperationResult<BorderPush> startPush(String playerId, String warId, GeoPoint position,
                                                 GeoPoint direction, Double terrainModifier) {
        OperationResult<War> precheck = checkStart(playerId, warId, clock.instant());
        if (!precheck.isSuccess()) {
            return precheck.propagate();
        }

        if (pushCost > 0) {
            OperationResult<Integer> debit = ledger.debit(playerId, pushCost);
            if (!debit.isSuccess()) {
                return debit.propagate();
            }
        }

        OperationResult<BorderPush> created = lockRegistry.withLock(EntityLockRegistry.PLAYER + playerId, () ->
                lockRegistry.withLock(EntityLockRegistry.WAR + warId, () ->
                        createPush(playerId, warId, position, direction, terrainModifier)));

        if (!created.isSuccess()) {
            if (pushCost > 0) {
                ledger.credit(playerId, pushCost);
                log.warn("Refunded {} to player {} after push creation was rejected: {}",
                        pushCost, playerId, created.getMessage());
            }
            return created;
        }

        BorderPush push = created.getValue();
        log.info("Player {} started push {} from {} into {}", playerId, push.getId(),
                push.getSourceCountryId(), push.getTargetCountryId());
        BorderPushDTO dto = BorderPushDTO.fromPush(push);
        broadcaster.broadcast(push.getSourceCountryId(), ConflictEvent.push(EventType.PUSH_STARTED, dto));
        broadcaster.broadcast(push.getTargetCountryId(), ConflictEvent.push(EventType.PUSH_INCOMING, dto));
        return created;
    }

    private OperationResult<BorderPush> createPush(String playerId, String warId, GeoPoint position,
                                                   GeoPoint direction, Double terrainModifier) {
        Instant now = clock.instant();
        OperationResult<War> recheck = checkStart(playerId, warId, now);
        if (!recheck.isSuccess()) {
            return recheck.propagate();
        }
        War war = recheck.getValue();

        BorderPush push = BorderPush.builder()
                .id(UUID.randomUUID().toString())
                .warId(warId)
                .playerId(playerId)
                .sourceCountryId(war.getAggressorCountryId())
                .targetCountryId(war.getDefenderCountryId())
                .position(position)
                .direction(direction)
                .terrainModifier(terrainModifier != null ? terrainModifier : 1.0)
                .resourcesConsumed(Math.max(0, pushCost))
                .startedAt(now)
                .lastUpdate(now)
                .build();
        PushPhysics.recomputeSpeed(push);
        pushRepository.save(push);

        playerRepository.update(playerId, p -> p.setLastBorderPushAt(now));
        int simultaneous = pushRepository.findByWarIdAndStatus(warId, PushStatus.ACTIVE).size();
        warRepository.update(warId, w -> {
            w.setAggressorSoldiersParticipated(w.getAggressorSoldiersParticipated() + 1);
            w.setMaxSimultaneousPushes(Math.max(w.getMaxSimultaneousPushes(), simultaneous));
        });
        return OperationResult.ok(push);
    }

    private OperationResult<War> checkStart(String playerId, String warId, Instant now) {
        Optional<Player> player = playerRepository.findById(playerId);
        if (player.isEmpty()) {
            return OperationResult.failure(ErrorKind.NOT_FOUND, "Player not found: " + playerId);
        }
        Optional<War> war = warRepository.findById(warId);
        if (war.isEmpty()) {
            return OperationResult.failure(ErrorKind.NOT_FOUND, "War not found: " + warId);
        }
        if (!war.get().isActive()) {
            return OperationResult.failure(ErrorKind.INVALID_STATE, "War is not active");
        }
        if (!player.get().belongsTo(war.get().getAggressorCountryId())) {
            return OperationResult.failure(ErrorKind.FORBIDDEN,
                    "Only soldiers of the aggressor country can start a border push");
        }
        if (pushRepository.findActiveByPlayerId(playerId).isPresent()) {
            return OperationResult.failure(ErrorKind.CONFLICT, "You already have an active border push");
        }
        Instant lastPush = player.get().getLastBorderPushAt();
        if (lastPush != null) {
            long elapsed = Duration.between(lastPush, now).toMillis();
            if (elapsed < pushCooldownMs) {
                return OperationResult.cooldown("Border push is on cooldown", pushCooldownMs - elapsed);
            }
        }
        return OperationResult.ok(war.get());
    }

    /**
     * Add the player as a supporter of an active push from their country.
     */
    public OperationResult<BorderPush> join(String pushId, String playerId) {
        return participate(pushId, playerId, false);
    }

    /**
     * Add the player as a defender of an active push into their country.
     */
    public OperationResult<BorderPush> defend(String pushId, String playerId) {
        return participate(pushId, playerId, true);
    }

    private OperationResult<BorderPush> participate(String pushId, String playerId, boolean defending) {
        OperationResult<BorderPush> precheck = checkParticipation(pushId, playerId, defending);
        if (!precheck.isSuccess()) {
            return precheck;
        }

        if (joinCost > 0) {
            OperationResult<Integer> debit = ledger.debit(playerId, joinCost);
            if (!debit.isSuccess()) {
                return debit.propagate();
            }
        }

        OperationResult<BorderPush> updated = lockRegistry.withLock(EntityLockRegistry.PUSH + pushId, () -> {
            OperationResult<BorderPush> recheck = checkParticipation(pushId, playerId, defending);
            if (!recheck.isSuccess()) {
                return recheck;
            }
            BorderPush push = recheck.getValue();
            // only strength, resistance and speed change here; distance is committed by the tick
            if (defending) {
                push.getDefenderIds().add(playerId);
                push.setDefendingSoldiers(push.getDefendingSoldiers() + 1);
                push.setResistanceStrength(PushPhysics.resistanceFor(push.getDefendingSoldiers()));
            } else {
                push.getSupporterIds().add(playerId);
                push.setSupportingSoldiers(push.getSupportingSoldiers() + 1);
                push.setPushStrength(PushPhysics.strengthFor(push.getSupportingSoldiers()));
            }
            push.setResourcesConsumed(push.getResourcesConsumed() + Math.max(0, joinCost));
            PushPhysics.recomputeSpeed(push);
            pushRepository.save(push);
            return OperationResult.ok(push);
        });

        if (!updated.isSuccess()) {
            if (joinCost > 0) {
                ledger.credit(playerId, joinCost);
                log.warn("Refunded {} to player {} after joining push {} was rejected", joinCost, playerId, pushId);
            }
            return updated;
        }

        BorderPush push = updated.getValue();
        updateWar(push.getWarId(), w -> {
            if (defending) {
                w.setDefenderSoldiersParticipated(w.getDefenderSoldiersParticipated() + 1);
            } else {
                w.setAggressorSoldiersParticipated(w.getAggressorSoldiersParticipated() + 1);
            }
        });

        BorderPushDTO dto = BorderPushDTO.fromPush(push);
        if (defending) {
            log.debug("Player {} defends against push {} (defenders {}, speed {})",
                    playerId, pushId, push.getDefendingSoldiers(), push.getPushSpeed());
            broadcaster.broadcast(push.getTargetCountryId(), ConflictEvent.push(EventType.DEFENSE_ADDED, dto));
        } else {
            log.debug("Player {} supports push {} (supporters {}, speed {})",
                    playerId, pushId, push.getSupportingSoldiers(), push.getPushSpeed());
            broadcaster.broadcast(push.getSourceCountryId(), ConflictEvent.push(EventType.SUPPORT_ADDED, dto));
        }
        return updated;
    }

    private OperationResult<BorderPush> checkParticipation(String pushId, String playerId, boolean defending) {
        Optional<Player> player = playerRepository.findById(playerId);
        if (player.isEmpty()) {
            return OperationResult.failure(ErrorKind.NOT_FOUND, "Player not found: " + playerId);
        }
        Optional<BorderPush> found = pushRepository.findById(pushId);
        if (found.isEmpty()) {
            return OperationResult.failure(ErrorKind.NOT_FOUND, "Border push not found: " + pushId);
        }
        BorderPush push = found.get();
        if (!push.isActive() || quarantinedPushes.contains(pushId)) {
            return OperationResult.failure(ErrorKind.INVALID_STATE, "Border push is not active");
        }
        if (warRepository.findById(push.getWarId()).filter(War::isActive).isEmpty()) {
            return OperationResult.failure(ErrorKind.INVALID_STATE, "War is not active");
        }
        if (defending && !player.get().belongsTo(push.getTargetCountryId())) {
            return OperationResult.failure(ErrorKind.FORBIDDEN,
                    "You can only defend against pushes targeting your country");
        }
        if (!defending && !player.get().belongsTo(push.getSourceCountryId())) {
            return OperationResult.failure(ErrorKind.FORBIDDEN,
                    "You can only join border pushes from your own country");
        }
        if (push.hasParticipant(playerId)) {
            return OperationResult.failure(ErrorKind.CONFLICT, "You already take part in this border push");
        }
        return OperationResult.ok(push);
    }

    /**
     * Progress as of now without committing anything. Takes no lock.
     */
    public OperationResult<PushProgress> peekProgress(String pushId) {
        return pushRepository.findById(pushId)
                .map(push -> OperationResult.ok(progressOf(push, clock.instant())))
                .orElseGet(() -> OperationResult.failure(ErrorKind.NOT_FOUND, "Border push not found: " + pushId));
    }

    /**
     * Commit the progress accrued since the last update and apply the completion policy.
     *
     * @throws InvariantViolationException if the push references a war that does not exist
     */
    public TickOutcome commitProgress(String pushId) {
        if (quarantinedPushes.contains(pushId)) {
            return TickOutcome.SKIPPED;
        }
        Resolution resolution = lockRegistry.withLock(EntityLockRegistry.PUSH + pushId, () -> {
            BorderPush push = pushRepository.findById(pushId).orElse(null);
            if (push == null || !push.isActive()) {
                return null;
            }
            Optional<War> war = warRepository.findById(push.getWarId());
            if (war.isEmpty()) {
                quarantinedPushes.add(pushId);
                log.error("Push {} references missing war {}; push quarantined", pushId, push.getWarId());
                throw new InvariantViolationException(pushId,
                        "Border push " + pushId + " references missing war " + push.getWarId());
            }
            Instant now = clock.instant();
            PushPhysics.advance(push, now);
            if (!war.get().isActive()) {
                finish(push, PushStatus.CANCELLED, now);
                pushRepository.save(push);
                return new Resolution(push, TickOutcome.CANCELLED);
            }
            if (push.getDistancePushed() > successDistanceMeters) {
                finish(push, PushStatus.SUCCESSFUL, now);
                pushRepository.save(push);
                return new Resolution(push, TickOutcome.COMPLETED);
            }
            pushRepository.save(push);
            return new Resolution(push, TickOutcome.PROGRESSED);
        });

        if (resolution == null) {
            return TickOutcome.SKIPPED;
        }
        publish(resolution);
        return resolution.outcome();
    }

    /**
     * Stop an active push with the given terminal status. SUCCESSFUL awards the territory
     * covered so far.
     */
    public OperationResult<BorderPush> stopPush(String pushId, PushStatus reason) {
        if (reason == null || !reason.isTerminal()) {
            throw new IllegalArgumentException("Stop reason must be a terminal status: " + reason);
        }
        OperationResult<Resolution> stopped = lockRegistry.withLock(EntityLockRegistry.PUSH + pushId, () -> {
            Optional<BorderPush> found = pushRepository.findById(pushId);
            if (found.isEmpty()) {
                return OperationResult.failure(ErrorKind.NOT_FOUND, "Border push not found: " + pushId);
            }
            BorderPush push = found.get();
            if (!push.isActive()) {
                return OperationResult.failure(ErrorKind.INVALID_STATE, "Border push is not active");
            }
            if (quarantinedPushes.contains(pushId)) {
                throw new InvariantViolationException(pushId, "Border push " + pushId + " is quarantined");
            }
            Instant now = clock.instant();
            PushPhysics.advance(push, now);
            finish(push, reason, now);
            pushRepository.save(push);
            TickOutcome outcome = reason == PushStatus.SUCCESSFUL ? TickOutcome.COMPLETED : TickOutcome.CANCELLED;
            return OperationResult.ok(new Resolution(push, outcome));
        });
        if (!stopped.isSuccess()) {
            return stopped.propagate();
        }
        publish(stopped.getValue());
        return OperationResult.ok(stopped.getValue().push());
    }

    /**
     * Request-facing stop: only the initiating player may stop their push.
     */
    public OperationResult<BorderPush> stopPush(String pushId, String playerId, PushStatus reason) {
        Optional<BorderPush> push = pushRepository.findById(pushId);
        if (push.isEmpty()) {
            return OperationResult.failure(ErrorKind.NOT_FOUND, "Border push not found: " + pushId);
        }
        if (!push.get().getPlayerId().equals(playerId)) {
            return OperationResult.failure(ErrorKind.FORBIDDEN, "Only the initiating player can stop a border push");
        }
        return stopPush(pushId, reason);
    }

    public Optional<BorderPush> getPush(String pushId) {
        return pushRepository.findById(pushId);
    }

    /**
     * Pushes filtered by status and war, newest first. Null filters match everything.
     */
    public List<BorderPush> findPushes(PushStatus status, String warId) {
        return pushRepository.findAll().stream()
                .filter(p -> status == null || p.getStatus() == status)
                .filter(p -> warId == null || warId.equals(p.getWarId()))
                .sorted(Comparator.comparing(BorderPush::getStartedAt).reversed())
                .toList();
    }

    public List<BorderPush> findActivePushes() {
        return pushRepository.findByStatus(PushStatus.ACTIVE);
    }

    public boolean isQuarantined(String pushId) {
        return quarantinedPushes.contains(pushId);
    }

    private void finish(BorderPush push, PushStatus status, Instant now) {
        push.setStatus(status);
        push.setEndedAt(now);
        push.setDurationSeconds(Duration.between(push.getStartedAt(), now).toSeconds());
    }

    private void publish(Resolution resolution) {
        BorderPush push = resolution.push();
        switch (resolution.outcome()) {
            case COMPLETED -> {
                awardTerritory(push);
                log.info("Push {} succeeded: {} gained {} km2 from {}", push.getId(),
                        push.getSourceCountryId(), String.format("%.1f", push.getTerritoryGained()),
                        push.getTargetCountryId());
                BorderPushDTO dto = BorderPushDTO.fromPush(push);
                broadcaster.broadcast(push.getSourceCountryId(), ConflictEvent.push(EventType.PUSH_COMPLETED, dto));
                broadcaster.broadcast(push.getTargetCountryId(), ConflictEvent.push(EventType.PUSH_LOST, dto));
            }
            case CANCELLED -> {
                updateWar(push.getWarId(), w -> w.setTotalBorderPushes(w.getTotalBorderPushes() + 1));
                log.info("Push {} ended with status {}", push.getId(), push.getStatus());
                BorderPushDTO dto = BorderPushDTO.fromPush(push);
                broadcaster.broadcast(push.getSourceCountryId(), ConflictEvent.push(EventType.PUSH_CANCELLED, dto));
                broadcaster.broadcast(push.getTargetCountryId(), ConflictEvent.push(EventType.PUSH_CANCELLED, dto));
            }
            case PROGRESSED -> {
                log.debug("Push {} at {} m (speed {} m/s)", push.getId(),
                        String.format("%.1f", push.getDistancePushed()), push.getPushSpeed());
                ConflictEvent event = ConflictEvent.progress(progressOf(push, push.getLastUpdate()));
                broadcaster.broadcast(push.getSourceCountryId(), event);
                broadcaster.broadcast(push.getTargetCountryId(), event);
            }
            default -> {
            }
        }
    }

    private void awardTerritory(BorderPush push) {
        double territory = push.getTerritoryGained();
        updateCountry(push.getSourceCountryId(), c -> c.setTerritoryGained(c.getTerritoryGained() + territory));
        updateCountry(push.getTargetCountryId(), c -> c.setTerritoryLost(c.getTerritoryLost() + territory));
        updateWar(push.getWarId(), w -> {
            w.setTerritoryExchanged(w.getTerritoryExchanged() + territory);
            w.setTotalBorderPushes(w.getTotalBorderPushes() + 1);
        });
        historyService.recordTerritoryGained(push.getSourceCountryId(), push.getPlayerId(), territory,
                push.getTargetCountryId(), push.getWarId());
        historyService.recordTerritoryLost(push.getTargetCountryId(), territory,
                push.getSourceCountryId(), push.getWarId());
    }

    private void updateWar(String warId, Consumer<War> mutation) {
        lockRegistry.withLock(EntityLockRegistry.WAR + warId, () -> {
            warRepository.update(warId, mutation);
        });
    }

    private void updateCountry(String countryId, Consumer<Country> mutation) {
        lockRegistry.withLock(EntityLockRegistry.COUNTRY + countryId, () -> {
            countryRepository.update(countryId, mutation);
        });
    }

    private static PushProgress progressOf(BorderPush push, Instant now) {
        double candidate = PushPhysics.candidateDistance(push, now);
        return PushProgress.builder()
                .pushId(push.getId())
                .status(push.getStatus())
                .distancePushed(push.getDistancePushed())
                .candidateDistance(candidate)
                .territoryGained(push.getTerritoryGained())
                .candidateTerritory(PushPhysics.territoryKm2(candidate))
                .pushSpeed(push.getPushSpeed())
                .supportingSoldiers(push.getSupportingSoldiers())
                .defendingSoldiers(push.getDefendingSoldiers())
                .asOf(now)
                .build();
    }

    private record Resolution(BorderPush push, TickOutcome outcome) {
    }
}
