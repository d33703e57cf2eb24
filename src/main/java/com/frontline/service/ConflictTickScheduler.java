package com.frontline.service;

import com.frontline.dto.ServerStatsDTO;
import com.frontline.model.BorderPush;
import com.frontline.model.Country;
import com.frontline.model.WarStatus;
import com.frontline.repository.CountryRepository;
import com.frontline.repository.WarRepository;
import com.frontline.websocket.ConflictBroadcaster;
import com.frontline.websocket.ConflictBroadcaster.ConflictEvent;
import com.frontline.websocket.ConflictBroadcaster.ResourcesGeneratedMessage;
import com.frontline.websocket.ObserverRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Periodic drivers: push progress, resource generation and server statistics.
 * A failure on one entity is logged and never stops the rest of the batch.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConflictTickScheduler {

    private final BorderPushService borderPushService;
    private final ResourceLedger ledger;
    private final CountryRepository countryRepository;
    private final WarRepository warRepository;
    private final ObserverRegistry observerRegistry;
    private final ConflictBroadcaster broadcaster;

    /**
     * Commit progress of every active push.
     *
     * @return how many pushes ended in each outcome
     */
    @Scheduled(fixedDelayString = "${game.tick.conflict-interval-ms:5000}")
    public Map<BorderPushService.TickOutcome, Integer> conflictTick() {
        Map<BorderPushService.TickOutcome, Integer> outcomes = new EnumMap<>(BorderPushService.TickOutcome.class);
        List<BorderPush> active = borderPushService.findActivePushes();
        for (BorderPush push : active) {
            try {
                outcomes.merge(borderPushService.commitProgress(push.getId()), 1, Integer::sum);
            } catch (RuntimeException e) {
                log.error("Error advancing push {}", push.getId(), e);
            }
        }
        if (!active.isEmpty()) {
            log.debug("Conflict tick processed {} push(es): {}", active.size(), outcomes);
        }
        return outcomes;
    }

    /**
     * Generate resources for every claimed country.
     *
     * @return total resources generated
     */
    @Scheduled(fixedDelayString = "${game.tick.economy-interval-ms:60000}")
    public int economyTick() {
        int total = 0;
        for (Country country : countryRepository.findByClaimed(true)) {
            try {
                OperationResult<Integer> generated = ledger.generate(country.getId(), country.getResourceGenerationRate());
                if (!generated.isSuccess()) {
                    log.warn("No resources generated for {}: {}", country.getId(), generated.getMessage());
                    continue;
                }
                int amount = generated.getValue();
                total += amount;
                int balance = ledger.balanceOf(country.getId()).getValue();
                broadcaster.broadcast(country.getId(), ConflictEvent.resourcesGenerated(
                        new ResourcesGeneratedMessage(country.getId(), amount, balance)));
            } catch (RuntimeException e) {
                log.error("Error generating resources for country {}", country.getId(), e);
            }
        }
        log.debug("Economy tick generated {} resource(s)", total);
        return total;
    }

    @Scheduled(fixedDelayString = "${game.tick.stats-interval-ms:30000}")
    public void statsTick() {
        try {
            broadcaster.broadcastGlobal(ConflictEvent.serverStats(currentStats()));
        } catch (RuntimeException e) {
            log.error("Error publishing server stats", e);
        }
    }

    public ServerStatsDTO currentStats() {
        return ServerStatsDTO.builder()
                .connectedObservers(observerRegistry.connectedCount())
                .activeRooms(observerRegistry.activeRoomCount())
                .activeWars(warRepository.findByStatus(WarStatus.ACTIVE).size())
                .activePushes(borderPushService.findActivePushes().size())
                .build();
    }
}
