package com.frontline.service;

import com.frontline.model.CountryHistoryEntry;
import com.frontline.model.HistoryEventType;
import com.frontline.repository.CountryHistoryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Timeline of ownership, membership, war and territory changes per country.
 * <p>
 * Entries are written after the change they describe has been stored, outside any
 * conflict lock.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CountryHistoryService {

    public static final int DEFAULT_LIMIT = 50;
    public static final int MAX_LIMIT = 500;

    private final CountryHistoryRepository historyRepository;
    private final Clock clock;

    private final AtomicLong sequence = new AtomicLong();

    public void recordClaimed(String countryId, String playerId) {
        record(CountryHistoryEntry.builder()
                .countryId(countryId)
                .eventType(HistoryEventType.CLAIMED)
                .playerId(playerId)
                .description("Country claimed by player " + playerId));
    }

    /**
     * @param lastSoldierId the player whose departure emptied the country
     */
    public void recordUnclaimed(String countryId, String lastSoldierId) {
        record(CountryHistoryEntry.builder()
                .countryId(countryId)
                .eventType(HistoryEventType.UNCLAIMED)
                .playerId(lastSoldierId)
                .description("Country became unclaimed"));
    }

    public void recordSoldierJoined(String countryId, String playerId) {
        record(CountryHistoryEntry.builder()
                .countryId(countryId)
                .eventType(HistoryEventType.SOLDIER_JOINED)
                .playerId(playerId)
                .description("Player " + playerId + " joined as soldier"));
    }

    public void recordSoldierLeft(String countryId, String playerId) {
        record(CountryHistoryEntry.builder()
                .countryId(countryId)
                .eventType(HistoryEventType.SOLDIER_LEFT)
                .playerId(playerId)
                .description("Player " + playerId + " left the country"));
    }

    public void recordWarDeclared(String countryId, String warId, String playerId, String targetCountryId) {
        record(CountryHistoryEntry.builder()
                .countryId(countryId)
                .eventType(HistoryEventType.WAR_DECLARED)
                .playerId(playerId)
                .relatedCountryId(targetCountryId)
                .warId(warId)
                .description("War declared against country " + targetCountryId));
    }

    public void recordWarEnded(String countryId, String warId, String opponentId, String winnerCountryId) {
        String outcome = winnerCountryId == null ? "War ended"
                : winnerCountryId.equals(countryId) ? "War won" : "War lost";
        record(CountryHistoryEntry.builder()
                .countryId(countryId)
                .eventType(HistoryEventType.WAR_ENDED)
                .relatedCountryId(opponentId)
                .warId(warId)
                .description(outcome));
    }

    public void recordTerritoryGained(String countryId, String playerId, double amount,
                                      String fromCountryId, String warId) {
        record(CountryHistoryEntry.builder()
                .countryId(countryId)
                .eventType(HistoryEventType.TERRITORY_GAINED)
                .playerId(playerId)
                .relatedCountryId(fromCountryId)
                .warId(warId)
                .amount(amount)
                .description(String.format(Locale.ROOT, "Gained %.1f km² of territory from country %s", amount, fromCountryId)));
    }

    public void recordTerritoryLost(String countryId, double amount, String toCountryId, String warId) {
        record(CountryHistoryEntry.builder()
                .countryId(countryId)
                .eventType(HistoryEventType.TERRITORY_LOST)
                .relatedCountryId(toCountryId)
                .warId(warId)
                .amount(amount)
                .description(String.format(Locale.ROOT, "Lost %.1f km² of territory to country %s", amount, toCountryId)));
    }

    /**
     * Newest entries first. The limit is clamped to [1, {@value #MAX_LIMIT}].
     */
    public List<CountryHistoryEntry> timeline(String countryId, int limit) {
        return historyRepository.findByCountryId(countryId, Math.max(1, Math.min(limit, MAX_LIMIT)));
    }

    private void record(CountryHistoryEntry.CountryHistoryEntryBuilder entry) {
        CountryHistoryEntry saved = historyRepository.save(entry
                .id(UUID.randomUUID().toString())
                .timestamp(clock.instant())
                .sequence(sequence.incrementAndGet())
                .build());
        log.debug("History {} for {}: {}", saved.getEventType(), saved.getCountryId(), saved.getDescription());
    }
}
