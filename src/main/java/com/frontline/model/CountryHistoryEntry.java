package com.frontline.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One entry in a country's timeline. Entries are append-only.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class CountryHistoryEntry {

    private String id;

    private String countryId;

    private HistoryEventType eventType;

    /** Player who triggered the event, if any. */
    private String playerId;

    /** The other country for wars and territory changes. */
    private String relatedCountryId;

    private String warId;

    /** km² for territory entries. */
    private Double amount;

    private String description;

    private Instant timestamp;

    /** Insertion order; breaks ties between entries with the same timestamp. */
    private long sequence;

    public CountryHistoryEntry copy() {
        return toBuilder().build();
    }
}
