package com.frontline.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

/**
 * A declared conflict between two countries. Wars are never deleted.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class War {

    private String id;

    private String aggressorCountryId;

    private String defenderCountryId;

    /** Player who declared the war; only they may end it. */
    private String declaredBy;

    private Instant declaredAt;

    @Builder.Default
    private WarStatus status = WarStatus.ACTIVE;

    private Instant endedAt;

    private String endedBy;

    private String winnerCountryId;

    private String reason;

    /** Territory moved by successful pushes, in km². */
    @Builder.Default
    private double territoryExchanged = 0;

    @Builder.Default
    private long durationMinutes = 0;

    @Builder.Default
    private int totalBorderPushes = 0;

    @Builder.Default
    private int aggressorSoldiersParticipated = 0;

    @Builder.Default
    private int defenderSoldiersParticipated = 0;

    @Builder.Default
    private int maxSimultaneousPushes = 0;

    @JsonIgnore
    public boolean isActive() {
        return status == WarStatus.ACTIVE;
    }

    public boolean involves(String countryId) {
        return aggressorCountryId.equals(countryId) || defenderCountryId.equals(countryId);
    }

    public String opponentOf(String countryId) {
        return aggressorCountryId.equals(countryId) ? defenderCountryId : aggressorCountryId;
    }

    public String pairKey() {
        return pairKey(aggressorCountryId, defenderCountryId);
    }

    /**
     * Order-independent key for a pair of countries, "min|max".
     */
    public static String pairKey(String countryA, String countryB) {
        return countryA.compareTo(countryB) <= 0
                ? countryA + "|" + countryB
                : countryB + "|" + countryA;
    }

    public long minutesSinceDeclared(Instant now) {
        Instant end = endedAt != null ? endedAt : now;
        return Duration.between(declaredAt, end).toMinutes();
    }

    public War copy() {
        return toBuilder().build();
    }
}
