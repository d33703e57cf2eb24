package com.frontline.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A contested expansion of the source country into the target country within a war.
 * <p>
 * Kinematic fields ({@code pushStrength}, {@code resistanceStrength}, {@code pushSpeed},
 * {@code distancePushed}) are only written by {@code BorderPushService} while it holds
 * the push lock.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class BorderPush {

    private String id;

    private String warId;

    /** Initiating player. */
    private String playerId;

    private String sourceCountryId;

    private String targetCountryId;

    private GeoPoint position;

    private GeoPoint direction;

    @Builder.Default
    private PushStatus status = PushStatus.ACTIVE;

    @Builder.Default
    private double pushStrength = 1.0;

    @Builder.Default
    private double resistanceStrength = 1.0;

    @Builder.Default
    private double terrainModifier = 1.0;

    @Builder.Default
    private int supportingSoldiers = 1;

    @Builder.Default
    private int defendingSoldiers = 0;

    @Builder.Default
    private Set<String> supporterIds = new LinkedHashSet<>();

    @Builder.Default
    private Set<String> defenderIds = new LinkedHashSet<>();

    /** Meters advanced as of {@code lastUpdate}. */
    @Builder.Default
    private double distancePushed = 0;

    /** Square kilometers, derived from {@code distancePushed}. */
    @Builder.Default
    private double territoryGained = 0;

    /** Meters per second. */
    @Builder.Default
    private double pushSpeed = 1.0;

    @Builder.Default
    private int resourcesConsumed = 0;

    @Builder.Default
    private long durationSeconds = 0;

    private Instant startedAt;

    private Instant lastUpdate;

    private Instant endedAt;

    @JsonIgnore
    public boolean isActive() {
        return status == PushStatus.ACTIVE;
    }

    public boolean hasParticipant(String participantId) {
        return playerId.equals(participantId)
                || supporterIds.contains(participantId)
                || defenderIds.contains(participantId);
    }

    public BorderPush copy() {
        return toBuilder()
                .supporterIds(supporterIds != null ? new LinkedHashSet<>(supporterIds) : new LinkedHashSet<>())
                .defenderIds(defenderIds != null ? new LinkedHashSet<>(defenderIds) : new LinkedHashSet<>())
                .build();
    }
}
