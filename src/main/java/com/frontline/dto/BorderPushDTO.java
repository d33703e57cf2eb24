package com.frontline.dto;

import com.frontline.model.BorderPush;
import com.frontline.model.GeoPoint;
import com.frontline.model.PushStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * DTO for border push representation. Participant ids stay server side.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BorderPushDTO {

    private String id;
    private String warId;
    private String playerId;
    private String sourceCountryId;
    private String targetCountryId;
    private GeoPoint position;
    private GeoPoint direction;
    private PushStatus status;
    private double pushStrength;
    private double resistanceStrength;
    private double terrainModifier;
    private int supportingSoldiers;
    private int defendingSoldiers;
    private double distancePushed;
    private double territoryGained;
    private double pushSpeed;
    private int resourcesConsumed;
    private long durationSeconds;
    private Instant startedAt;
    private Instant lastUpdate;
    private Instant endedAt;

    public static BorderPushDTO fromPush(BorderPush push) {
        return BorderPushDTO.builder()
                .id(push.getId())
                .warId(push.getWarId())
                .playerId(push.getPlayerId())
                .sourceCountryId(push.getSourceCountryId())
                .targetCountryId(push.getTargetCountryId())
                .position(push.getPosition())
                .direction(push.getDirection())
                .status(push.getStatus())
                .pushStrength(push.getPushStrength())
                .resistanceStrength(push.getResistanceStrength())
                .terrainModifier(push.getTerrainModifier())
                .supportingSoldiers(push.getSupportingSoldiers())
                .defendingSoldiers(push.getDefendingSoldiers())
                .distancePushed(push.getDistancePushed())
                .territoryGained(push.getTerritoryGained())
                .pushSpeed(push.getPushSpeed())
                .resourcesConsumed(push.getResourcesConsumed())
                .durationSeconds(push.getDurationSeconds())
                .startedAt(push.getStartedAt())
                .lastUpdate(push.getLastUpdate())
                .endedAt(push.getEndedAt())
                .build();
    }
}
