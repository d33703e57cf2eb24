package com.frontline.dto;

import com.frontline.model.War;
import com.frontline.model.WarStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * DTO for war representation.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class WarDTO {

    private String id;
    private String aggressorCountryId;
    private String defenderCountryId;
    private String declaredBy;
    private Instant declaredAt;
    private WarStatus status;
    private Instant endedAt;
    private String endedBy;
    private String winnerCountryId;
    private String reason;
    private double territoryExchanged;
    private long durationMinutes;
    private int totalBorderPushes;
    private int aggressorSoldiersParticipated;
    private int defenderSoldiersParticipated;
    private int maxSimultaneousPushes;

    public static WarDTO fromWar(War war) {
        return WarDTO.builder()
                .id(war.getId())
                .aggressorCountryId(war.getAggressorCountryId())
                .defenderCountryId(war.getDefenderCountryId())
                .declaredBy(war.getDeclaredBy())
                .declaredAt(war.getDeclaredAt())
                .status(war.getStatus())
                .endedAt(war.getEndedAt())
                .endedBy(war.getEndedBy())
                .winnerCountryId(war.getWinnerCountryId())
                .reason(war.getReason())
                .territoryExchanged(war.getTerritoryExchanged())
                .durationMinutes(war.getDurationMinutes())
                .totalBorderPushes(war.getTotalBorderPushes())
                .aggressorSoldiersParticipated(war.getAggressorSoldiersParticipated())
                .defenderSoldiersParticipated(war.getDefenderSoldiersParticipated())
                .maxSimultaneousPushes(war.getMaxSimultaneousPushes())
                .build();
    }
}
