package com.frontline.dto;

import com.frontline.model.PushStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Read-only view of a push's progress. The candidate values include movement since the
 * last commit and are not persisted.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PushProgress {

    private String pushId;
    private PushStatus status;
    private double distancePushed;
    private double candidateDistance;
    private double territoryGained;
    private double candidateTerritory;
    private double pushSpeed;
    private int supportingSoldiers;
    private int defendingSoldiers;
    private Instant asOf;
}
