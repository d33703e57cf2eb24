package com.frontline.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A claimable country on the world map.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class Country implements ResourceHolder {

    private String id;

    private String name;

    private String isoCode;

    private String ownerId;

    @Builder.Default
    private boolean claimed = false;

    private Instant claimedAt;

    @Builder.Default
    private int soldierCount = 0;

    @Builder.Default
    private int maxSoldiers = 50;

    @Builder.Default
    private int resources = 1000;

    /** Resources generated per economy tick (floored). */
    @Builder.Default
    private double resourceGenerationRate = 1.0;

    @Builder.Default
    private double defenseStrength = 1.0;

    @Builder.Default
    private TerrainType terrainType = TerrainType.PLAINS;

    @Builder.Default
    private double terrainModifier = 1.0;

    private double areaKm2;

    @Builder.Default
    private boolean atWar = false;

    @Builder.Default
    private int activeWars = 0;

    @Builder.Default
    private int warsWon = 0;

    @Builder.Default
    private int warsLost = 0;

    @Builder.Default
    private double territoryGained = 0;

    @Builder.Default
    private double territoryLost = 0;

    private String color;

    private Instant lastActivity;

    public boolean canAcceptNewSoldier() {
        return soldierCount < maxSoldiers;
    }

    public boolean isOwnedBy(String playerId) {
        return ownerId != null && ownerId.equals(playerId);
    }

    /**
     * Claim this country for a player, who becomes its owner and first soldier.
     */
    public void claim(String playerId, Instant now) {
        this.claimed = true;
        this.ownerId = playerId;
        this.claimedAt = now;
        this.soldierCount = 1;
        this.lastActivity = now;
    }

    public void addSoldier(Instant now) {
        if (!canAcceptNewSoldier()) {
            throw new IllegalStateException("Country has reached maximum soldier capacity");
        }
        this.soldierCount++;
        this.lastActivity = now;
    }

    /**
     * Remove a soldier; the country falls back to unclaimed once empty.
     */
    public void removeSoldier(Instant now) {
        if (soldierCount <= 0) {
            throw new IllegalStateException("No soldiers to remove");
        }
        this.soldierCount--;
        if (soldierCount == 0 && claimed) {
            this.claimed = false;
            this.ownerId = null;
            this.claimedAt = null;
        }
        this.lastActivity = now;
    }

    public void enterWar() {
        this.activeWars++;
        this.atWar = true;
    }

    public void leaveWar() {
        this.activeWars = Math.max(0, activeWars - 1);
        this.atWar = activeWars > 0;
    }

    public Country copy() {
        return toBuilder().build();
    }
}
