package com.frontline.dto;

import com.frontline.model.Country;
import com.frontline.model.TerrainType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO for country representation.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CountryDTO {

    private String id;
    private String name;
    private String isoCode;
    private String ownerId;
    private boolean claimed;
    private int soldierCount;
    private int maxSoldiers;
    private int resources;
    private double resourceGenerationRate;
    private TerrainType terrainType;
    private double terrainModifier;
    private double areaKm2;
    private boolean atWar;
    private int activeWars;
    private int warsWon;
    private int warsLost;
    private double territoryGained;
    private double territoryLost;
    private String color;

    public static CountryDTO fromCountry(Country country) {
        return CountryDTO.builder()
                .id(country.getId())
                .name(country.getName())
                .isoCode(country.getIsoCode())
                .ownerId(country.getOwnerId())
                .claimed(country.isClaimed())
                .soldierCount(country.getSoldierCount())
                .maxSoldiers(country.getMaxSoldiers())
                .resources(country.getResources())
                .resourceGenerationRate(country.getResourceGenerationRate())
                .terrainType(country.getTerrainType())
                .terrainModifier(country.getTerrainModifier())
                .areaKm2(country.getAreaKm2())
                .atWar(country.isAtWar())
                .activeWars(country.getActiveWars())
                .warsWon(country.getWarsWon())
                .warsLost(country.getWarsLost())
                .territoryGained(country.getTerritoryGained())
                .territoryLost(country.getTerritoryLost())
                .color(country.getColor())
                .build();
    }
}
