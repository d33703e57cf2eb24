package com.frontline.config;

import com.frontline.model.TerrainType;

/**
 * A single country in a catalog file. Optional numeric fields fall back to the
 * configured defaults when absent.
 *
 * @param id                     unique id, an ISO-like code such as "FR"
 * @param name                   display name
 * @param isoCode                ISO 3166 alpha-3 code
 * @param terrainType            dominant terrain, defaults to plains
 * @param terrainModifier        overrides the terrain type's default modifier
 * @param resourceGenerationRate resources per economy tick
 * @param maxSoldiers            soldier capacity
 * @param areaKm2                land area
 * @param color                  map color, e.g. "#1f77b4"
 */
public record CountryDefinition(
        String id,
        String name,
        String isoCode,
        TerrainType terrainType,
        Double terrainModifier,
        Double resourceGenerationRate,
        Integer maxSoldiers,
        double areaKm2,
        String color
) {}
