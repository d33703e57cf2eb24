package com.frontline.model;

/**
 * Dominant terrain of a country, used to pick a default terrain modifier.
 */
public enum TerrainType {
    PLAINS(1.0),
    FOREST(1.3),
    DESERT(1.5),
    COASTAL(1.1),
    ISLANDS(2.0),
    MOUNTAINS(2.5);

    private final double defaultModifier;

    TerrainType(double defaultModifier) {
        this.defaultModifier = defaultModifier;
    }

    public double getDefaultModifier() {
        return defaultModifier;
    }
}
