package com.frontline.model;

/**
 * Kinds of entries in a country's timeline.
 */
public enum HistoryEventType {
    CLAIMED,
    UNCLAIMED,
    WAR_DECLARED,
    WAR_ENDED,
    TERRITORY_GAINED,
    TERRITORY_LOST,
    SOLDIER_JOINED,
    SOLDIER_LEFT
}
