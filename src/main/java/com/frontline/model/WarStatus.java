package com.frontline.model;

/**
 * Lifecycle of a war. CEASEFIRE is modelled but no current rule enters it.
 */
public enum WarStatus {
    ACTIVE,
    ENDED,
    CEASEFIRE
}
