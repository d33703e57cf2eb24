package com.frontline.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * How a player moves; faster modes cost more resources.
 */
@Getter
@RequiredArgsConstructor
public enum MovementType {
    WALK(1),
    RUN(2),
    TELEPORT(10);

    private final int cost;
}
