package com.frontline.service;

import com.frontline.model.BorderPush;

import java.time.Duration;
import java.time.Instant;

/**
 * Strength, resistance, speed and territory derivation for border pushes.
 * Every code path that changes a push's kinematics goes through {@link #recomputeSpeed}.
 */
public final class PushPhysics {

    public static final double BASE_SPEED = 1.0;
    public static final double BASE_STRENGTH = 1.0;
    public static final double BASE_RESISTANCE = 1.0;
    public static final double MIN_SPEED = 0.1;
    public static final double MAX_SPEED = 5.0;
    /** Floor for divisors: resistance and terrain never drop below this. */
    public static final double MIN_DIVISOR = 0.1;

    private PushPhysics() {
    }

    public static double strengthFor(int supportingSoldiers) {
        return BASE_STRENGTH * Math.sqrt(Math.max(1, supportingSoldiers));
    }

    public static double resistanceFor(int defendingSoldiers) {
        if (defendingSoldiers <= 0) {
            return BASE_RESISTANCE;
        }
        return BASE_RESISTANCE * Math.sqrt(defendingSoldiers);
    }

    /**
     * Meters per second, clamped to [{@value #MIN_SPEED}, {@value #MAX_SPEED}].
     */
    public static double speed(double pushStrength, double resistanceStrength, double terrainModifier) {
        double resistance = Math.max(resistanceStrength, MIN_DIVISOR);
        double terrain = Math.max(terrainModifier, MIN_DIVISOR);
        double raw = BASE_SPEED * (pushStrength / resistance) * (1.0 / terrain);
        if (Double.isNaN(raw)) {
            return MIN_SPEED;
        }
        return Math.max(MIN_SPEED, Math.min(MAX_SPEED, raw));
    }

    public static void recomputeSpeed(BorderPush push) {
        push.setPushSpeed(speed(push.getPushStrength(), push.getResistanceStrength(), push.getTerrainModifier()));
    }

    /**
     * Circular-expansion approximation: π r² with r in kilometers.
     */
    public static double territoryKm2(double distanceMeters) {
        double radiusKm = distanceMeters / 1000.0;
        return Math.PI * radiusKm * radiusKm;
    }

    /**
     * Distance the push would have reached at {@code now} without committing anything.
     * Negative elapsed time (clock skew) counts as zero so progress never goes backwards.
     */
    public static double candidateDistance(BorderPush push, Instant now) {
        if (!push.isActive() || push.getLastUpdate() == null) {
            return push.getDistancePushed();
        }
        double elapsedSeconds = Math.max(0, Duration.between(push.getLastUpdate(), now).toNanos() / 1_000_000_000.0);
        return push.getDistancePushed() + push.getPushSpeed() * elapsedSeconds;
    }

    /**
     * Fold progress up to {@code now} into the push's committed state.
     */
    public static void advance(BorderPush push, Instant now) {
        double distance = candidateDistance(push, now);
        push.setDistancePushed(Math.max(push.getDistancePushed(), distance));
        push.setTerritoryGained(territoryKm2(push.getDistancePushed()));
        if (push.getLastUpdate() == null || now.isAfter(push.getLastUpdate())) {
            push.setLastUpdate(now);
        }
    }
}
