package org.Aayush.pivot.cost;

import lombok.Builder;
import lombok.Value;

/**
 * Tunables of the motion cost model, bound once at planner construction.
 */
@Value
@Builder(toBuilder = true)
public class CostModelConfig {

    /** Cruising speed used as the no-loss reference (m/s). */
    @Builder.Default
    double referenceSpeed = 4.0d;

    /** Friction coefficient bounding cornering speed. */
    @Builder.Default
    double frictionCoefficient = 0.7d;

    /** Gravitational acceleration (m/s^2). */
    @Builder.Default
    double gravity = 9.81d;

    /** Integer scale applied to the turning speed-loss fraction (K_ANGLE). */
    @Builder.Default
    int angleWeight = 1_000;

    /** Integer scale applied to squared step distance (K_DIST). */
    @Builder.Default
    int distanceWeight = 1_000;

    /** Integer scale applied to squared distance-to-goal by the heuristic (K_HEUR). */
    @Builder.Default
    int heuristicWeight = 10;

    /** Multiplier applied to moves driven in reverse. */
    @Builder.Default
    int reverseMultiplier = 6;

    /**
     * Returns the canonical tuning.
     */
    public static CostModelConfig defaults() {
        return CostModelConfig.builder().build();
    }

    /**
     * Validates value ranges.
     *
     * @throws IllegalArgumentException when a tunable is out of range.
     */
    public CostModelConfig validate() {
        requirePositiveFinite(referenceSpeed, "referenceSpeed");
        requirePositiveFinite(frictionCoefficient, "frictionCoefficient");
        requirePositiveFinite(gravity, "gravity");
        requireNonNegative(angleWeight, "angleWeight");
        requirePositive(distanceWeight, "distanceWeight");
        requireNonNegative(heuristicWeight, "heuristicWeight");
        if (reverseMultiplier < 1) {
            throw new IllegalArgumentException("reverseMultiplier must be >= 1, got " + reverseMultiplier);
        }
        return this;
    }

    private static void requirePositiveFinite(double value, String name) {
        if (!Double.isFinite(value) || value <= 0.0d) {
            throw new IllegalArgumentException(name + " must be finite and > 0, got " + value);
        }
    }

    private static void requirePositive(int value, String name) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be > 0, got " + value);
        }
    }

    private static void requireNonNegative(int value, String name) {
        if (value < 0) {
            throw new IllegalArgumentException(name + " must be >= 0, got " + value);
        }
    }
}
