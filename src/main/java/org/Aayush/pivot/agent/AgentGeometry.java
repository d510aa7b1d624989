package org.Aayush.pivot.agent;

import lombok.Value;
import lombok.experimental.Accessors;

/**
 * Rectangular agent body described by its half-extents in cell units.
 * <p>
 * {@code halfWidth} runs along the heading direction, {@code halfHeight} across it.
 * </p>
 */
@Value
@Accessors(fluent = true)
public class AgentGeometry {
    double halfWidth;
    double halfHeight;

    /**
     * Creates a geometry from half-extents.
     *
     * @throws IllegalArgumentException when an extent is non-finite or not positive.
     */
    public AgentGeometry(double halfWidth, double halfHeight) {
        this.halfWidth = requirePositive(halfWidth, "halfWidth");
        this.halfHeight = requirePositive(halfHeight, "halfHeight");
    }

    /**
     * Creates a geometry from full body size (width, height).
     */
    public static AgentGeometry fromSize(double width, double height) {
        return new AgentGeometry(width / 2.0d, height / 2.0d);
    }

    /**
     * Radius of the circle through the rectangle's corners.
     */
    public double circumradius() {
        return Math.hypot(halfWidth, halfHeight);
    }

    private static double requirePositive(double value, String name) {
        if (!Double.isFinite(value) || value <= 0.0d) {
            throw new IllegalArgumentException(name + " must be finite and > 0, got " + value);
        }
        return value;
    }
}
