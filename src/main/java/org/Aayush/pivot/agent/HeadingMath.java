package org.Aayush.pivot.agent;

import lombok.experimental.UtilityClass;
import org.Aayush.pivot.grid.GridPosition;

/**
 * Modular arithmetic over discretized headings.
 * <p>
 * A heading is an increment in {@code [0, maxIncrements)}; increment {@code i} points at
 * angle {@code i * 2*PI / maxIncrements}, measured from the +x axis toward +y.
 * </p>
 */
@UtilityClass
public final class HeadingMath {

    /**
     * Wraps any integer heading into {@code [0, maxIncrements)}.
     */
    public static int clampHeading(int heading, int maxIncrements) {
        return Math.floorMod(heading, maxIncrements);
    }

    /**
     * Heading pointing the opposite way ({@code +maxIncrements/2}).
     */
    public static int oppositeHeading(int heading, int maxIncrements) {
        return clampHeading(heading + maxIncrements / 2, maxIncrements);
    }

    /**
     * Shortest rotation between two headings, in increments, in {@code [0, maxIncrements/2]}.
     */
    public static int rotationBetween(int from, int to, int maxIncrements) {
        int clockwise = Math.floorMod(to - from, maxIncrements);
        int counterClockwise = Math.floorMod(from - to, maxIncrements);
        return Math.min(clockwise, counterClockwise);
    }

    /**
     * Angle of one increment in radians.
     */
    public static double incrementSize(int maxIncrements) {
        return 2.0d * Math.PI / maxIncrements;
    }

    /**
     * Angle of a heading in radians.
     */
    public static double angleOf(int heading, int maxIncrements) {
        return heading * incrementSize(maxIncrements);
    }

    /**
     * Neighbor-cell step for a direction angle: the rounded unit vector, each axis
     * clamped to {@code {-1, 0, 1}}.
     */
    public static GridPosition stepFor(double angle) {
        int x = clampUnit(Math.round(Math.cos(angle)));
        int y = clampUnit(Math.round(Math.sin(angle)));
        return new GridPosition(x, y);
    }

    private static int clampUnit(long value) {
        if (value < -1L) {
            return -1;
        }
        if (value > 1L) {
            return 1;
        }
        return (int) value;
    }
}
