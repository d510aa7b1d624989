package org.Aayush.pivot.agent;

import lombok.experimental.UtilityClass;

/**
 * Separating-axis overlap test between a rotated rectangle and one unit grid cell.
 * <p>
 * Candidate axes are the rectangle's two face normals and the two grid axes. The shapes
 * are disjoint iff their projections are separated on at least one axis. Projections
 * that merely touch (within {@link #TOUCH_EPSILON}) count as separated, so a body whose
 * edge lies exactly on a cell boundary does not claim the neighboring cell.
 * </p>
 */
@UtilityClass
final class SeparatingAxisOverlap {
    static final double TOUCH_EPSILON = 1e-9d;

    /**
     * Tests overlap between the cell {@code [cellX, cellX+1] x [cellY, cellY+1]} and a
     * rectangle centered at {@code (centerX, centerY)} rotated by {@code angle}.
     */
    static boolean overlaps(
            int cellX,
            int cellY,
            double centerX,
            double centerY,
            double halfWidth,
            double halfHeight,
            double angle
    ) {
        double cos = Math.cos(angle);
        double sin = Math.sin(angle);

        double[] rectXs = new double[4];
        double[] rectYs = new double[4];
        fillRectangleCorners(centerX, centerY, halfWidth, halfHeight, cos, sin, rectXs, rectYs);

        double[] cellXs = {cellX, cellX + 1.0d, cellX, cellX + 1.0d};
        double[] cellYs = {cellY, cellY, cellY + 1.0d, cellY + 1.0d};

        // rectangle face normals, then grid axes
        double[][] axes = {
                {cos, sin},
                {-sin, cos},
                {1.0d, 0.0d},
                {0.0d, 1.0d}
        };
        for (double[] axis : axes) {
            if (separatedOn(axis[0], axis[1], rectXs, rectYs, cellXs, cellYs)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Writes the four rotated corners of a rectangle about the given center.
     */
    static void fillRectangleCorners(
            double centerX,
            double centerY,
            double halfWidth,
            double halfHeight,
            double cos,
            double sin,
            double[] outXs,
            double[] outYs
    ) {
        double[] localXs = {-halfWidth, halfWidth, halfWidth, -halfWidth};
        double[] localYs = {-halfHeight, -halfHeight, halfHeight, halfHeight};
        for (int i = 0; i < 4; i++) {
            outXs[i] = centerX + localXs[i] * cos - localYs[i] * sin;
            outYs[i] = centerY + localXs[i] * sin + localYs[i] * cos;
        }
    }

    private static boolean separatedOn(
            double axisX,
            double axisY,
            double[] aXs,
            double[] aYs,
            double[] bXs,
            double[] bYs
    ) {
        double aMin = Double.POSITIVE_INFINITY;
        double aMax = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < aXs.length; i++) {
            double projection = aXs[i] * axisX + aYs[i] * axisY;
            aMin = Math.min(aMin, projection);
            aMax = Math.max(aMax, projection);
        }
        double bMin = Double.POSITIVE_INFINITY;
        double bMax = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < bXs.length; i++) {
            double projection = bXs[i] * axisX + bYs[i] * axisY;
            bMin = Math.min(bMin, projection);
            bMax = Math.max(bMax, projection);
        }
        return aMax <= bMin + TOUCH_EPSILON || bMax <= aMin + TOUCH_EPSILON;
    }
}
