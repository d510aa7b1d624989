package org.Aayush.pivot.grid;

/**
 * Integer cell coordinate, also used as a relative cell offset.
 *
 * @param x column.
 * @param y row.
 */
public record GridPosition(int x, int y) {

    public static final GridPosition ORIGIN = new GridPosition(0, 0);

    /**
     * Creates a position.
     */
    public static GridPosition of(int x, int y) {
        return new GridPosition(x, y);
    }

    /**
     * Translates this position by an offset.
     */
    public GridPosition plus(GridPosition offset) {
        return new GridPosition(x + offset.x, y + offset.y);
    }

    /**
     * Returns whether this is the {@code (0,0)} offset.
     */
    public boolean isZero() {
        return x == 0 && y == 0;
    }

    /**
     * Squared Euclidean distance to another position.
     */
    public int squaredDistanceTo(GridPosition other) {
        int dx = other.x - x;
        int dy = other.y - y;
        return dx * dx + dy * dy;
    }

    @Override
    public String toString() {
        return "(" + x + "," + y + ")";
    }
}
