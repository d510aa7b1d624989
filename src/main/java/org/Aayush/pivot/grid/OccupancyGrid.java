package org.Aayush.pivot.grid;

import java.util.Objects;

/**
 * Fixed-size blocked/free map over a {@code width x height} cell lattice.
 * <p>
 * Cells are stored row-major in a {@link BitArray} ({@code index = y * width + x}); a set
 * bit means blocked. Coordinates outside {@code [0,width) x [0,height)} are reported as
 * blocked rather than rejected, so planners can probe footprints near the border without
 * bounds checks of their own.
 * </p>
 * <p>
 * The grid is mutated only by its owner between queries. Searches read it and assume no
 * concurrent writer.
 * </p>
 */
public final class OccupancyGrid {
    public static final char BLOCKED_GLYPH = '#';
    public static final char FREE_GLYPH = '.';

    private final int width;
    private final int height;
    private final BitArray cells;

    /**
     * Creates an all-free grid.
     *
     * @param width column count, must be positive.
     * @param height row count, must be positive.
     */
    public OccupancyGrid(int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException(
                    "grid dimensions must be positive, got " + width + "x" + height
            );
        }
        this.width = width;
        this.height = height;
        this.cells = new BitArray(Math.multiplyExact(width, height));
    }

    /**
     * Parses a grid from text rows, {@code '#'} blocked and {@code '.'} free.
     * All rows must have the same length; row {@code 0} is {@code y = 0}.
     */
    public static OccupancyGrid fromAscii(String... rows) {
        Objects.requireNonNull(rows, "rows");
        if (rows.length == 0) {
            throw new IllegalArgumentException("at least one row is required");
        }
        int width = rows[0].length();
        OccupancyGrid grid = new OccupancyGrid(width, rows.length);
        for (int y = 0; y < rows.length; y++) {
            String row = Objects.requireNonNull(rows[y], "row " + y);
            if (row.length() != width) {
                throw new IllegalArgumentException(
                        "row " + y + " has length " + row.length() + ", expected " + width
                );
            }
            for (int x = 0; x < width; x++) {
                char glyph = row.charAt(x);
                if (glyph == BLOCKED_GLYPH) {
                    grid.setBlocked(x, y, true);
                } else if (glyph != FREE_GLYPH) {
                    throw new IllegalArgumentException(
                            "unexpected glyph '" + glyph + "' at (" + x + "," + y + ")"
                    );
                }
            }
        }
        return grid;
    }

    /**
     * Number of columns.
     */
    public int width() {
        return width;
    }

    /**
     * Number of rows.
     */
    public int height() {
        return height;
    }

    /**
     * Total number of cells, {@code width * height}.
     */
    public int cellCount() {
        return cells.length();
    }

    /**
     * Returns whether {@code (x,y)} lies inside the grid.
     */
    public boolean inBounds(int x, int y) {
        return x >= 0 && x < width && y >= 0 && y < height;
    }

    /**
     * Returns whether a position lies inside the grid.
     */
    public boolean inBounds(GridPosition position) {
        return inBounds(position.x(), position.y());
    }

    /**
     * Returns {@code true} if the cell is blocked or outside the grid.
     */
    public boolean isBlocked(int x, int y) {
        if (!inBounds(x, y)) {
            return true;
        }
        return cells.get(index(x, y));
    }

    /**
     * Returns whether a position is blocked. Out-of-bounds positions are blocked.
     */
    public boolean isBlocked(GridPosition position) {
        return isBlocked(position.x(), position.y());
    }

    /**
     * Flips one in-bounds cell.
     *
     * @throws IndexOutOfBoundsException if {@code (x,y)} is outside the grid.
     */
    public void toggle(int x, int y) {
        cells.toggle(checkedIndex(x, y));
    }

    /**
     * Writes one in-bounds cell.
     *
     * @throws IndexOutOfBoundsException if {@code (x,y)} is outside the grid.
     */
    public void setBlocked(int x, int y, boolean blocked) {
        cells.set(checkedIndex(x, y), blocked);
    }

    /**
     * Row-major bit index of an in-bounds cell.
     */
    public int index(int x, int y) {
        return y * width + x;
    }

    /**
     * Inverse of {@link #index(int, int)}.
     */
    public GridPosition xy(int index) {
        if (index < 0 || index >= cells.length()) {
            throw new IndexOutOfBoundsException("cell index " + index + " out of range [0, " + cells.length() + ")");
        }
        return new GridPosition(index % width, index / width);
    }

    /**
     * @return number of blocked in-bounds cells.
     */
    public int blockedCount() {
        return cells.cardinality();
    }

    /**
     * Renders the grid using the same glyphs accepted by {@link #fromAscii(String...)}.
     */
    public String toAscii() {
        StringBuilder out = new StringBuilder((width + 1) * height);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                out.append(cells.get(index(x, y)) ? BLOCKED_GLYPH : FREE_GLYPH);
            }
            out.append('\n');
        }
        return out.toString();
    }

    private int checkedIndex(int x, int y) {
        if (!inBounds(x, y)) {
            throw new IndexOutOfBoundsException(
                    "cell (" + x + "," + y + ") outside grid " + width + "x" + height
            );
        }
        return index(x, y);
    }
}
