package org.Aayush.pivot.agent;

import org.Aayush.pivot.grid.GridPosition;
import org.Aayush.pivot.grid.OccupancyGrid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Per-heading cell footprint of a rotated rectangular agent.
 * <p>
 * Bodies that fit inside one cell at every heading (circumradius at most half a cell)
 * sit at the cell center and degrade to the single offset {@code (0,0)}.
 * </p>
 * <p>
 * Larger bodies are anchored at the far vertex of the agent's cell, {@code (1, 1)} in
 * cell-local coordinates, so an axis-aligned body spanning up to two cells covers exactly
 * the {@code {0,1} x {0,1}} block. For every heading increment the build:
 * </p>
 * <ol>
 * <li>rotates the four body corners about the anchor,</li>
 * <li>takes their bounding box and scans every cell it touches, from
 * {@code floor(min)} to {@code floor(max)} on each axis,</li>
 * <li>keeps each scanned cell that the rotated body overlaps with positive area
 * ({@link SeparatingAxisOverlap}).</li>
 * </ol>
 * <p>
 * The result is every cell the body physically overlaps. The cache is immutable once
 * built and safe to share across threads.
 * </p>
 */
public final class FootprintCache {
    private static final Logger log = LoggerFactory.getLogger(FootprintCache.class);

    /** Largest circumradius still treated as a single-cell body. */
    static final double SINGLE_CELL_RADIUS = 0.5d;
    /** Cell-local anchor of multi-cell bodies. */
    static final double ANCHOR = 1.0d;
    private static final List<GridPosition> SINGLE_CELL = List.of(GridPosition.ORIGIN);

    private final AgentGeometry geometry;
    private final int maxIncrements;
    private final List<List<GridPosition>> footprints;
    private final int largestFootprint;

    /**
     * Builds footprints for every heading increment.
     *
     * @param geometry agent body.
     * @param maxIncrements heading discretization, must be positive.
     */
    public FootprintCache(AgentGeometry geometry, int maxIncrements) {
        this.geometry = Objects.requireNonNull(geometry, "geometry");
        if (maxIncrements <= 0) {
            throw new IllegalArgumentException("maxIncrements must be > 0, got " + maxIncrements);
        }
        this.maxIncrements = maxIncrements;

        List<List<GridPosition>> built = new ArrayList<>(maxIncrements);
        boolean fitsOneCell = geometry.circumradius() <= SINGLE_CELL_RADIUS;
        int largest = 0;
        for (int heading = 0; heading < maxIncrements; heading++) {
            List<GridPosition> footprint = fitsOneCell
                    ? SINGLE_CELL
                    : buildFootprint(HeadingMath.angleOf(heading, maxIncrements));
            largest = Math.max(largest, footprint.size());
            built.add(footprint);
        }
        this.footprints = Collections.unmodifiableList(built);
        this.largestFootprint = largest;

        if (log.isDebugEnabled()) {
            log.debug("Built footprints for {} headings, body {}x{} half-extents, largest {} cells",
                    maxIncrements, geometry.halfWidth(), geometry.halfHeight(), largest);
        }
    }

    /**
     * Cell offsets covered by the body at a heading, relative to the agent's cell.
     *
     * @throws IllegalArgumentException when heading is outside {@code [0, maxIncrements)}.
     */
    public List<GridPosition> rotationFootprint(int heading) {
        validateHeading(heading);
        return footprints.get(heading);
    }

    /**
     * Absolute cells covered by the body standing at {@code position}.
     */
    public List<GridPosition> footprint(GridPosition position, int heading) {
        List<GridPosition> offsets = rotationFootprint(heading);
        List<GridPosition> cells = new ArrayList<>(offsets.size());
        for (GridPosition offset : offsets) {
            cells.add(position.plus(offset));
        }
        return cells;
    }

    /**
     * Returns whether any covered cell is blocked (out-of-bounds counts as blocked).
     */
    public boolean collides(OccupancyGrid grid, GridPosition position, int heading) {
        List<GridPosition> offsets = rotationFootprint(heading);
        for (int i = 0; i < offsets.size(); i++) {
            GridPosition offset = offsets.get(i);
            if (grid.isBlocked(position.x() + offset.x(), position.y() + offset.y())) {
                return true;
            }
        }
        return false;
    }

    /**
     * Agent body the footprints were built for.
     */
    public AgentGeometry geometry() {
        return geometry;
    }

    /**
     * Number of discrete headings covered.
     */
    public int maxIncrements() {
        return maxIncrements;
    }

    /**
     * Cell count of the widest footprint over all headings.
     */
    public int largestFootprint() {
        return largestFootprint;
    }

    private List<GridPosition> buildFootprint(double angle) {
        double halfWidth = geometry.halfWidth();
        double halfHeight = geometry.halfHeight();
        double cos = Math.cos(angle);
        double sin = Math.sin(angle);

        double[] cornerXs = new double[4];
        double[] cornerYs = new double[4];
        SeparatingAxisOverlap.fillRectangleCorners(ANCHOR, ANCHOR, halfWidth, halfHeight, cos, sin, cornerXs, cornerYs);

        double minX = Double.POSITIVE_INFINITY;
        double maxX = Double.NEGATIVE_INFINITY;
        double minY = Double.POSITIVE_INFINITY;
        double maxY = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < 4; i++) {
            minX = Math.min(minX, cornerXs[i]);
            maxX = Math.max(maxX, cornerXs[i]);
            minY = Math.min(minY, cornerYs[i]);
            maxY = Math.max(maxY, cornerYs[i]);
        }

        int fromX = (int) Math.floor(minX);
        int toX = (int) Math.floor(maxX);
        int fromY = (int) Math.floor(minY);
        int toY = (int) Math.floor(maxY);

        List<GridPosition> footprint = new ArrayList<>((toX - fromX + 1) * (toY - fromY + 1));
        for (int x = fromX; x <= toX; x++) {
            for (int y = fromY; y <= toY; y++) {
                if (SeparatingAxisOverlap.overlaps(x, y, ANCHOR, ANCHOR, halfWidth, halfHeight, angle)) {
                    footprint.add(new GridPosition(x, y));
                }
            }
        }
        return List.copyOf(footprint);
    }

    private void validateHeading(int heading) {
        if (heading < 0 || heading >= maxIncrements) {
            throw new IllegalArgumentException(
                    "heading out of range: " + heading + " [0, " + maxIncrements + ")"
            );
        }
    }
}
