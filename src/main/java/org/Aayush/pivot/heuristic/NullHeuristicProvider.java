package org.Aayush.pivot.heuristic;

import org.Aayush.pivot.grid.GridPosition;
import org.Aayush.pivot.grid.OccupancyGrid;

import java.util.Objects;

/**
 * Null heuristic provider.
 *
 * <p>Always returns zero estimates and therefore behaves like uniform-cost search while
 * still honoring goal bound checks.</p>
 */
public final class NullHeuristicProvider implements HeuristicProvider {
    private static final GoalBoundHeuristic ZERO = pose -> 0;

    private final OccupancyGrid grid;

    public NullHeuristicProvider(OccupancyGrid grid) {
        this.grid = Objects.requireNonNull(grid, "grid");
    }

    @Override
    public HeuristicType type() {
        return HeuristicType.NONE;
    }

    @Override
    public GoalBoundHeuristic bindGoal(GridPosition goal) {
        Objects.requireNonNull(goal, "goal");
        if (!grid.inBounds(goal)) {
            throw new IllegalArgumentException(
                    "goal out of bounds: " + goal + " [" + grid.width() + "x" + grid.height() + "]"
            );
        }
        return ZERO;
    }
}
