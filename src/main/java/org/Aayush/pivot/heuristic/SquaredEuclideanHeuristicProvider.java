package org.Aayush.pivot.heuristic;

import org.Aayush.pivot.grid.GridPosition;
import org.Aayush.pivot.grid.OccupancyGrid;
import org.Aayush.pivot.motion.Pose;

import java.util.Objects;

/**
 * Squared-distance heuristic provider.
 *
 * <p>Estimates {@code squared_distance(pose, goal) * K_HEUR}. Every edge moves at most one
 * cell per axis and costs at least {@code K_DIST}, so the true remaining cost is at least
 * {@code K_DIST * d / sqrt(2)} for Euclidean distance {@code d}. The estimate stays below
 * that bound, and the search stays optimal, while {@code d <= admissibilityRadius()}.</p>
 */
public final class SquaredEuclideanHeuristicProvider implements HeuristicProvider {
    private final OccupancyGrid grid;
    private final int heuristicWeight;
    private final int minimumEdgeCost;

    /**
     * Creates a squared-distance heuristic provider.
     *
     * @param grid grid used for goal bound validation.
     * @param heuristicWeight scale applied to squared distance.
     * @param minimumEdgeCost cheapest single edge of the paired cost model.
     */
    public SquaredEuclideanHeuristicProvider(OccupancyGrid grid, int heuristicWeight, int minimumEdgeCost) {
        this.grid = Objects.requireNonNull(grid, "grid");
        if (heuristicWeight < 0) {
            throw new IllegalArgumentException("heuristicWeight must be >= 0, got " + heuristicWeight);
        }
        if (minimumEdgeCost <= 0) {
            throw new IllegalArgumentException("minimumEdgeCost must be > 0, got " + minimumEdgeCost);
        }
        this.heuristicWeight = heuristicWeight;
        this.minimumEdgeCost = minimumEdgeCost;
    }

    @Override
    public HeuristicType type() {
        return HeuristicType.SQUARED_EUCLIDEAN;
    }

    @Override
    public GoalBoundHeuristic bindGoal(GridPosition goal) {
        validateGoal(goal);
        return new BoundSquaredEuclideanHeuristic(goal.x(), goal.y(), heuristicWeight);
    }

    /**
     * Largest goal distance (in cells) for which the estimate never overestimates.
     * Infinite when the heuristic weight is zero.
     */
    public double admissibilityRadius() {
        if (heuristicWeight == 0) {
            return Double.POSITIVE_INFINITY;
        }
        return minimumEdgeCost / (Math.sqrt(2.0d) * heuristicWeight);
    }

    /**
     * Returns whether every in-grid query is within the admissibility radius.
     */
    public boolean admissibleOver(OccupancyGrid target) {
        double diagonal = Math.hypot(target.width() - 1, target.height() - 1);
        return diagonal <= admissibilityRadius();
    }

    private void validateGoal(GridPosition goal) {
        Objects.requireNonNull(goal, "goal");
        if (!grid.inBounds(goal)) {
            throw new IllegalArgumentException(
                    "goal out of bounds: " + goal + " [" + grid.width() + "x" + grid.height() + "]"
            );
        }
    }

    private static final class BoundSquaredEuclideanHeuristic implements GoalBoundHeuristic {
        private final int goalX;
        private final int goalY;
        private final int heuristicWeight;

        private BoundSquaredEuclideanHeuristic(int goalX, int goalY, int heuristicWeight) {
            this.goalX = goalX;
            this.goalY = goalY;
            this.heuristicWeight = heuristicWeight;
        }

        @Override
        public int estimate(Pose pose) {
            long dx = (long) pose.x() - goalX;
            long dy = (long) pose.y() - goalY;
            long estimate = (dx * dx + dy * dy) * heuristicWeight;
            if (estimate > Integer.MAX_VALUE) {
                return Integer.MAX_VALUE;
            }
            return (int) estimate;
        }
    }
}
