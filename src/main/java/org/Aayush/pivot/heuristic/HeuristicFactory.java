package org.Aayush.pivot.heuristic;

import lombok.experimental.UtilityClass;
import org.Aayush.pivot.cost.MotionCostModel;
import org.Aayush.pivot.grid.OccupancyGrid;

/**
 * Strict heuristic factory.
 *
 * <p>Centralizes validation so every provider is created against the same grid and cost
 * contracts, with deterministic failure reason codes.</p>
 */
@UtilityClass
public final class HeuristicFactory {
    public static final String REASON_TYPE_REQUIRED = "H_TYPE_REQUIRED";
    public static final String REASON_GRID_REQUIRED = "H_GRID_REQUIRED";
    public static final String REASON_COST_MODEL_REQUIRED = "H_COST_MODEL_REQUIRED";

    /**
     * Creates a heuristic provider.
     *
     * @param type requested heuristic type.
     * @param grid occupancy grid queries will run against.
     * @param costModel cost model the heuristic is paired with.
     * @return initialized heuristic provider.
     */
    public static HeuristicProvider create(HeuristicType type, OccupancyGrid grid, MotionCostModel costModel) {
        if (type == null) {
            throw new HeuristicConfigurationException(
                    REASON_TYPE_REQUIRED,
                    "heuristic type must be explicitly specified (NONE, SQUARED_EUCLIDEAN)"
            );
        }
        if (grid == null) {
            throw new HeuristicConfigurationException(REASON_GRID_REQUIRED, "grid must be provided");
        }
        if (costModel == null) {
            throw new HeuristicConfigurationException(REASON_COST_MODEL_REQUIRED, "costModel must be provided");
        }

        return switch (type) {
            case NONE -> new NullHeuristicProvider(grid);
            case SQUARED_EUCLIDEAN -> new SquaredEuclideanHeuristicProvider(
                    grid,
                    costModel.config().getHeuristicWeight(),
                    costModel.minimumEdgeCost()
            );
        };
    }
}
