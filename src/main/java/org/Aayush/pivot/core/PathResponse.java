package org.Aayush.pivot.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.Aayush.pivot.grid.GridPosition;
import org.Aayush.pivot.heuristic.HeuristicType;
import org.Aayush.pivot.motion.Pose;

import java.util.List;

/**
 * Client-facing path response.
 *
 * <p>When {@code reachable=false}, {@code path} and {@code footprints} are empty and
 * {@code totalCost} is {@code -1}.</p>
 */
@Value
@Builder
public class PathResponse {
    /** Whether the goal was reached. */
    boolean reachable;
    /** Total path cost in cost-model units. */
    int totalCost;
    /** Number of states expanded by the search. */
    int expandedStates;
    /** Heuristic bound for the query. */
    HeuristicType heuristicType;
    /** Poses from start to goal. */
    @Singular("pose")
    List<Pose> path;
    /** Absolute cells covered by the body at each pose, aligned with {@code path}. */
    @Singular("footprint")
    List<List<GridPosition>> footprints;
}
