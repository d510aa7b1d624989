package org.Aayush.pivot.heuristic;

import org.Aayush.pivot.grid.GridPosition;

/**
 * Heuristic provider contract used by the planner.
 *
 * <p>Providers are immutable and thread-safe. Binding returns an immutable goal-bound
 * estimator suitable for concurrent hot-path reads.</p>
 */
public interface HeuristicProvider {

    /**
     * @return heuristic mode of this provider.
     */
    HeuristicType type();

    /**
     * Binds a goal cell and returns a reusable estimator.
     *
     * @param goal goal cell; heading is irrelevant to reaching it.
     * @return immutable estimator bound to the goal.
     */
    GoalBoundHeuristic bindGoal(GridPosition goal);
}
