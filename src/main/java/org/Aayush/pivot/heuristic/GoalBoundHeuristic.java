package org.Aayush.pivot.heuristic;

import org.Aayush.pivot.motion.Pose;

/**
 * Immutable goal-bound heuristic estimator.
 *
 * <p>Hot path contract: {@link #estimate(Pose)} must avoid allocations.</p>
 */
@FunctionalInterface
public interface GoalBoundHeuristic {

    /**
     * Estimates remaining cost from a pose to the pre-bound goal cell.
     *
     * @param pose search state.
     * @return non-negative estimate.
     */
    int estimate(Pose pose);
}
