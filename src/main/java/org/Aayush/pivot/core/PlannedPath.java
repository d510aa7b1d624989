package org.Aayush.pivot.core;

import org.Aayush.pivot.motion.Pose;

import java.util.List;

/**
 * Path found by {@link MotionPlanner#findPath}.
 *
 * @param poses poses from start to goal, inclusive.
 * @param totalCost summed edge cost.
 * @param expandedStates states expanded by the search.
 */
public record PlannedPath(List<Pose> poses, int totalCost, int expandedStates) {

    public PlannedPath {
        poses = List.copyOf(poses);
    }

    /**
     * First pose of the path.
     */
    public Pose start() {
        return poses.get(0);
    }

    /**
     * Last pose of the path, on the goal cell.
     */
    public Pose end() {
        return poses.get(poses.size() - 1);
    }

    /**
     * Number of moves (edges) along the path.
     */
    public int moveCount() {
        return poses.size() - 1;
    }
}
