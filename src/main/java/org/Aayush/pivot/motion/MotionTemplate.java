package org.Aayush.pivot.motion;

import org.Aayush.pivot.grid.GridPosition;

/**
 * One precomputed motion primitive: a single-cell step and the heading held after it.
 *
 * @param offset neighbor-cell step, each axis in {@code {-1, 0, 1}}, never {@code (0,0)}.
 * @param targetHeading heading after the move.
 * @param reverse whether the move is driven backwards.
 */
public record MotionTemplate(GridPosition offset, int targetHeading, boolean reverse) {

    /**
     * Applies this primitive to a pose.
     */
    public Pose applyTo(Pose from) {
        return new Pose(from.position().plus(offset), targetHeading, reverse);
    }
}
