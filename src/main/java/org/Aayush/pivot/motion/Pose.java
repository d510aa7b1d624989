package org.Aayush.pivot.motion;

import lombok.EqualsAndHashCode;
import lombok.Value;
import lombok.experimental.Accessors;
import org.Aayush.pivot.grid.GridPosition;

import java.util.Objects;

/**
 * Search state: agent cell, heading increment, and whether the move that produced this
 * pose was driven in reverse.
 * <p>
 * Identity is {@code (position, heading)} only. The {@code reverse} flag describes the
 * arriving move and is carried for costing and rendering, so a forward arrival and a
 * reverse arrival at the same cell and heading are the same visited state. Instances are
 * immutable and can be shared freely between search bookkeeping structures.
 * </p>
 */
@Value
@Accessors(fluent = true)
public class Pose {
    GridPosition position;
    int heading;
    @EqualsAndHashCode.Exclude
    boolean reverse;

    public Pose(GridPosition position, int heading, boolean reverse) {
        this.position = Objects.requireNonNull(position, "position");
        this.heading = heading;
        this.reverse = reverse;
    }

    /**
     * Creates a forward-driving pose.
     */
    public static Pose of(int x, int y, int heading) {
        return new Pose(new GridPosition(x, y), heading, false);
    }

    /**
     * Forward pose at a cell.
     */
    public static Pose of(GridPosition position, int heading) {
        return new Pose(position, heading, false);
    }

    /**
     * Column of the pose cell.
     */
    public int x() {
        return position.x();
    }

    /**
     * Row of the pose cell.
     */
    public int y() {
        return position.y();
    }
}
