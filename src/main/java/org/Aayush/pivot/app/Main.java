package org.Aayush.pivot.app;

import org.Aayush.pivot.core.MotionPlanner;
import org.Aayush.pivot.core.PlannedPath;
import org.Aayush.pivot.core.PlannerConfig;
import org.Aayush.pivot.grid.GridPosition;
import org.Aayush.pivot.grid.OccupancyGrid;
import org.Aayush.pivot.motion.Pose;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Minimal application entry point used for local smoke runs.
 *
 * <p>Plans across a small walled grid and logs the grid with the path drawn over it.
 * Planner settings come from {@code pivot.planner.*} system properties.</p>
 */
public class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static final char PATH_GLYPH = 'o';
    static final char REVERSE_GLYPH = 'r';
    static final char START_GLYPH = 'S';
    static final char GOAL_GLYPH = 'G';

    static final String[] DEMO_GRID = {
            "............",
            "............",
            "....#.......",
            "....#.......",
            "....#####...",
            "........#...",
            "........#...",
            "............",
    };

    /**
     * Launches the demo query.
     *
     * @param args ignored.
     */
    public static void main(String[] args) {
        OccupancyGrid grid = OccupancyGrid.fromAscii(DEMO_GRID);
        GridPosition start = GridPosition.of(1, 6);
        GridPosition goal = GridPosition.of(10, 1);
        Optional<PlannedPath> path = run(grid, PlannerConfig.fromSystemProperties(), start, 0, goal);

        if (path.isEmpty()) {
            log.info("No path from {} to {}", start, goal);
            log.info("\n{}", grid.toAscii());
            return;
        }
        PlannedPath found = path.get();
        log.info("Path from {} to {}: {} moves, cost {}", start, goal, found.moveCount(), found.totalCost());
        for (Pose pose : found.poses()) {
            log.info("  {} heading {}{}", pose.position(), pose.heading(), pose.reverse() ? " (reverse)" : "");
        }
        log.info("\n{}", render(grid, found));
    }

    static Optional<PlannedPath> run(
            OccupancyGrid grid,
            PlannerConfig config,
            GridPosition start,
            int startHeading,
            GridPosition goal
    ) {
        return new MotionPlanner(grid, config).findPath(start, startHeading, goal);
    }

    /**
     * Draws the path over the grid's ASCII form, one row per {@code y}.
     */
    static String render(OccupancyGrid grid, PlannedPath path) {
        String[] rows = grid.toAscii().split("\n");
        char[][] canvas = new char[rows.length][];
        for (int y = 0; y < rows.length; y++) {
            canvas[y] = rows[y].toCharArray();
        }
        for (Pose pose : path.poses()) {
            canvas[pose.y()][pose.x()] = pose.reverse() ? REVERSE_GLYPH : PATH_GLYPH;
        }
        Pose start = path.start();
        Pose end = path.end();
        canvas[start.y()][start.x()] = START_GLYPH;
        canvas[end.y()][end.x()] = GOAL_GLYPH;

        StringBuilder out = new StringBuilder();
        for (int y = 0; y < canvas.length; y++) {
            if (y > 0) {
                out.append('\n');
            }
            out.append(canvas[y]);
        }
        return out.toString();
    }
}
