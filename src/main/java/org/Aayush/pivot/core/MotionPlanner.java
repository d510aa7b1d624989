package org.Aayush.pivot.core;

import lombok.Builder;
import org.Aayush.pivot.agent.AgentGeometry;
import org.Aayush.pivot.agent.FootprintCache;
import org.Aayush.pivot.cost.MotionCostModel;
import org.Aayush.pivot.grid.GridPosition;
import org.Aayush.pivot.grid.OccupancyGrid;
import org.Aayush.pivot.heuristic.GoalBoundHeuristic;
import org.Aayush.pivot.heuristic.HeuristicConfigurationException;
import org.Aayush.pivot.heuristic.HeuristicFactory;
import org.Aayush.pivot.heuristic.HeuristicProvider;
import org.Aayush.pivot.heuristic.SquaredEuclideanHeuristicProvider;
import org.Aayush.pivot.motion.MotionConfigurationException;
import org.Aayush.pivot.motion.MotionTemplate;
import org.Aayush.pivot.motion.MotionTemplateCache;
import org.Aayush.pivot.motion.Pose;
import org.Aayush.pivot.search.BestFirstSearch;
import org.Aayush.pivot.search.NeighborExpander;
import org.Aayush.pivot.search.SearchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Main planning entry point.
 *
 * <p>The facade binds one occupancy grid to one agent configuration. Construction builds
 * every precomputed table once:</p>
 * <ul>
 * <li>per-heading footprints of the agent body,</li>
 * <li>per-heading motion templates,</li>
 * <li>the edge cost model and the heuristic provider.</li>
 * </ul>
 * <p>Queries borrow these tables read-only, so one planner may serve concurrent queries as
 * long as the grid is not edited meanwhile. Configuration failures are normalized to
 * {@link PlannerException} with stable reason codes.</p>
 */
public final class MotionPlanner implements PlannerService {
    private static final Logger log = LoggerFactory.getLogger(MotionPlanner.class);

    public static final String REASON_REQUEST_REQUIRED = "P_REQUEST_REQUIRED";
    public static final String REASON_START_REQUIRED = "P_START_REQUIRED";
    public static final String REASON_GOAL_REQUIRED = "P_GOAL_REQUIRED";
    public static final String REASON_HEADING_OUT_OF_RANGE = "P_HEADING_OUT_OF_RANGE";
    public static final String REASON_START_OUT_OF_BOUNDS = "P_START_OUT_OF_BOUNDS";
    public static final String REASON_GOAL_OUT_OF_BOUNDS = "P_GOAL_OUT_OF_BOUNDS";
    public static final String REASON_INVALID_DISCRETIZATION = "P_INVALID_DISCRETIZATION";
    public static final String REASON_INVALID_GEOMETRY = "P_INVALID_GEOMETRY";
    public static final String REASON_ZERO_OFFSET_TEMPLATE = "P_ZERO_OFFSET_TEMPLATE";
    public static final String REASON_INVALID_COST_MODEL = "P_INVALID_COST_MODEL";
    public static final String REASON_GRID_REQUIRED = "P_GRID_REQUIRED";
    public static final String REASON_HEURISTIC_CONFIGURATION_FAILED = "P_HEURISTIC_CONFIGURATION_FAILED";

    private final OccupancyGrid grid;
    private final PlannerConfig config;
    private final FootprintCache footprints;
    private final MotionTemplateCache templates;
    private final MotionCostModel costModel;
    private final HeuristicProvider heuristicProvider;
    private final int capacityHint;

    /**
     * Creates a planner over a grid.
     *
     * @param grid occupancy grid; edits after construction are seen by later queries.
     * @param config planner configuration, defaults when {@code null}.
     * @throws PlannerException when the grid is missing or the configuration is invalid.
     */
    @Builder
    public MotionPlanner(OccupancyGrid grid, PlannerConfig config) {
        if (grid == null) {
            throw new PlannerException(REASON_GRID_REQUIRED, "grid must be provided");
        }
        this.grid = grid;
        this.config = config == null ? PlannerConfig.defaults() : config;
        this.templates = buildTemplates(this.config);
        this.footprints = new FootprintCache(buildGeometry(this.config), this.config.getMaxIncrements());
        this.costModel = buildCostModel(this.config);
        this.heuristicProvider = buildHeuristic(this.config, grid, costModel);
        this.capacityHint = capacityHint(grid, this.config.getMaxIncrements());
        if (log.isDebugEnabled()) {
            log.debug("Planner over {}x{} grid: {} headings, arc {}, {} templates, largest footprint {} cells, heuristic {}",
                    grid.width(), grid.height(), templates.maxIncrements(), templates.arc(),
                    templates.templateCount(), footprints.largestFootprint(), heuristicProvider.type());
        }

        if (heuristicProvider instanceof SquaredEuclideanHeuristicProvider squared
                && !squared.admissibleOver(grid)) {
            log.warn("Grid {}x{} exceeds heuristic admissibility radius {} cells; "
                            + "long queries may return near-optimal paths",
                    grid.width(), grid.height(), String.format("%.1f", squared.admissibilityRadius()));
        }
    }

    /**
     * Creates a planner with the default configuration.
     */
    public MotionPlanner(OccupancyGrid grid) {
        this(grid, null);
    }

    /**
     * Finds the cheapest kinematically feasible path from a start pose to a goal cell.
     *
     * <p>Any heading is accepted on arrival. A start whose footprint is blocked cannot
     * move and yields no path.</p>
     *
     * @param start start cell.
     * @param startHeading start heading increment in {@code [0, maxIncrements)}.
     * @param goal goal cell.
     * @return path and total cost, or empty when the goal is unreachable.
     * @throws PlannerException when an argument is missing or out of range.
     */
    public Optional<PlannedPath> findPath(GridPosition start, int startHeading, GridPosition goal) {
        validateQuery(start, startHeading, goal);

        Pose startPose = Pose.of(start, startHeading);
        if (footprints.collides(grid, start, startHeading)) {
            log.debug("Start {} heading {} collides; no path", start, startHeading);
            return Optional.empty();
        }

        GoalBoundHeuristic heuristic = bindGoal(goal);
        NeighborExpander<Pose> expander = (current, sink) -> {
            List<MotionTemplate> moves = templates.templatesFor(current.heading());
            for (int i = 0; i < moves.size(); i++) {
                Pose next = moves.get(i).applyTo(current);
                if (footprints.collides(grid, next.position(), next.heading())) {
                    continue;
                }
                sink.accept(next, costModel.cost(next, current));
            }
        };

        Optional<SearchResult<Pose>> result = BestFirstSearch.search(
                startPose,
                capacityHint,
                expander,
                heuristic::estimate,
                pose -> pose.position().equals(goal)
        );

        if (result.isEmpty()) {
            log.debug("No path {} -> {} (heading {})", start, goal, startHeading);
            return Optional.empty();
        }
        SearchResult<Pose> found = result.get();
        log.debug("Path {} -> {}: cost {}, {} poses, {} expanded, {} generated",
                start, goal, found.totalCost(), found.path().size(),
                found.expandedStates(), found.generatedNodes());
        return Optional.of(new PlannedPath(found.path(), found.totalCost(), found.expandedStates()));
    }

    /**
     * Executes one client request.
     *
     * @param request path request.
     * @return response with path poses and per-pose footprint cells when reachable.
     * @throws PlannerException when request contracts fail.
     */
    @Override
    public PathResponse plan(PathRequest request) {
        if (request == null) {
            throw new PlannerException(REASON_REQUEST_REQUIRED, "request must be provided");
        }
        if (request.getStartHeading() == null) {
            throw new PlannerException(REASON_HEADING_OUT_OF_RANGE, "startHeading must be provided");
        }

        Optional<PlannedPath> planned = findPath(request.getStart(), request.getStartHeading(), request.getGoal());
        PathResponse.PathResponseBuilder builder = PathResponse.builder()
                .heuristicType(heuristicProvider.type());
        if (planned.isEmpty()) {
            return builder.reachable(false).totalCost(-1).build();
        }

        PlannedPath path = planned.get();
        builder.reachable(true)
                .totalCost(path.totalCost())
                .expandedStates(path.expandedStates());
        for (Pose pose : path.poses()) {
            builder.pose(pose);
            builder.footprint(footprints.footprint(pose.position(), pose.heading()));
        }
        return builder.build();
    }

    /**
     * Occupancy grid the planner reads on every query.
     */
    public OccupancyGrid grid() {
        return grid;
    }

    /**
     * Effective configuration, with defaults applied.
     */
    public PlannerConfig config() {
        return config;
    }

    /**
     * Per-heading footprints of the configured agent body.
     */
    public FootprintCache footprints() {
        return footprints;
    }

    /**
     * Per-heading motion templates.
     */
    public MotionTemplateCache templates() {
        return templates;
    }

    /**
     * Edge cost model used by the search.
     */
    public MotionCostModel costModel() {
        return costModel;
    }

    private void validateQuery(GridPosition start, int startHeading, GridPosition goal) {
        if (start == null) {
            throw new PlannerException(REASON_START_REQUIRED, "start must be provided");
        }
        if (goal == null) {
            throw new PlannerException(REASON_GOAL_REQUIRED, "goal must be provided");
        }
        if (startHeading < 0 || startHeading >= config.getMaxIncrements()) {
            throw new PlannerException(
                    REASON_HEADING_OUT_OF_RANGE,
                    "startHeading " + startHeading + " out of range [0, " + config.getMaxIncrements() + ")"
            );
        }
        if (!grid.inBounds(start)) {
            throw new PlannerException(
                    REASON_START_OUT_OF_BOUNDS,
                    "start " + start + " outside grid " + grid.width() + "x" + grid.height()
            );
        }
        if (!grid.inBounds(goal)) {
            throw new PlannerException(
                    REASON_GOAL_OUT_OF_BOUNDS,
                    "goal " + goal + " outside grid " + grid.width() + "x" + grid.height()
            );
        }
    }

    private GoalBoundHeuristic bindGoal(GridPosition goal) {
        try {
            return heuristicProvider.bindGoal(goal);
        } catch (IllegalArgumentException ex) {
            throw new PlannerException(REASON_GOAL_OUT_OF_BOUNDS, ex.getMessage(), ex);
        }
    }

    private static MotionTemplateCache buildTemplates(PlannerConfig config) {
        try {
            return new MotionTemplateCache(config.getMaxIncrements(), config.getArc());
        } catch (MotionConfigurationException ex) {
            String reason = MotionTemplateCache.REASON_ZERO_OFFSET.equals(ex.reasonCode())
                    ? REASON_ZERO_OFFSET_TEMPLATE
                    : REASON_INVALID_DISCRETIZATION;
            throw new PlannerException(reason, ex.getMessage(), ex);
        }
    }

    private static AgentGeometry buildGeometry(PlannerConfig config) {
        try {
            return config.geometry();
        } catch (IllegalArgumentException ex) {
            throw new PlannerException(REASON_INVALID_GEOMETRY, ex.getMessage(), ex);
        }
    }

    private static MotionCostModel buildCostModel(PlannerConfig config) {
        if (config.getCostModel() == null) {
            throw new PlannerException(REASON_INVALID_COST_MODEL, "costModel must be provided");
        }
        try {
            return new MotionCostModel(config.getCostModel(), config.getMaxIncrements());
        } catch (IllegalArgumentException ex) {
            throw new PlannerException(REASON_INVALID_COST_MODEL, ex.getMessage(), ex);
        }
    }

    private static HeuristicProvider buildHeuristic(
            PlannerConfig config,
            OccupancyGrid grid,
            MotionCostModel costModel
    ) {
        try {
            return HeuristicFactory.create(config.getHeuristicType(), grid, costModel);
        } catch (HeuristicConfigurationException ex) {
            throw new PlannerException(REASON_HEURISTIC_CONFIGURATION_FAILED, ex.getMessage(), ex);
        }
    }

    private static int capacityHint(OccupancyGrid grid, int maxIncrements) {
        long states = (long) grid.cellCount() * maxIncrements;
        return (int) Math.min(states, 1 << 20);
    }
}
