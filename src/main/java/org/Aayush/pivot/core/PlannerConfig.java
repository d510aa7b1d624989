package org.Aayush.pivot.core;

import lombok.Builder;
import lombok.Value;
import org.Aayush.pivot.agent.AgentGeometry;
import org.Aayush.pivot.cost.CostModelConfig;
import org.Aayush.pivot.heuristic.HeuristicType;

import java.util.Locale;

/**
 * Planner configuration bound once at construction.
 *
 * <p>Defaults describe an eight-heading agent turning at most one increment per step with
 * a body smaller than one cell.</p>
 */
@Value
@Builder(toBuilder = true)
public class PlannerConfig {
    static final String PROP_MAX_INCREMENTS = "pivot.planner.maxIncrements";
    static final String PROP_ARC = "pivot.planner.arc";
    static final String PROP_HALF_WIDTH = "pivot.planner.halfWidth";
    static final String PROP_HALF_HEIGHT = "pivot.planner.halfHeight";
    static final String PROP_HEURISTIC = "pivot.planner.heuristic";

    static final int DEFAULT_MAX_INCREMENTS = 8;
    static final int DEFAULT_ARC = 1;
    static final double DEFAULT_HALF_EXTENT = 0.25d;

    /** Heading discretization count. */
    @Builder.Default
    int maxIncrements = DEFAULT_MAX_INCREMENTS;

    /** Maximum forward turn per step, in increments. */
    @Builder.Default
    int arc = DEFAULT_ARC;

    /** Body half-extent along the heading, in cells. */
    @Builder.Default
    double halfWidth = DEFAULT_HALF_EXTENT;

    /** Body half-extent across the heading, in cells. */
    @Builder.Default
    double halfHeight = DEFAULT_HALF_EXTENT;

    /** Heuristic guiding the search. */
    @Builder.Default
    HeuristicType heuristicType = HeuristicType.SQUARED_EUCLIDEAN;

    /** Edge cost tunables. */
    @Builder.Default
    CostModelConfig costModel = CostModelConfig.defaults();

    /**
     * Returns the default configuration.
     */
    public static PlannerConfig defaults() {
        return PlannerConfig.builder().build();
    }

    /**
     * Loads configuration from system properties; blank or malformed values keep defaults.
     */
    public static PlannerConfig fromSystemProperties() {
        return PlannerConfig.builder()
                .maxIncrements(readInt(PROP_MAX_INCREMENTS, DEFAULT_MAX_INCREMENTS))
                .arc(readInt(PROP_ARC, DEFAULT_ARC))
                .halfWidth(readDouble(PROP_HALF_WIDTH, DEFAULT_HALF_EXTENT))
                .halfHeight(readDouble(PROP_HALF_HEIGHT, DEFAULT_HALF_EXTENT))
                .heuristicType(readHeuristic(PROP_HEURISTIC, HeuristicType.SQUARED_EUCLIDEAN))
                .build();
    }

    /**
     * Agent body described by this configuration.
     *
     * @throws IllegalArgumentException when an extent is not positive.
     */
    public AgentGeometry geometry() {
        return new AgentGeometry(halfWidth, halfHeight);
    }

    private static int readInt(String property, int fallback) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }

    private static double readDouble(String property, double fallback) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }

    private static HeuristicType readHeuristic(String property, HeuristicType fallback) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return HeuristicType.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            return fallback;
        }
    }
}
