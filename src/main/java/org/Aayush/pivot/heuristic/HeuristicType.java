package org.Aayush.pivot.heuristic;

/**
 * Supported heuristic modes.
 *
 * <p>{@code NONE} disables heuristic guidance (uniform-cost search).</p>
 * <p>{@code SQUARED_EUCLIDEAN} scales squared distance-to-goal by {@code K_HEUR}.</p>
 */
public enum HeuristicType {
    NONE,
    SQUARED_EUCLIDEAN
}
