package org.Aayush.pivot.search;

import java.util.List;

/**
 * Outcome of a successful search.
 *
 * @param path states from start to goal, inclusive.
 * @param totalCost summed edge cost along {@code path}.
 * @param expandedStates number of states expanded before the goal was popped.
 * @param generatedNodes number of arena nodes allocated, including the start node.
 * @param <S> search state type.
 */
public record SearchResult<S>(List<S> path, int totalCost, int expandedStates, int generatedNodes) {

    public SearchResult {
        path = List.copyOf(path);
    }

    /**
     * @return the goal state.
     */
    public S goal() {
        return path.get(path.size() - 1);
    }
}
