package org.Aayush.pivot.search;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import lombok.experimental.UtilityClass;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.function.ToIntFunction;

/**
 * Generic best-first (A*-ordered) search over hashable states.
 * <p>
 * Per-query bookkeeping, all pre-sized from the caller's capacity hint:
 * </p>
 * <ul>
 * <li>{@link NodeArena}: nodes (state, g, f, parent index) in growable columns.</li>
 * <li>{@link SearchQueue}: open set ordered by {@code f = g + h}, ties in insertion order.</li>
 * <li>best-node map: state to the arena index of its cheapest known node. The node's
 * {@code g} is the best known cost and its parent index is the predecessor link.</li>
 * </ul>
 * <p>
 * A popped node that is no longer the best node for its state is stale and skipped.
 * Nothing is retained between calls; each call runs synchronously to the goal or to
 * exhaustion.
 * </p>
 */
@UtilityClass
public final class BestFirstSearch {
    private static final int NO_NODE = -1;

    /**
     * Runs one search.
     *
     * @param start initial state.
     * @param capacityHint expected number of distinct states.
     * @param expander successor generator.
     * @param heuristic non-negative remaining-cost estimate.
     * @param isGoal goal predicate.
     * @param <S> state type with value equality and hashing.
     * @return path and cost to the first goal state popped, or empty when the reachable
     *         state space is exhausted.
     */
    public static <S> Optional<SearchResult<S>> search(
            S start,
            int capacityHint,
            NeighborExpander<S> expander,
            ToIntFunction<S> heuristic,
            Predicate<S> isGoal
    ) {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(expander, "expander");
        Objects.requireNonNull(heuristic, "heuristic");
        Objects.requireNonNull(isGoal, "isGoal");
        if (capacityHint < 0) {
            throw new IllegalArgumentException("capacityHint must be non-negative, got " + capacityHint);
        }

        NodeArena<S> arena = new NodeArena<>(capacityHint);
        SearchQueue open = new SearchQueue(arena, capacityHint);
        Object2IntOpenHashMap<S> bestNode = new Object2IntOpenHashMap<>(capacityHint);
        bestNode.defaultReturnValue(NO_NODE);

        int root = arena.add(start, 0, requireEstimate(heuristic.applyAsInt(start)), NodeArena.NO_PARENT);
        bestNode.put(start, root);
        open.insert(root);

        Relaxation<S> relaxation = new Relaxation<>(arena, open, bestNode, heuristic);
        int expanded = 0;

        while (!open.isEmpty()) {
            int node = open.extractMin();
            S state = arena.state(node);
            if (bestNode.getInt(state) != node) {
                continue;
            }
            if (isGoal.test(state)) {
                return Optional.of(new SearchResult<>(arena.pathTo(node), arena.gCost(node), expanded, arena.size()));
            }
            expanded++;
            relaxation.current = node;
            relaxation.currentG = arena.gCost(node);
            expander.expand(state, relaxation);
        }
        return Optional.empty();
    }

    private static int requireEstimate(int estimate) {
        if (estimate < 0) {
            throw new IllegalStateException("heuristic must be >= 0, got " + estimate);
        }
        return estimate;
    }

    private static int saturatingAdd(int a, int b) {
        long sum = (long) a + b;
        return sum > Integer.MAX_VALUE ? Integer.MAX_VALUE : (int) sum;
    }

    /**
     * Successor sink reused for every expansion of one search.
     */
    private static final class Relaxation<S> implements NeighborExpander.Sink<S> {
        private final NodeArena<S> arena;
        private final SearchQueue open;
        private final Object2IntOpenHashMap<S> bestNode;
        private final ToIntFunction<S> heuristic;
        private int current;
        private int currentG;

        private Relaxation(
                NodeArena<S> arena,
                SearchQueue open,
                Object2IntOpenHashMap<S> bestNode,
                ToIntFunction<S> heuristic
        ) {
            this.arena = arena;
            this.open = open;
            this.bestNode = bestNode;
            this.heuristic = heuristic;
        }

        @Override
        public void accept(S next, int edgeCost) {
            if (edgeCost < 0) {
                throw new IllegalStateException("edge cost must be >= 0, got " + edgeCost);
            }
            long tentative = (long) currentG + edgeCost;
            if (tentative >= Integer.MAX_VALUE) {
                return;
            }
            int known = bestNode.getInt(next);
            if (known != NO_NODE && tentative >= arena.gCost(known)) {
                return;
            }
            int g = (int) tentative;
            int f = saturatingAdd(g, requireEstimate(heuristic.applyAsInt(next)));
            int node = arena.add(next, g, f, current);
            bestNode.put(next, node);
            open.insert(node);
        }
    }
}
