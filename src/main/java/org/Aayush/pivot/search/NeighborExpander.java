package org.Aayush.pivot.search;

/**
 * Successor generator used by {@link BestFirstSearch}.
 *
 * <p>Implementations push successors into the supplied sink instead of returning a
 * collection, so expansion allocates nothing beyond the successor states themselves.</p>
 *
 * @param <S> search state type; must implement value equality and hashing.
 */
@FunctionalInterface
public interface NeighborExpander<S> {

    /**
     * Emits every successor of {@code state}.
     *
     * @param state state being expanded.
     * @param sink receiver of {@code (successor, edgeCost)} pairs.
     */
    void expand(S state, Sink<S> sink);

    /**
     * Receiver of successors.
     *
     * @param <S> search state type.
     */
    @FunctionalInterface
    interface Sink<S> {
        /**
         * @param next successor state.
         * @param edgeCost non-negative cost of the move.
         */
        void accept(S next, int edgeCost);
    }
}
