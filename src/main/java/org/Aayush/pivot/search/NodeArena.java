package org.Aayush.pivot.search;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;

import java.util.Collections;

/**
 * Index-addressed node storage for one search.
 * <p>
 * <strong>Design:</strong> nodes live in parallel growable columns (state, g, f, parent)
 * and are referenced by their integer index. Predecessor links and open-set entries are
 * plain ints, so no node holds a reference to another node and the whole arena is
 * released in bulk when the search returns.
 * </p>
 * <p><strong>Usage Warning:</strong> This class is NOT thread-safe. One arena per query.</p>
 *
 * @param <S> search state type.
 */
public final class NodeArena<S> {
    /** Parent index of the root node. */
    public static final int NO_PARENT = -1;

    private final ObjectArrayList<S> states;
    private final IntArrayList gCosts;
    private final IntArrayList fCosts;
    private final IntArrayList parents;

    /**
     * @param capacityHint expected node count; columns are pre-sized to it.
     */
    public NodeArena(int capacityHint) {
        if (capacityHint < 0) {
            throw new IllegalArgumentException("capacityHint must be non-negative, got " + capacityHint);
        }
        this.states = new ObjectArrayList<>(capacityHint);
        this.gCosts = new IntArrayList(capacityHint);
        this.fCosts = new IntArrayList(capacityHint);
        this.parents = new IntArrayList(capacityHint);
    }

    /**
     * Appends a node.
     *
     * @return index of the new node.
     */
    public int add(S state, int gCost, int fCost, int parent) {
        if (parent != NO_PARENT && (parent < 0 || parent >= size())) {
            throw new IllegalArgumentException("parent index " + parent + " out of range [0, " + size() + ")");
        }
        int index = states.size();
        states.add(state);
        gCosts.add(gCost);
        fCosts.add(fCost);
        parents.add(parent);
        return index;
    }

    /**
     * State stored at a node index.
     */
    public S state(int node) {
        return states.get(node);
    }

    /**
     * Accumulated cost from the start to a node.
     */
    public int gCost(int node) {
        return gCosts.getInt(node);
    }

    /**
     * Priority key of a node, {@code g + h}.
     */
    public int fCost(int node) {
        return fCosts.getInt(node);
    }

    /**
     * Predecessor index of a node, or {@link #NO_PARENT} for the root.
     */
    public int parent(int node) {
        return parents.getInt(node);
    }

    /**
     * Number of allocated nodes.
     */
    public int size() {
        return states.size();
    }

    /**
     * States from the root to {@code node}, inclusive.
     */
    public ObjectArrayList<S> pathTo(int node) {
        ObjectArrayList<S> path = new ObjectArrayList<>();
        for (int current = node; current != NO_PARENT; current = parents.getInt(current)) {
            path.add(states.get(current));
        }
        Collections.reverse(path);
        return path;
    }
}
