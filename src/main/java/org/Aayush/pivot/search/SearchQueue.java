package org.Aayush.pivot.search;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Arrays;
import java.util.Objects;

/**
 * Min-priority open set of arena node indices, ordered by {@code fCost}.
 * <p>
 * <strong>Key Features:</strong>
 * <ul>
 * <li><strong>Primitive heap:</strong> entries are {@code int} node indices into a
 * {@link NodeArena}; the heap never holds node objects.</li>
 * <li><strong>Deterministic ties:</strong> equal {@code fCost} entries pop in insertion
 * order (lower node index first).</li>
 * <li><strong>Lazy updates:</strong> an improved path is pushed as a new node; the caller
 * discards superseded entries when they surface.</li>
 * </ul>
 * </p>
 * <p><strong>Usage Warning:</strong> This class is NOT thread-safe. It is intended for single-threaded use.</p>
 */
public final class SearchQueue {

    // 1-based binary heap for simple parent/child math
    private int[] heap;
    @Getter
    @Accessors(fluent = true)
    private int size = 0;

    @Getter
    private int peakSize = 0;

    private final NodeArena<?> arena;

    /**
     * @param arena node storage supplying {@code fCost} for ordering.
     * @param capacityHint initial heap capacity.
     */
    public SearchQueue(NodeArena<?> arena, int capacityHint) {
        this.arena = Objects.requireNonNull(arena, "arena");
        if (capacityHint < 0) {
            throw new IllegalArgumentException("capacityHint must be non-negative, got " + capacityHint);
        }
        this.heap = new int[Math.max(2, capacityHint + 1)];
    }

    /**
     * Pushes a node index.
     *
     * @throws IllegalArgumentException if the index is not a node of the arena.
     */
    public void insert(int node) {
        if (node < 0 || node >= arena.size()) {
            throw new IllegalArgumentException("node " + node + " out of bounds (arena size: " + arena.size() + ")");
        }
        if (size + 1 >= heap.length) {
            heap = Arrays.copyOf(heap, heap.length << 1);
        }
        size++;
        heap[size] = node;
        swim(size);
        if (size > peakSize) {
            peakSize = size;
        }
    }

    /**
     * Removes and returns the node with the smallest {@code fCost}.
     *
     * @throws EmptyQueueException if the queue is empty.
     */
    public int extractMin() {
        if (isEmpty()) {
            throw new EmptyQueueException();
        }
        int min = heap[1];
        heap[1] = heap[size];
        size--;
        if (size > 0) {
            sink(1);
        }
        return min;
    }

    /**
     * Returns the node with the smallest {@code fCost} without removing it.
     *
     * @throws EmptyQueueException if the queue is empty.
     */
    public int peek() {
        if (isEmpty()) {
            throw new EmptyQueueException();
        }
        return heap[1];
    }

    /**
     * @return true when no entries remain.
     */
    public boolean isEmpty() {
        return size == 0;
    }

    // --- Heap Helper Methods ---

    private void swim(int k) {
        while (k > 1 && greater(k / 2, k)) {
            swap(k, k / 2);
            k = k / 2;
        }
    }

    private void sink(int k) {
        while (2 * k <= size) {
            int j = 2 * k;
            if (j < size && greater(j, j + 1)) j++;
            if (!greater(k, j)) break;
            swap(k, j);
            k = j;
        }
    }

    /**
     * Returns whether heap slot {@code i} has lower priority than slot {@code j}.
     */
    private boolean greater(int i, int j) {
        int a = heap[i];
        int b = heap[j];
        int byCost = Integer.compare(arena.fCost(a), arena.fCost(b));
        if (byCost != 0) {
            return byCost > 0;
        }
        return a > b;
    }

    private void swap(int i, int j) {
        int tmp = heap[i];
        heap[i] = heap[j];
        heap[j] = tmp;
    }
}
