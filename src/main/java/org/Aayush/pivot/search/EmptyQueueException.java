package org.Aayush.pivot.search;

/**
 * Thrown when {@link SearchQueue#extractMin()} is called on an empty open set.
 * Callers are expected to check {@link SearchQueue#isEmpty()} first.
 */
public class EmptyQueueException extends IllegalStateException {

    public EmptyQueueException() {
        super("open set is empty");
    }
}
