package org.Aayush.pivot.heuristic;

import org.Aayush.pivot.common.ReasonCodedException;

/**
 * Thrown when a heuristic provider cannot be created for the requested mode.
 */
public final class HeuristicConfigurationException extends ReasonCodedException {

    public HeuristicConfigurationException(String reasonCode, String message) {
        super(reasonCode, message);
    }
}
