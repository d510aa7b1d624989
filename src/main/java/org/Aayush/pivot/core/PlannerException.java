package org.Aayush.pivot.core;

import org.Aayush.pivot.common.ReasonCodedException;

/**
 * Planner contract exception with deterministic reason codes.
 *
 * <p>Raised for malformed requests and invalid planner configuration. An unreachable
 * goal is a normal outcome and never raises this exception.</p>
 */
public final class PlannerException extends ReasonCodedException {

    /**
     * Creates an exception with a stable reason code.
     */
    public PlannerException(String reasonCode, String message) {
        super(reasonCode, message);
    }

    /**
     * Creates an exception with a stable reason code and the underlying failure.
     */
    public PlannerException(String reasonCode, String message, Throwable cause) {
        super(reasonCode, message, cause);
    }
}
