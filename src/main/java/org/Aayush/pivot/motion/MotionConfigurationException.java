package org.Aayush.pivot.motion;

import org.Aayush.pivot.common.ReasonCodedException;

/**
 * Thrown when heading discretization parameters cannot produce a valid template set.
 */
public final class MotionConfigurationException extends ReasonCodedException {

    public MotionConfigurationException(String reasonCode, String message) {
        super(reasonCode, message);
    }
}
