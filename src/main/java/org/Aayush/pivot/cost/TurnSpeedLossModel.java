package org.Aayush.pivot.cost;

/**
 * Fraction of cruising speed lost when cornering through a turn.
 * <pre>
 * max_safe_speed = min(reference_speed, sqrt(friction * gravity / turn_angle))
 * loss_fraction  = clamp((reference_speed - max_safe_speed) / reference_speed, 0, 1)
 * </pre>
 * <p>
 * Sharper turns lower the safe cornering speed; a zero-angle move keeps full speed.
 * </p>
 */
public final class TurnSpeedLossModel {
    private final double referenceSpeed;
    private final double frictionCoefficient;
    private final double gravity;

    /**
     * @param referenceSpeed cruising speed, finite and {@code > 0}.
     * @param frictionCoefficient tyre/ground friction, finite and {@code > 0}.
     * @param gravity gravitational acceleration, finite and {@code > 0}.
     */
    public TurnSpeedLossModel(double referenceSpeed, double frictionCoefficient, double gravity) {
        this.referenceSpeed = requirePositive(referenceSpeed, "referenceSpeed");
        this.frictionCoefficient = requirePositive(frictionCoefficient, "frictionCoefficient");
        this.gravity = requirePositive(gravity, "gravity");
    }

    /**
     * Highest speed that keeps traction through a turn of {@code turnAngle} radians.
     */
    public double maxSafeSpeed(double turnAngle) {
        if (!(turnAngle > 0.0d)) {
            return referenceSpeed;
        }
        double safe = Math.sqrt(frictionCoefficient * gravity / turnAngle);
        return Math.min(referenceSpeed, safe);
    }

    /**
     * Speed lost through a turn of {@code turnAngle} radians, in {@code [0, 1]}.
     */
    public double lossFraction(double turnAngle) {
        double loss = (referenceSpeed - maxSafeSpeed(turnAngle)) / referenceSpeed;
        if (loss < 0.0d) {
            return 0.0d;
        }
        if (loss > 1.0d) {
            return 1.0d;
        }
        return loss;
    }

    private static double requirePositive(double value, String name) {
        if (!Double.isFinite(value) || value <= 0.0d) {
            throw new IllegalArgumentException(name + " must be finite and > 0, got " + value);
        }
        return value;
    }
}
