package org.Aayush.pivot.cost;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.Aayush.pivot.agent.HeadingMath;
import org.Aayush.pivot.motion.Pose;

import java.util.Objects;

/**
 * Edge cost of one motion primitive.
 * <p>
 * Canonical cost:
 * </p>
 * <pre>
 * turn_angle     = shortest rotation between headings (radians)
 * angle_cost     = floor(speed_loss_fraction(turn_angle) * K_ANGLE)
 * distance_cost  = squared_step_distance * K_DIST
 * multiplier     = reverse_multiplier if the move is driven in reverse, else 1
 * effective_cost = (angle_cost + distance_cost) * multiplier
 * </pre>
 * <p>
 * A start state (no predecessor) costs {@code 0}. The cheapest possible edge is a straight
 * forward single-cell step costing exactly {@code K_DIST}. Immutable and thread-safe.
 * </p>
 */
@Accessors(fluent = true)
public final class MotionCostModel {

    @Getter
    private final CostModelConfig config;
    @Getter
    private final int maxIncrements;
    private final double incrementSize;
    private final TurnSpeedLossModel speedLoss;

    /**
     * Creates a cost model for one heading discretization.
     *
     * @param config validated tunables.
     * @param maxIncrements heading discretization, must be positive.
     */
    public MotionCostModel(CostModelConfig config, int maxIncrements) {
        this.config = Objects.requireNonNull(config, "config").validate();
        if (maxIncrements <= 0) {
            throw new IllegalArgumentException("maxIncrements must be > 0, got " + maxIncrements);
        }
        this.maxIncrements = maxIncrements;
        this.incrementSize = HeadingMath.incrementSize(maxIncrements);
        this.speedLoss = new TurnSpeedLossModel(
                config.getReferenceSpeed(),
                config.getFrictionCoefficient(),
                config.getGravity()
        );
    }

    /**
     * Fast-path scalar cost without breakdown allocation.
     *
     * @param to pose reached by the move.
     * @param from pose the move starts from, or {@code null} for the start state.
     */
    public int cost(Pose to, Pose from) {
        return computeInternal(to, from, null);
    }

    /**
     * Explainable cost computation for debugging and rendering overlays.
     */
    public CostBreakdown explain(Pose to, Pose from) {
        MutableCostBreakdown breakdown = new MutableCostBreakdown();
        computeInternal(to, from, breakdown);
        return breakdown.toImmutable();
    }

    /**
     * Lowest cost any single edge can have.
     */
    public int minimumEdgeCost() {
        return config.getDistanceWeight();
    }

    private int computeInternal(Pose to, Pose from, MutableCostBreakdown out) {
        Objects.requireNonNull(to, "to");
        if (from == null) {
            if (out != null) {
                out.reverse = to.reverse();
                out.multiplier = 1;
            }
            return 0;
        }

        int turnIncrements = HeadingMath.rotationBetween(from.heading(), to.heading(), maxIncrements);
        double turnAngle = turnIncrements * incrementSize;
        double maxSafeSpeed = speedLoss.maxSafeSpeed(turnAngle);
        double lossFraction = speedLoss.lossFraction(turnAngle);

        long angleCost = (long) (lossFraction * config.getAngleWeight());
        long distanceCost = (long) to.position().squaredDistanceTo(from.position()) * config.getDistanceWeight();
        int multiplier = to.reverse() ? config.getReverseMultiplier() : 1;
        int effectiveCost = saturate((angleCost + distanceCost) * multiplier);

        if (out != null) {
            out.turnIncrements = turnIncrements;
            out.turnAngle = turnAngle;
            out.maxSafeSpeed = maxSafeSpeed;
            out.lossFraction = lossFraction;
            out.angleCost = (int) angleCost;
            out.distanceCost = saturate(distanceCost);
            out.reverse = to.reverse();
            out.multiplier = multiplier;
            out.effectiveCost = effectiveCost;
        }
        return effectiveCost;
    }

    private static int saturate(long value) {
        if (value > Integer.MAX_VALUE) {
            return Integer.MAX_VALUE;
        }
        return (int) value;
    }

    /**
     * Immutable explainability payload.
     */
    public record CostBreakdown(
            int turnIncrements,
            double turnAngle,
            double maxSafeSpeed,
            double lossFraction,
            int angleCost,
            int distanceCost,
            boolean reverse,
            int multiplier,
            int effectiveCost
    ) {
    }

    /**
     * Mutable breakdown container filled by the explain path.
     */
    static final class MutableCostBreakdown {
        int turnIncrements;
        double turnAngle;
        double maxSafeSpeed;
        double lossFraction;
        int angleCost;
        int distanceCost;
        boolean reverse;
        int multiplier;
        int effectiveCost;

        CostBreakdown toImmutable() {
            return new CostBreakdown(
                    turnIncrements,
                    turnAngle,
                    maxSafeSpeed,
                    lossFraction,
                    angleCost,
                    distanceCost,
                    reverse,
                    multiplier,
                    effectiveCost
            );
        }
    }
}
