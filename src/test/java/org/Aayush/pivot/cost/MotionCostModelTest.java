package org.Aayush.pivot.cost;

import org.Aayush.pivot.grid.GridPosition;
import org.Aayush.pivot.motion.Pose;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MotionCostModel")
class MotionCostModelTest {
    private final MotionCostModel model = new MotionCostModel(CostModelConfig.defaults(), 8);

    @Nested
    @DisplayName("Edge costs")
    class EdgeCosts {

        @Test
        @DisplayName("Start state costs nothing")
        void testStartCost() {
            assertEquals(0, model.cost(Pose.of(3, 3, 2), null));
        }

        @Test
        @DisplayName("Straight forward step costs exactly the distance weight")
        void testStraightStep() {
            assertEquals(1_000, model.cost(Pose.of(1, 0, 0), Pose.of(0, 0, 0)));
            assertEquals(model.minimumEdgeCost(), model.cost(Pose.of(1, 0, 0), Pose.of(0, 0, 0)));
        }

        @ParameterizedTest(name = "turn {0} increments -> angle cost {1}")
        @CsvSource({"0,0", "1,260", "2,477", "4,630"})
        @DisplayName("Angle cost follows the cornering speed loss")
        void testAngleCost(int turn, int expectedAngleCost) {
            MotionCostModel.CostBreakdown breakdown = model.explain(Pose.of(1, 0, turn), Pose.of(0, 0, 0));
            assertEquals(turn, breakdown.turnIncrements());
            assertEquals(expectedAngleCost, breakdown.angleCost());
            assertEquals(1_000, breakdown.distanceCost());
            assertEquals(expectedAngleCost + 1_000, breakdown.effectiveCost());
        }

        @Test
        @DisplayName("Diagonal step after a 45-degree turn")
        void testDiagonalTurn() {
            assertEquals(2_260, model.cost(Pose.of(1, 1, 1), Pose.of(0, 0, 0)));
            assertEquals(2_000, model.cost(Pose.of(2, 2, 1), Pose.of(1, 1, 1)));
        }

        @Test
        @DisplayName("Turn cost is symmetric and wraps around")
        void testTurnSymmetry() {
            assertEquals(
                    model.cost(Pose.of(1, 1, 1), Pose.of(0, 0, 0)),
                    model.cost(Pose.of(1, -1, 7), Pose.of(0, 0, 0))
            );
        }

        @Test
        @DisplayName("Reverse moves pay the multiplier")
        void testReverseMultiplier() {
            Pose from = Pose.of(5, 5, 0);
            Pose straightBack = new Pose(GridPosition.of(4, 5), 0, true);
            Pose turningBack = new Pose(GridPosition.of(5, 6), 6, true);
            assertEquals(6_000, model.cost(straightBack, from));
            assertEquals((477 + 1_000) * 6, model.cost(turningBack, from));

            MotionCostModel.CostBreakdown breakdown = model.explain(straightBack, from);
            assertTrue(breakdown.reverse());
            assertEquals(6, breakdown.multiplier());
        }

        @Test
        @DisplayName("Weights saturate instead of overflowing")
        void testSaturation() {
            CostModelConfig heavy = CostModelConfig.builder()
                    .distanceWeight(Integer.MAX_VALUE)
                    .reverseMultiplier(6)
                    .build();
            MotionCostModel saturating = new MotionCostModel(heavy, 8);
            assertEquals(Integer.MAX_VALUE, saturating.cost(new Pose(GridPosition.of(1, 1), 0, true), Pose.of(0, 0, 0)));
        }
    }

    @Nested
    @DisplayName("Speed loss")
    class SpeedLoss {

        @Test
        @DisplayName("Gentle turns keep cruising speed")
        void testGentleTurn() {
            TurnSpeedLossModel loss = new TurnSpeedLossModel(4.0d, 0.7d, 9.81d);
            assertEquals(4.0d, loss.maxSafeSpeed(0.0d));
            assertEquals(0.0d, loss.lossFraction(0.1d));
        }

        @Test
        @DisplayName("Sharper turns lose more speed")
        void testMonotonicLoss() {
            TurnSpeedLossModel loss = new TurnSpeedLossModel(4.0d, 0.7d, 9.81d);
            double previous = -1.0d;
            for (int turn = 1; turn <= 4; turn++) {
                double fraction = loss.lossFraction(turn * Math.PI / 4.0d);
                assertTrue(fraction > previous);
                assertTrue(fraction <= 1.0d);
                previous = fraction;
            }
        }
    }

    @Nested
    @DisplayName("Configuration")
    class Configuration {

        @Test
        @DisplayName("Defaults")
        void testDefaults() {
            CostModelConfig config = CostModelConfig.defaults();
            assertEquals(1_000, config.getAngleWeight());
            assertEquals(1_000, config.getDistanceWeight());
            assertEquals(10, config.getHeuristicWeight());
            assertEquals(6, config.getReverseMultiplier());
            assertSame(config, config.validate());
        }

        @Test
        @DisplayName("Out-of-range tunables are rejected")
        void testValidation() {
            assertThrows(IllegalArgumentException.class,
                    () -> CostModelConfig.builder().reverseMultiplier(0).build().validate());
            assertThrows(IllegalArgumentException.class,
                    () -> CostModelConfig.builder().distanceWeight(0).build().validate());
            assertThrows(IllegalArgumentException.class,
                    () -> CostModelConfig.builder().gravity(Double.NaN).build().validate());
            assertThrows(IllegalArgumentException.class,
                    () -> CostModelConfig.builder().heuristicWeight(-1).build().validate());
            assertThrows(IllegalArgumentException.class,
                    () -> new MotionCostModel(CostModelConfig.defaults(), 0));
        }
    }
}
