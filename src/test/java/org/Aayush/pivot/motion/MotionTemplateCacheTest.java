package org.Aayush.pivot.motion;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.Aayush.pivot.agent.HeadingMath;
import org.Aayush.pivot.grid.GridPosition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.HashSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MotionTemplateCache")
class MotionTemplateCacheTest {

    @Nested
    @DisplayName("Eight headings, arc 1")
    class EightHeadings {
        private final MotionTemplateCache cache = new MotionTemplateCache(8, 1);

        @Test
        @DisplayName("Every heading is cardinal")
        void testCardinalHeadings() {
            assertEquals(IntArrayList.wrap(new int[]{0, 1, 2, 3, 4, 5, 6, 7}), cache.cardinalHeadings());
        }

        @ParameterizedTest(name = "heading {0}")
        @ValueSource(ints = {0, 1, 2, 3, 4, 5, 6, 7})
        @DisplayName("Three forward and five reverse moves per heading, none in place")
        void testTemplateShape(int heading) {
            List<MotionTemplate> templates = cache.templatesFor(heading);
            assertEquals(8, templates.size());
            assertEquals(3, templates.stream().filter(t -> !t.reverse()).count());
            assertEquals(5, templates.stream().filter(MotionTemplate::reverse).count());
            assertEquals(templates.size(), new HashSet<>(templates).size());
            for (MotionTemplate template : templates) {
                assertFalse(template.offset().isZero());
                assertTrue(Math.abs(template.offset().x()) <= 1);
                assertTrue(Math.abs(template.offset().y()) <= 1);
                int turn = HeadingMath.rotationBetween(heading, template.targetHeading(), 8);
                assertTrue(turn <= (template.reverse() ? 2 : 1));
            }
            assertEquals(64, cache.templateCount());
        }

        @Test
        @DisplayName("Heading 0 moves east forward and west in reverse")
        void testHeadingZeroMoves() {
            List<MotionTemplate> templates = cache.templatesFor(0);
            assertTrue(templates.contains(new MotionTemplate(GridPosition.of(1, 0), 0, false)));
            assertTrue(templates.contains(new MotionTemplate(GridPosition.of(1, 1), 1, false)));
            assertTrue(templates.contains(new MotionTemplate(GridPosition.of(1, -1), 7, false)));
            assertTrue(templates.contains(new MotionTemplate(GridPosition.of(-1, 0), 0, true)));
            assertTrue(templates.contains(new MotionTemplate(GridPosition.of(0, 1), 6, true)));
            assertTrue(templates.contains(new MotionTemplate(GridPosition.of(0, -1), 2, true)));
        }

        @Test
        @DisplayName("Applying a template moves the pose and carries the reverse flag")
        void testApplyTo() {
            Pose moved = new MotionTemplate(GridPosition.of(-1, 0), 0, true).applyTo(Pose.of(4, 4, 0));
            assertEquals(GridPosition.of(3, 4), moved.position());
            assertEquals(0, moved.heading());
            assertTrue(moved.reverse());
        }

        @Test
        @DisplayName("Heading outside the discretization is rejected")
        void testHeadingOutOfRange() {
            assertThrows(IllegalArgumentException.class, () -> cache.templatesFor(8));
            assertThrows(IllegalArgumentException.class, () -> cache.templatesFor(-1));
            assertFalse(cache.isCardinal(8));
        }
    }

    @Nested
    @DisplayName("Sixteen headings, arc 1")
    class SixteenHeadings {
        private final MotionTemplateCache cache = new MotionTemplateCache(16, 1);

        @Test
        @DisplayName("Only compass-aligned headings are cardinal")
        void testCardinalHeadings() {
            assertEquals(IntArrayList.wrap(new int[]{0, 2, 4, 6, 8, 10, 12, 14}), cache.cardinalHeadings());
            assertFalse(cache.isCardinal(1));
            assertTrue(cache.isCardinal(2));
        }

        @Test
        @DisplayName("Oblique heading has no straight forward move")
        void testObliqueHeadingDropsStraightMove() {
            List<MotionTemplate> templates = cache.templatesFor(1);
            assertTrue(templates.stream().noneMatch(t -> !t.reverse() && t.targetHeading() == 1));
            assertEquals(2, templates.stream().filter(t -> !t.reverse()).count());
            assertTrue(templates.stream().anyMatch(t -> t.reverse() && t.targetHeading() == 1));
        }

        @ParameterizedTest(name = "heading {0}")
        @ValueSource(ints = {0, 1, 3, 5, 8, 15})
        @DisplayName("Every heading has at least one move")
        void testEveryHeadingCanMove(int heading) {
            assertFalse(cache.templatesFor(heading).isEmpty());
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @ParameterizedTest(name = "N={0}, arc={1}")
        @CsvSource({"8,4", "8,5", "8,-1", "2,1"})
        @DisplayName("Arc must satisfy 0 <= 2*arc < N")
        void testInvalidArc(int maxIncrements, int arc) {
            MotionConfigurationException ex = assertThrows(
                    MotionConfigurationException.class,
                    () -> new MotionTemplateCache(maxIncrements, arc)
            );
            assertEquals(MotionTemplateCache.REASON_INVALID_ARC, ex.reasonCode());
            assertTrue(ex.getMessage().startsWith("[M_INVALID_ARC]"));
        }

        @Test
        @DisplayName("Increment count must be positive")
        void testInvalidIncrements() {
            MotionConfigurationException ex = assertThrows(
                    MotionConfigurationException.class,
                    () -> new MotionTemplateCache(0, 0)
            );
            assertEquals(MotionTemplateCache.REASON_INVALID_INCREMENTS, ex.reasonCode());
        }

        @Test
        @DisplayName("Zero-offset move is a configuration error")
        void testZeroOffsetRejected() {
            MotionTemplate stationary = new MotionTemplate(GridPosition.ORIGIN, 3, false);
            MotionConfigurationException ex = assertThrows(
                    MotionConfigurationException.class,
                    () -> MotionTemplateCache.requireNonZeroOffset(stationary, 2)
            );
            assertEquals(MotionTemplateCache.REASON_ZERO_OFFSET, ex.reasonCode());
            assertDoesNotThrow(() -> MotionTemplateCache.requireNonZeroOffset(
                    new MotionTemplate(GridPosition.of(1, 0), 0, false), 0));
        }

        @Test
        @DisplayName("Arc 0 keeps straight and reverse moves")
        void testArcZero() {
            MotionTemplateCache cache = new MotionTemplateCache(8, 0);
            assertEquals(0, cache.arc());
            assertEquals(8, cache.maxIncrements());
            assertEquals(
                    List.of(
                            new MotionTemplate(GridPosition.of(1, 0), 0, false),
                            new MotionTemplate(GridPosition.of(-1, 0), 0, true)
                    ),
                    cache.templatesFor(0)
            );
        }
    }
}
