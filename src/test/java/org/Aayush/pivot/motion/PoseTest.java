package org.Aayush.pivot.motion;

import org.Aayush.pivot.grid.GridPosition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Pose")
class PoseTest {

    @Test
    @DisplayName("Identity ignores the reverse flag")
    void testEqualityIgnoresReverse() {
        Pose forward = new Pose(GridPosition.of(2, 3), 5, false);
        Pose reverse = new Pose(GridPosition.of(2, 3), 5, true);
        assertEquals(forward, reverse);
        assertEquals(forward.hashCode(), reverse.hashCode());

        Set<Pose> visited = new HashSet<>();
        visited.add(forward);
        assertFalse(visited.add(reverse));
    }

    @Test
    @DisplayName("Position and heading distinguish poses")
    void testEqualityUsesPositionAndHeading() {
        assertNotEquals(Pose.of(2, 3, 5), Pose.of(2, 3, 4));
        assertNotEquals(Pose.of(2, 3, 5), Pose.of(3, 2, 5));
        assertEquals(2, Pose.of(2, 3, 5).x());
        assertEquals(3, Pose.of(2, 3, 5).y());
    }

    @Test
    @DisplayName("Position is required")
    void testNullPosition() {
        assertThrows(NullPointerException.class, () -> new Pose(null, 0, false));
    }
}
