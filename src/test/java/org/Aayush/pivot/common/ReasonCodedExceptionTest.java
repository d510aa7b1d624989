package org.Aayush.pivot.common;

import org.Aayush.pivot.core.PlannerException;
import org.Aayush.pivot.heuristic.HeuristicConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ReasonCodedException")
class ReasonCodedExceptionTest {

    @Test
    @DisplayName("Message is prefixed with the reason code")
    void testMessageFormat() {
        PlannerException ex = new PlannerException("P_GRID_REQUIRED", "grid must be provided");
        assertEquals("P_GRID_REQUIRED", ex.reasonCode());
        assertEquals("[P_GRID_REQUIRED] grid must be provided", ex.getMessage());
    }

    @Test
    @DisplayName("Cause is preserved")
    void testCause() {
        IllegalArgumentException cause = new IllegalArgumentException("bad");
        PlannerException ex = new PlannerException("P_INVALID_GEOMETRY", "wrapped", cause);
        assertSame(cause, ex.getCause());
    }

    @Test
    @DisplayName("Blank or missing codes are rejected")
    void testInvalidCodes() {
        assertThrows(IllegalArgumentException.class, () -> new HeuristicConfigurationException(" ", "x"));
        assertThrows(NullPointerException.class, () -> new HeuristicConfigurationException(null, "x"));
    }
}
