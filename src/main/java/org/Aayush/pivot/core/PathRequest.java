package org.Aayush.pivot.core;

import lombok.Builder;
import lombok.Value;
import org.Aayush.pivot.grid.GridPosition;

/**
 * Client-facing path query.
 */
@Value
@Builder
public class PathRequest {
    /** Cell the agent starts in. */
    GridPosition start;
    /** Heading increment the agent starts with. */
    Integer startHeading;
    /** Cell to reach; any heading is accepted on arrival. */
    GridPosition goal;
}
