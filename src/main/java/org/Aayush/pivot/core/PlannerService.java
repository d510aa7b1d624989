package org.Aayush.pivot.core;

/**
 * Client-facing planner surface.
 */
public interface PlannerService {

    /**
     * Executes one path query.
     *
     * @param request path request.
     * @return response describing reachability, path, and cost.
     * @throws PlannerException when request contracts fail.
     */
    PathResponse plan(PathRequest request);
}
