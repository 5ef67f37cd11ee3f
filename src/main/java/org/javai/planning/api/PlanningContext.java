package org.javai.planning.api;

import org.javai.planning.model.MotionPlanResponse;

/**
 * A planner bound to one scene and one request.
 */
public interface PlanningContext {

	String name();

	/**
	 * Solve the bound request, writing trajectory, error code and message into {@code response}.
	 * <p>
	 * May block for as long as the request's planning time allows. Implementations poll the
	 * {@link TerminationSignal} they were created with and return early once it is raised.
	 *
	 * @return true if a solution was found
	 */
	boolean solve(MotionPlanResponse response);

	/**
	 * Release per-request state. Called once after {@link #solve(MotionPlanResponse)} returns.
	 */
	default void clear() {
	}
}
