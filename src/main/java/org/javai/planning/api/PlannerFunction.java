package org.javai.planning.api;

import org.javai.planning.model.MotionPlanRequest;
import org.javai.planning.model.MotionPlanResponse;

/**
 * The downstream part of an adapter chain: either the next adapter or the core planner.
 */
@FunctionalInterface
public interface PlannerFunction {

	/**
	 * @return true if planning succeeded
	 */
	boolean plan(PlanningScene scene, MotionPlanRequest request, MotionPlanResponse response);
}
