package org.javai.planning.api;

import java.util.Map;
import org.javai.planning.model.MotionPlanRequest;
import org.javai.planning.model.MotionPlanResponse;

/**
 * A pre/post-processing stage wrapped around the core planner.
 * <p>
 * An adapter may derive a new request and call {@code planner}, post-process the response the
 * planner filled in, or refuse to call {@code planner} at all and report failure on the response.
 * Recovery from a downstream failure is up to the adapter.
 */
public interface PlanningRequestAdapter {

	/**
	 * Configure the adapter. Called once, before the adapter is placed in a chain.
	 */
	default void initialize(Map<String, Object> parameters) {
	}

	String description();

	/**
	 * @param planner the downstream stage
	 * @param scene the scene being planned in
	 * @param request the request as produced by the upstream stage
	 * @param response the response shared by the whole chain
	 * @param addedWaypoints where to record indices of waypoints this adapter inserts
	 * @return true if planning succeeded
	 */
	boolean adaptAndPlan(PlannerFunction planner, PlanningScene scene, MotionPlanRequest request,
			MotionPlanResponse response, AddedWaypoints addedWaypoints);
}
