package org.javai.planning.testsupport;

import org.javai.planning.api.AddedWaypoints;
import org.javai.planning.api.PlannerFunction;
import org.javai.planning.api.PlanningRequestAdapter;
import org.javai.planning.api.PlanningScene;
import org.javai.planning.model.ErrorCode;
import org.javai.planning.model.MotionPlanRequest;
import org.javai.planning.model.MotionPlanResponse;

/**
 * Never calls downstream.
 */
public class RefusingAdapter implements PlanningRequestAdapter {

	@Override
	public String description() {
		return "Refusing";
	}

	@Override
	public boolean adaptAndPlan(PlannerFunction planner, PlanningScene scene, MotionPlanRequest request,
			MotionPlanResponse response, AddedWaypoints addedWaypoints) {
		response.fail(ErrorCode.START_STATE_INVALID, "Start state rejected before planning");
		return false;
	}
}
