package org.javai.planning.testsupport;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.javai.planning.api.AddedWaypoints;
import org.javai.planning.api.PlannerFunction;
import org.javai.planning.api.PlanningRequestAdapter;
import org.javai.planning.api.PlanningScene;
import org.javai.planning.model.MotionPlanRequest;
import org.javai.planning.model.MotionPlanResponse;
import org.javai.planning.model.RobotTrajectory;

/**
 * Gives every waypoint after the first a fixed time step, stretched by the request's velocity scaling.
 */
public class TimeParameterizationAdapter implements PlanningRequestAdapter {

	public static final Duration STEP = Duration.ofMillis(100);

	@Override
	public String description() {
		return "Add Time Parameterization";
	}

	@Override
	public boolean adaptAndPlan(PlannerFunction planner, PlanningScene scene, MotionPlanRequest request,
			MotionPlanResponse response, AddedWaypoints addedWaypoints) {
		boolean solved = planner.plan(scene, request, response);
		if (!solved || !response.hasTrajectory()) {
			return solved;
		}
		long stepNanos = (long) (STEP.toNanos() / request.maxVelocityScalingFactor());
		RobotTrajectory trajectory = response.trajectory();
		List<RobotTrajectory.Waypoint> timed = new ArrayList<>();
		for (int i = 0; i < trajectory.waypointCount(); i++) {
			Duration step = i == 0 ? Duration.ZERO : Duration.ofNanos(stepNanos);
			timed.add(new RobotTrajectory.Waypoint(trajectory.waypoint(i), step));
		}
		response.setTrajectory(trajectory.withWaypoints(timed));
		return true;
	}
}
