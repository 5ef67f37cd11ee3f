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
import org.javai.planning.model.RobotState;
import org.javai.planning.model.RobotTrajectory;

/**
 * Appends a fixed state to a solved trajectory, optionally declaring it as adapter-added.
 */
public class AppendWaypointAdapter implements PlanningRequestAdapter {

	private final RobotState appended;
	private final boolean declare;

	public AppendWaypointAdapter(RobotState appended, boolean declare) {
		this.appended = appended;
		this.declare = declare;
	}

	@Override
	public String description() {
		return "Append Waypoint";
	}

	@Override
	public boolean adaptAndPlan(PlannerFunction planner, PlanningScene scene, MotionPlanRequest request,
			MotionPlanResponse response, AddedWaypoints addedWaypoints) {
		boolean solved = planner.plan(scene, request, response);
		if (solved && response.hasTrajectory()) {
			RobotTrajectory trajectory = response.trajectory();
			List<RobotTrajectory.Waypoint> waypoints = new ArrayList<>(trajectory.waypoints());
			waypoints.add(new RobotTrajectory.Waypoint(appended, Duration.ZERO));
			response.setTrajectory(trajectory.withWaypoints(waypoints));
			if (declare) {
				addedWaypoints.record(waypoints.size() - 1);
			}
		}
		return solved;
	}
}
