package org.javai.planning.diagnostics;

import java.util.List;
import org.javai.planning.model.RobotState;
import org.javai.planning.model.RobotTrajectory;

/**
 * A computed plan, published for display.
 *
 * @param modelId name of the robot model the plan is for
 * @param trajectoryStart the first waypoint of the plan
 * @param trajectory the plan segments, in execution order
 */
public record DisplayTrajectory(String modelId, RobotState trajectoryStart, List<RobotTrajectory> trajectory) {

	public DisplayTrajectory {
		trajectory = trajectory != null ? List.copyOf(trajectory) : List.of();
	}
}
