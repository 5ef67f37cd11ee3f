package org.javai.planning.api;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.javai.planning.model.MotionPlanRequest;
import org.javai.planning.model.MotionPlanResponse;
import org.javai.planning.model.RobotModel;

/**
 * Core planning capability. A pipeline binds exactly one planner manager at configuration time and
 * asks it for a fresh {@link PlanningContext} per request.
 */
public interface PlannerManager {

	/**
	 * Prepare the planner for the given robot.
	 *
	 * @param robotModel the robot this planner will plan for
	 * @param parameters planner-specific settings, possibly empty
	 * @return false if the planner cannot be used with this model or these parameters
	 */
	boolean initialize(RobotModel robotModel, Map<String, Object> parameters);

	String description();

	default List<String> planningAlgorithms() {
		return List.of();
	}

	default boolean canServiceRequest(MotionPlanRequest request) {
		return true;
	}

	/**
	 * Create a context for one request.
	 * <p>
	 * When the request cannot be served, returns empty and records the reason on {@code response}.
	 */
	Optional<PlanningContext> planningContext(PlanningScene scene, MotionPlanRequest request,
			TerminationSignal terminationSignal, MotionPlanResponse response);
}
