package org.javai.planning.testsupport;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.javai.planning.api.PlannerManager;
import org.javai.planning.api.PlanningContext;
import org.javai.planning.api.PlanningScene;
import org.javai.planning.api.TerminationSignal;
import org.javai.planning.model.Constraints;
import org.javai.planning.model.ErrorCode;
import org.javai.planning.model.JointConstraint;
import org.javai.planning.model.MotionPlanRequest;
import org.javai.planning.model.MotionPlanResponse;
import org.javai.planning.model.RobotModel;
import org.javai.planning.model.RobotState;
import org.javai.planning.model.RobotTrajectory;

/**
 * Interpolates joint positions from the start state to the first joint goal. Ignores obstacles, which
 * makes it useful for exercising re-validation.
 */
public class StraightLinePlanner implements PlannerManager {

	public static final String WAYPOINTS = "waypoints";

	private RobotModel robotModel;
	private int waypoints = 5;
	private volatile MotionPlanRequest lastRequest;

	@Override
	public boolean initialize(RobotModel robotModel, Map<String, Object> parameters) {
		this.robotModel = robotModel;
		Object configured = parameters.get(WAYPOINTS);
		if (configured instanceof Number number) {
			this.waypoints = number.intValue();
		}
		return waypoints >= 2 && !robotModel.jointGroups().isEmpty();
	}

	@Override
	public String description() {
		return "StraightLine";
	}

	@Override
	public List<String> planningAlgorithms() {
		return List.of("linear");
	}

	@Override
	public Optional<PlanningContext> planningContext(PlanningScene scene, MotionPlanRequest request,
			TerminationSignal terminationSignal, MotionPlanResponse response) {
		if (!robotModel.hasJointGroup(request.groupName())) {
			response.fail(ErrorCode.INVALID_GROUP_NAME, "Unknown group '" + request.groupName() + "'");
			return Optional.empty();
		}
		return Optional.of(new LinearContext(request, terminationSignal));
	}

	public MotionPlanRequest lastRequest() {
		return lastRequest;
	}

	public int waypoints() {
		return waypoints;
	}

	private final class LinearContext implements PlanningContext {

		private final MotionPlanRequest request;
		private final TerminationSignal terminationSignal;

		LinearContext(MotionPlanRequest request, TerminationSignal terminationSignal) {
			this.request = request;
			this.terminationSignal = terminationSignal;
		}

		@Override
		public String name() {
			return "linear";
		}

		@Override
		public boolean solve(MotionPlanResponse response) {
			lastRequest = request;
			if (request.goalConstraints().isEmpty()
					|| request.goalConstraints().get(0).jointConstraints().isEmpty()) {
				response.fail(ErrorCode.INVALID_GOAL_CONSTRAINTS, "No joint goal given");
				return false;
			}
			Constraints goal = request.goalConstraints().get(0);
			RobotState start = request.startState();
			List<RobotState> states = new ArrayList<>();
			for (int i = 0; i < waypoints; i++) {
				if (terminationSignal.shouldStop()) {
					response.fail(ErrorCode.PREEMPTED, "Planning was terminated");
					return false;
				}
				double fraction = (double) i / (waypoints - 1);
				RobotState state = start;
				for (JointConstraint target : goal.jointConstraints()) {
					double from = start.position(target.jointName()).orElse(0.0);
					state = state.withPosition(target.jointName(), from + (target.position() - from) * fraction);
				}
				states.add(state);
			}
			response.setTrajectory(RobotTrajectory.untimed(request.groupName(), states));
			response.setStartState(start);
			response.setPlanningTime(Duration.ofMillis(1));
			response.setErrorCode(ErrorCode.SUCCESS);
			return true;
		}
	}
}
