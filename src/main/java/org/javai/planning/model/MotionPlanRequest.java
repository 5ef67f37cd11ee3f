package org.javai.planning.model;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable description of a motion planning problem.
 * <p>
 * Adapters never mutate a request; they derive a new one with the {@code with…} methods and pass it
 * to the next stage.
 *
 * @param groupName the planning group to move
 * @param startState the state planning starts from
 * @param goalConstraints alternative goal regions; satisfying any one of them is a solution
 * @param pathConstraints constraints that must hold along the whole path
 * @param plannerId planner-specific algorithm id, may be blank for the planner's default
 * @param pipelineId the pipeline the request is addressed to, informational
 * @param numPlanningAttempts how many attempts the planner may make
 * @param allowedPlanningTime time budget for one solve
 * @param maxVelocityScalingFactor velocity scaling in (0, 1]
 * @param maxAccelerationScalingFactor acceleration scaling in (0, 1]
 * @param parameters planner-specific parameters
 */
public record MotionPlanRequest(
		String groupName,
		RobotState startState,
		List<Constraints> goalConstraints,
		Constraints pathConstraints,
		String plannerId,
		String pipelineId,
		int numPlanningAttempts,
		Duration allowedPlanningTime,
		double maxVelocityScalingFactor,
		double maxAccelerationScalingFactor,
		Map<String, Object> parameters
) {

	public static final Duration DEFAULT_PLANNING_TIME = Duration.ofSeconds(5);

	public MotionPlanRequest {
		Objects.requireNonNull(groupName, "groupName must not be null");
		startState = startState != null ? startState : RobotState.empty();
		goalConstraints = goalConstraints != null ? List.copyOf(goalConstraints) : List.of();
		pathConstraints = pathConstraints != null ? pathConstraints : Constraints.none();
		plannerId = plannerId != null ? plannerId : "";
		pipelineId = pipelineId != null ? pipelineId : "";
		if (numPlanningAttempts < 1) {
			numPlanningAttempts = 1;
		}
		allowedPlanningTime = allowedPlanningTime != null ? allowedPlanningTime : DEFAULT_PLANNING_TIME;
		maxVelocityScalingFactor = normalizeScaling(maxVelocityScalingFactor);
		maxAccelerationScalingFactor = normalizeScaling(maxAccelerationScalingFactor);
		parameters = parameters != null ? Map.copyOf(parameters) : Map.of();
	}

	public static Builder builder(String groupName) {
		return new Builder(groupName);
	}

	public MotionPlanRequest withStartState(RobotState state) {
		return new MotionPlanRequest(groupName, state, goalConstraints, pathConstraints, plannerId, pipelineId,
				numPlanningAttempts, allowedPlanningTime, maxVelocityScalingFactor, maxAccelerationScalingFactor,
				parameters);
	}

	public MotionPlanRequest withGoalConstraints(List<Constraints> goals) {
		return new MotionPlanRequest(groupName, startState, goals, pathConstraints, plannerId, pipelineId,
				numPlanningAttempts, allowedPlanningTime, maxVelocityScalingFactor, maxAccelerationScalingFactor,
				parameters);
	}

	public MotionPlanRequest withAllowedPlanningTime(Duration budget) {
		return new MotionPlanRequest(groupName, startState, goalConstraints, pathConstraints, plannerId, pipelineId,
				numPlanningAttempts, budget, maxVelocityScalingFactor, maxAccelerationScalingFactor, parameters);
	}

	public MotionPlanRequest withParameter(String key, Object value) {
		Map<String, Object> copy = new LinkedHashMap<>(parameters);
		copy.put(key, value);
		return new MotionPlanRequest(groupName, startState, goalConstraints, pathConstraints, plannerId, pipelineId,
				numPlanningAttempts, allowedPlanningTime, maxVelocityScalingFactor, maxAccelerationScalingFactor, copy);
	}

	/**
	 * True when the path or any goal stacks more than one position or orientation constraint.
	 */
	public boolean hasStackedConstraints() {
		if (pathConstraints.hasStackedConstraints()) {
			return true;
		}
		for (Constraints goal : goalConstraints) {
			if (goal.hasStackedConstraints()) {
				return true;
			}
		}
		return false;
	}

	private static double normalizeScaling(double factor) {
		// values outside (0, 1] fall back to full speed
		return factor > 0.0 && factor <= 1.0 ? factor : 1.0;
	}

	public static final class Builder {
		private final String groupName;
		private RobotState startState = RobotState.empty();
		private List<Constraints> goalConstraints = List.of();
		private Constraints pathConstraints = Constraints.none();
		private String plannerId = "";
		private String pipelineId = "";
		private int numPlanningAttempts = 1;
		private Duration allowedPlanningTime = DEFAULT_PLANNING_TIME;
		private double maxVelocityScalingFactor = 1.0;
		private double maxAccelerationScalingFactor = 1.0;
		private final Map<String, Object> parameters = new LinkedHashMap<>();

		private Builder(String groupName) {
			this.groupName = Objects.requireNonNull(groupName, "groupName must not be null");
		}

		public Builder startState(RobotState startState) {
			this.startState = startState;
			return this;
		}

		public Builder goal(Constraints goal) {
			this.goalConstraints = List.of(goal);
			return this;
		}

		public Builder goalConstraints(List<Constraints> goalConstraints) {
			this.goalConstraints = goalConstraints;
			return this;
		}

		public Builder pathConstraints(Constraints pathConstraints) {
			this.pathConstraints = pathConstraints;
			return this;
		}

		public Builder plannerId(String plannerId) {
			this.plannerId = plannerId;
			return this;
		}

		public Builder pipelineId(String pipelineId) {
			this.pipelineId = pipelineId;
			return this;
		}

		public Builder numPlanningAttempts(int numPlanningAttempts) {
			this.numPlanningAttempts = numPlanningAttempts;
			return this;
		}

		public Builder allowedPlanningTime(Duration allowedPlanningTime) {
			this.allowedPlanningTime = allowedPlanningTime;
			return this;
		}

		public Builder maxVelocityScalingFactor(double factor) {
			this.maxVelocityScalingFactor = factor;
			return this;
		}

		public Builder maxAccelerationScalingFactor(double factor) {
			this.maxAccelerationScalingFactor = factor;
			return this;
		}

		public Builder parameter(String key, Object value) {
			this.parameters.put(key, value);
			return this;
		}

		public MotionPlanRequest build() {
			return new MotionPlanRequest(groupName, startState, goalConstraints, pathConstraints, plannerId,
					pipelineId, numPlanningAttempts, allowedPlanningTime, maxVelocityScalingFactor,
					maxAccelerationScalingFactor, parameters);
		}
	}
}
