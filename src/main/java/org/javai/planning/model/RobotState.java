package org.javai.planning.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Joint positions of a robot at one instant.
 */
public record RobotState(Map<String, Double> jointPositions) {

	public RobotState {
		jointPositions = jointPositions != null
				? Map.copyOf(jointPositions)
				: Map.of();
	}

	public static RobotState empty() {
		return new RobotState(Map.of());
	}

	public static RobotState of(String jointName, double position) {
		return new RobotState(Map.of(jointName, position));
	}

	public Optional<Double> position(String jointName) {
		return Optional.ofNullable(jointPositions.get(jointName));
	}

	public boolean isEmpty() {
		return jointPositions.isEmpty();
	}

	/**
	 * Returns a copy of this state with one joint moved.
	 */
	public RobotState withPosition(String jointName, double position) {
		Objects.requireNonNull(jointName, "jointName must not be null");
		Map<String, Double> copy = new LinkedHashMap<>(jointPositions);
		copy.put(jointName, position);
		return new RobotState(copy);
	}
}
