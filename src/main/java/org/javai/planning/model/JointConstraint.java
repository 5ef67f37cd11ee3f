package org.javai.planning.model;

public record JointConstraint(String jointName, double position, double toleranceAbove, double toleranceBelow,
		double weight) {

	public boolean isSatisfiedBy(RobotState state) {
		return state.position(jointName)
				.map(actual -> actual <= position + toleranceAbove && actual >= position - toleranceBelow)
				.orElse(false);
	}
}
