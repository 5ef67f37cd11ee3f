package org.javai.planning.model;

import java.util.List;

/**
 * A named set of constraints that must hold jointly, either at the goal or along the whole path.
 */
public record Constraints(
		String name,
		List<JointConstraint> jointConstraints,
		List<PositionConstraint> positionConstraints,
		List<OrientationConstraint> orientationConstraints
) {

	public Constraints {
		name = name != null ? name : "";
		jointConstraints = jointConstraints != null ? List.copyOf(jointConstraints) : List.of();
		positionConstraints = positionConstraints != null ? List.copyOf(positionConstraints) : List.of();
		orientationConstraints = orientationConstraints != null ? List.copyOf(orientationConstraints) : List.of();
	}

	public static Constraints none() {
		return new Constraints("", List.of(), List.of(), List.of());
	}

	public static Constraints ofJoints(String name, List<JointConstraint> jointConstraints) {
		return new Constraints(name, jointConstraints, List.of(), List.of());
	}

	public boolean isEmpty() {
		return jointConstraints.isEmpty() && positionConstraints.isEmpty() && orientationConstraints.isEmpty();
	}

	/**
	 * More than one position or orientation constraint usually means stale pose targets from a previous request.
	 */
	public boolean hasStackedConstraints() {
		return positionConstraints.size() > 1 || orientationConstraints.size() > 1;
	}
}
