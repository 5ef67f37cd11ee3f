package org.javai.planning.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Kinematic description of the robot a pipeline plans for.
 *
 * @param name the model name, reported on displayed trajectories
 * @param modelFrame the root frame of the model
 * @param jointGroups planning group name to the joints it moves
 */
public record RobotModel(String name, String modelFrame, Map<String, List<String>> jointGroups) {

	public RobotModel {
		Objects.requireNonNull(name, "name must not be null");
		modelFrame = modelFrame != null ? modelFrame : "world";
		jointGroups = jointGroups != null ? Map.copyOf(jointGroups) : Map.of();
	}

	public boolean hasJointGroup(String groupName) {
		return groupName != null && jointGroups.containsKey(groupName);
	}

	public List<String> jointNames(String groupName) {
		List<String> joints = jointGroups.get(groupName);
		return joints != null ? List.copyOf(joints) : List.of();
	}
}
