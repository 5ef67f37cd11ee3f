package org.javai.planning.api;

import java.util.ArrayList;
import java.util.List;
import org.javai.planning.model.Constraints;
import org.javai.planning.model.Contact;
import org.javai.planning.model.RobotModel;
import org.javai.planning.model.RobotState;
import org.javai.planning.model.RobotTrajectory;

/**
 * The environment a request is planned and validated against: robot model, obstacles and the
 * collision/constraint checks over them.
 */
public interface PlanningScene {

	String name();

	RobotModel robotModel();

	/**
	 * The frame contacts are reported in.
	 */
	default String planningFrame() {
		return robotModel().modelFrame();
	}

	/**
	 * Whether {@code state} is collision free and satisfies {@code constraints} for the group.
	 */
	boolean isStateValid(RobotState state, Constraints constraints, String groupName);

	/**
	 * Contacts between bodies at {@code state}, at most {@code maxContacts} in total and
	 * {@code maxContactsPerPair} for any pair of bodies.
	 */
	List<Contact> contacts(RobotState state, int maxContacts, int maxContactsPerPair);

	/**
	 * Indices of the waypoints of {@code trajectory} that are not valid states.
	 */
	default List<Integer> invalidWaypoints(RobotTrajectory trajectory, Constraints pathConstraints, String groupName) {
		List<Integer> invalid = new ArrayList<>();
		for (int i = 0; i < trajectory.waypointCount(); i++) {
			if (!isStateValid(trajectory.waypoint(i), pathConstraints, groupName)) {
				invalid.add(i);
			}
		}
		return invalid;
	}
}
