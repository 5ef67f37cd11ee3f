package org.javai.planning.pipeline;

import java.util.ArrayList;
import java.util.List;
import org.javai.planning.api.PlanningScene;
import org.javai.planning.model.Contact;
import org.javai.planning.model.MotionPlanRequest;
import org.javai.planning.model.RobotTrajectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Re-checks a path a planner reported as solved, independently of the planner's own checks.
 * <p>
 * Invalid waypoints that adapters inserted are tolerated, as is a path whose only invalid waypoint is
 * the start state.
 */
class SolutionChecker {

	private static final Logger logger = LoggerFactory.getLogger(SolutionChecker.class);

	static final int MAX_CONTACTS = 10;
	static final int MAX_CONTACTS_PER_PAIR = 3;

	SolutionCheckResult check(PlanningScene scene, MotionPlanRequest request, RobotTrajectory trajectory,
			List<Integer> addedWaypointIndices) {
		List<Integer> invalid = scene.invalidWaypoints(trajectory, request.pathConstraints(), request.groupName());
		if (invalid.isEmpty()) {
			logger.debug("Planned path was found to be valid when rechecked");
			return SolutionCheckResult.passed(List.of());
		}

		if (addedWaypointIndices.containsAll(invalid)) {
			logger.debug("Planned path was found to be valid, except for states that were added by planning request adapters");
			return SolutionCheckResult.passed(invalid);
		}

		if (invalid.size() == 1 && invalid.get(0) == 0) {
			logger.debug("The robot appears to start at an invalid state; accepting the path");
			return SolutionCheckResult.passed(invalid);
		}

		logger.error("Computed path is not valid. Invalid states at index locations: {} out of {}",
				invalid, trajectory.waypointCount());

		// MAX_CONTACTS caps the whole path, not each waypoint
		List<Contact> contacts = new ArrayList<>();
		for (int index : invalid) {
			int remaining = MAX_CONTACTS - contacts.size();
			if (remaining <= 0) {
				break;
			}
			List<Contact> found = scene.contacts(trajectory.waypoint(index), remaining, MAX_CONTACTS_PER_PAIR);
			contacts.addAll(found.size() > remaining ? found.subList(0, remaining) : found);
		}
		if (!contacts.isEmpty()) {
			logger.error("Found {} contact(s) along the invalid path", contacts.size());
		}
		return new SolutionCheckResult(false, invalid, contacts);
	}
}
