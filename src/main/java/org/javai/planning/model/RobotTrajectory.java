package org.javai.planning.model;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Ordered sequence of waypoints for one planning group.
 */
public record RobotTrajectory(String groupName, List<Waypoint> waypoints) {

	public RobotTrajectory {
		waypoints = waypoints != null ? List.copyOf(waypoints) : List.of();
	}

	/**
	 * A trajectory whose waypoints carry no timing yet.
	 */
	public static RobotTrajectory untimed(String groupName, List<RobotState> states) {
		List<Waypoint> waypoints = new ArrayList<>();
		for (RobotState state : states) {
			waypoints.add(new Waypoint(state, Duration.ZERO));
		}
		return new RobotTrajectory(groupName, waypoints);
	}

	public int waypointCount() {
		return waypoints.size();
	}

	public boolean isEmpty() {
		return waypoints.isEmpty();
	}

	public RobotState waypoint(int index) {
		return waypoints.get(index).state();
	}

	public RobotState firstWaypoint() {
		if (waypoints.isEmpty()) {
			throw new IllegalStateException("Trajectory has no waypoints");
		}
		return waypoints.get(0).state();
	}

	public Duration duration() {
		Duration total = Duration.ZERO;
		for (Waypoint waypoint : waypoints) {
			total = total.plus(waypoint.fromPrevious());
		}
		return total;
	}

	/**
	 * Returns a copy with {@code state} inserted before the current first waypoint.
	 */
	public RobotTrajectory withPrefix(RobotState state) {
		List<Waypoint> copy = new ArrayList<>(waypoints.size() + 1);
		copy.add(new Waypoint(state, Duration.ZERO));
		copy.addAll(waypoints);
		return new RobotTrajectory(groupName, copy);
	}

	public RobotTrajectory withWaypoints(List<Waypoint> replacement) {
		return new RobotTrajectory(groupName, replacement);
	}

	/**
	 * @param state joint positions at this waypoint
	 * @param fromPrevious time elapsed since the previous waypoint, zero for the first
	 */
	public record Waypoint(RobotState state, Duration fromPrevious) {

		public Waypoint {
			Objects.requireNonNull(state, "state must not be null");
			fromPrevious = fromPrevious != null ? fromPrevious : Duration.ZERO;
		}
	}
}
