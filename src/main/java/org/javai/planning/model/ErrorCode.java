package org.javai.planning.model;

/**
 * Result codes reported on a {@link MotionPlanResponse}.
 */
public enum ErrorCode {

	SUCCESS(1),
	FAILURE(99999),

	PLANNING_FAILED(-1),
	INVALID_MOTION_PLAN(-2),
	MOTION_PLAN_INVALIDATED_BY_ENVIRONMENT_CHANGE(-3),
	CONTROL_FAILED(-4),
	UNABLE_TO_AQUIRE_SENSOR_DATA(-5),
	TIMED_OUT(-6),
	PREEMPTED(-7),

	START_STATE_IN_COLLISION(-10),
	START_STATE_VIOLATES_PATH_CONSTRAINTS(-11),
	START_STATE_INVALID(-26),

	GOAL_IN_COLLISION(-12),
	GOAL_VIOLATES_PATH_CONSTRAINTS(-13),
	GOAL_CONSTRAINTS_VIOLATED(-14),
	GOAL_STATE_INVALID(-27),

	INVALID_GROUP_NAME(-15),
	INVALID_GOAL_CONSTRAINTS(-16),
	INVALID_ROBOT_STATE(-17),
	INVALID_LINK_NAME(-18),
	INVALID_OBJECT_NAME(-19),

	FRAME_TRANSFORM_FAILURE(-21),
	COLLISION_CHECKING_UNAVAILABLE(-22),
	ROBOT_STATE_STALE(-23),
	SENSOR_INFO_STALE(-24),
	COMMUNICATION_FAILURE(-25),

	NO_IK_SOLUTION(-31);

	private final int value;

	ErrorCode(int value) {
		this.value = value;
	}

	public int value() {
		return value;
	}

	public boolean isSuccess() {
		return this == SUCCESS;
	}

	public static ErrorCode fromValue(int value) {
		for (ErrorCode code : values()) {
			if (code.value == value) {
				return code;
			}
		}
		throw new IllegalArgumentException("Unknown error code value: " + value);
	}
}
