package org.javai.planning.model;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Mutable result of one planning call.
 * <p>
 * Each stage of the adapter chain writes into the same response on its way back up. A response is
 * owned by the call that created it and is not safe for concurrent use.
 */
public class MotionPlanResponse {

	private RobotTrajectory trajectory;
	private RobotState startState;
	private ErrorCode errorCode = ErrorCode.SUCCESS;
	private String message = "";
	private Duration planningTime = Duration.ZERO;
	private final List<Contact> contacts = new ArrayList<>();

	public RobotTrajectory trajectory() {
		return trajectory;
	}

	public void setTrajectory(RobotTrajectory trajectory) {
		this.trajectory = trajectory;
	}

	public boolean hasTrajectory() {
		return trajectory != null;
	}

	public RobotState startState() {
		return startState;
	}

	public void setStartState(RobotState startState) {
		this.startState = startState;
	}

	public ErrorCode errorCode() {
		return errorCode;
	}

	public void setErrorCode(ErrorCode errorCode) {
		this.errorCode = errorCode != null ? errorCode : ErrorCode.FAILURE;
	}

	public String message() {
		return message;
	}

	public void setMessage(String message) {
		this.message = message != null ? message : "";
	}

	public Duration planningTime() {
		return planningTime;
	}

	public void setPlanningTime(Duration planningTime) {
		this.planningTime = planningTime != null ? planningTime : Duration.ZERO;
	}

	public List<Contact> contacts() {
		return Collections.unmodifiableList(contacts);
	}

	public void addContacts(List<Contact> found) {
		if (found != null) {
			contacts.addAll(found);
		}
	}

	/**
	 * Marks this response as failed with the given code and diagnostic text.
	 */
	public void fail(ErrorCode code, String reason) {
		setErrorCode(code);
		setMessage(reason);
	}

	public boolean isSuccess() {
		return errorCode.isSuccess();
	}

	@Override
	public String toString() {
		return "MotionPlanResponse[errorCode=" + errorCode
				+ ", waypoints=" + (trajectory != null ? trajectory.waypointCount() : 0)
				+ ", planningTime=" + planningTime
				+ ", message=" + message + "]";
	}
}
