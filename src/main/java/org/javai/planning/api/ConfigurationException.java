package org.javai.planning.api;

/**
 * Thrown when a pipeline cannot be configured, for example because a planner or adapter could not be
 * resolved or refused to initialize.
 */
public class ConfigurationException extends PlanningPipelineException {

	public ConfigurationException(String message) {
		super(message);
	}

	public ConfigurationException(String message, Throwable cause) {
		super(message, cause);
	}
}
