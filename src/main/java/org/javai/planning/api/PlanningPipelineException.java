package org.javai.planning.api;

/**
 * Base class for structural pipeline errors: the pipeline is misconfigured or cannot accept the
 * call. Failing to find a plan is not one of these; it is reported through the planning result.
 */
public class PlanningPipelineException extends RuntimeException {

	public PlanningPipelineException(String message) {
		super(message);
	}

	public PlanningPipelineException(String message, Throwable cause) {
		super(message, cause);
	}
}
