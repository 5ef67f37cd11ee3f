package org.javai.planning.pipeline;

import org.javai.planning.api.PlanningPipelineException;

/**
 * Thrown when a pipeline without a bound planner is asked to plan.
 */
public class PipelineNotConfiguredException extends PlanningPipelineException {

	public PipelineNotConfiguredException(String message) {
		super(message);
	}
}
