package org.javai.planning.pipeline;

import org.javai.planning.api.PlanningPipelineException;

/**
 * Thrown when a pipeline is asked to plan or reconfigure while it is already computing a plan.
 */
public class PipelineBusyException extends PlanningPipelineException {

	public PipelineBusyException(String message) {
		super(message);
	}
}
