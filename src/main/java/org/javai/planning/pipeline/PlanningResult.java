package org.javai.planning.pipeline;

import java.util.Objects;
import org.javai.planning.model.ErrorCode;
import org.javai.planning.model.MotionPlanResponse;

/**
 * Outcome of {@link PlanningPipeline#generatePlan}.
 * <p>
 * {@code success} is false when no plan was found, an adapter refused the request, or the computed
 * path failed re-validation. The response then carries the error code and a diagnostic message.
 *
 * @param success whether a valid plan was produced
 * @param response the response filled in by the adapter chain and the pipeline
 */
public record PlanningResult(boolean success, MotionPlanResponse response) {

	public PlanningResult {
		Objects.requireNonNull(response, "response must not be null");
	}

	public ErrorCode errorCode() {
		return response.errorCode();
	}

	public String message() {
		return response.message();
	}
}
