package org.javai.planning.pipeline;

/**
 * Per-call switches for {@link PlanningPipeline#generatePlan}.
 *
 * @param publishReceivedRequests publish each request before planning starts
 * @param checkSolutionPaths re-check computed paths against the scene
 * @param displayComputedMotionPlans publish computed paths for display
 */
public record GenerationOptions(
		boolean publishReceivedRequests,
		boolean checkSolutionPaths,
		boolean displayComputedMotionPlans
) {

	public static GenerationOptions defaults() {
		return new GenerationOptions(false, true, true);
	}

	/**
	 * No publishing and no re-checking: the chain's answer is returned as is.
	 */
	public static GenerationOptions quiet() {
		return new GenerationOptions(false, false, false);
	}

	public GenerationOptions withPublishReceivedRequests(boolean enabled) {
		return new GenerationOptions(enabled, checkSolutionPaths, displayComputedMotionPlans);
	}

	public GenerationOptions withCheckSolutionPaths(boolean enabled) {
		return new GenerationOptions(publishReceivedRequests, enabled, displayComputedMotionPlans);
	}

	public GenerationOptions withDisplayComputedMotionPlans(boolean enabled) {
		return new GenerationOptions(publishReceivedRequests, checkSolutionPaths, enabled);
	}
}
