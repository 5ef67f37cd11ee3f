package org.javai.planning.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Materialized configuration of one planning pipeline.
 *
 * @param planningPlugin name of the planner to resolve
 * @param requestAdapters adapter names, outermost first
 * @param plannerParameters settings handed to the planner on initialization
 * @param adapterParameters adapter name to the settings handed to that adapter
 * @param publishReceivedRequests default for publishing each received request
 * @param checkSolutionPaths default for re-checking computed paths
 * @param displayComputedMotionPlans default for publishing computed paths
 */
public record PipelineSettings(
		String planningPlugin,
		List<String> requestAdapters,
		Map<String, Object> plannerParameters,
		Map<String, Map<String, Object>> adapterParameters,
		boolean publishReceivedRequests,
		boolean checkSolutionPaths,
		boolean displayComputedMotionPlans
) {

	public PipelineSettings {
		requestAdapters = requestAdapters != null ? List.copyOf(requestAdapters) : List.of();
		// YAML allows null values, so no Map.copyOf here
		plannerParameters = plannerParameters != null
				? Collections.unmodifiableMap(new LinkedHashMap<>(plannerParameters))
				: Map.of();
		adapterParameters = adapterParameters != null
				? Collections.unmodifiableMap(new LinkedHashMap<>(adapterParameters))
				: Map.of();
	}

	public static PipelineSettings of(String planningPlugin, List<String> requestAdapters) {
		return new PipelineSettings(planningPlugin, requestAdapters, Map.of(), Map.of(), false, true, true);
	}

	public Map<String, Object> parametersFor(String adapterName) {
		Map<String, Object> parameters = adapterParameters.get(adapterName);
		return parameters != null ? parameters : Map.of();
	}
}
