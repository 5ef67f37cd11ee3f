package org.javai.planning.config;

import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.yaml.snakeyaml.Yaml;

/**
 * Reads {@link PipelineSettings} from YAML.
 *
 * <pre>
 * ompl:
 *   planning_plugin: ompl_interface/OMPLPlanner
 *   request_adapters: &gt;-
 *     default_planner_request_adapters/FixStartStateBounds
 *     default_planner_request_adapters/AddTimeOptimalParameterization
 *   check_solution_paths: true
 *   planner_parameters:
 *     longest_valid_segment_fraction: 0.005
 *   adapter_parameters:
 *     default_planner_request_adapters/FixStartStateBounds:
 *       start_state_max_bounds_error: 0.1
 * </pre>
 *
 * Settings may sit at the document root or under a namespace key such as {@code ompl}.
 * {@code request_adapters} is either a YAML list or a whitespace-separated string.
 */
public class PipelineSettingsParser {

	static final String PLANNING_PLUGIN = "planning_plugin";
	static final String REQUEST_ADAPTERS = "request_adapters";
	static final String PLANNER_PARAMETERS = "planner_parameters";
	static final String ADAPTER_PARAMETERS = "adapter_parameters";
	static final String PUBLISH_RECEIVED_REQUESTS = "publish_received_requests";
	static final String CHECK_SOLUTION_PATHS = "check_solution_paths";
	static final String DISPLAY_COMPUTED_MOTION_PLANS = "display_computed_motion_plans";

	private final Yaml yaml = new Yaml();

	public PipelineSettings parse(Path path, String namespace) {
		try (var reader = Files.newBufferedReader(path)) {
			return parse(reader, namespace);
		}
		catch (PipelineSettingsException e) {
			throw e;
		}
		catch (Exception e) {
			throw new PipelineSettingsException("Failed to read pipeline settings from path: " + path, e);
		}
	}

	public PipelineSettings parse(InputStream inputStream, String namespace) {
		Object data;
		try {
			data = yaml.load(inputStream);
		}
		catch (Exception e) {
			throw new PipelineSettingsException("Failed to read pipeline settings from input stream", e);
		}
		return build(data, namespace);
	}

	public PipelineSettings parse(Reader reader, String namespace) {
		Object data;
		try {
			data = yaml.load(reader);
		}
		catch (Exception e) {
			throw new PipelineSettingsException("Failed to read pipeline settings from reader", e);
		}
		return build(data, namespace);
	}

	public PipelineSettings parseString(String yamlContent) {
		return parseString(yamlContent, null);
	}

	public PipelineSettings parseString(String yamlContent, String namespace) {
		Object data;
		try {
			data = yaml.load(yamlContent);
		}
		catch (Exception e) {
			throw new PipelineSettingsException("Failed to read pipeline settings from string", e);
		}
		return build(data, namespace);
	}

	private PipelineSettings build(Object data, String namespace) {
		Map<String, Object> root = asMap(data, "document");
		Map<String, Object> section = root;
		if (namespace != null && !namespace.isBlank()) {
			Object scoped = root.get(namespace);
			if (scoped == null) {
				throw new PipelineSettingsException("No pipeline settings under namespace '" + namespace + "'");
			}
			section = asMap(scoped, namespace);
		}

		Object plugin = section.get(PLANNING_PLUGIN);
		if (!(plugin instanceof String pluginName) || pluginName.isBlank()) {
			throw new PipelineSettingsException("'" + PLANNING_PLUGIN + "' must be a non-empty string");
		}

		return new PipelineSettings(
				pluginName.trim(),
				adapterNames(section.get(REQUEST_ADAPTERS)),
				optionalMap(section.get(PLANNER_PARAMETERS), PLANNER_PARAMETERS),
				adapterParameters(section.get(ADAPTER_PARAMETERS)),
				flag(section, PUBLISH_RECEIVED_REQUESTS, false),
				flag(section, CHECK_SOLUTION_PATHS, true),
				flag(section, DISPLAY_COMPUTED_MOTION_PLANS, true)
		);
	}

	private static List<String> adapterNames(Object value) {
		List<String> names = new ArrayList<>();
		if (value == null) {
			return names;
		}
		if (value instanceof String text) {
			for (String token : text.trim().split("\\s+")) {
				if (!token.isEmpty()) {
					names.add(token);
				}
			}
			return names;
		}
		if (value instanceof List<?> list) {
			for (Object item : list) {
				if (!(item instanceof String name) || name.isBlank()) {
					throw new PipelineSettingsException("'" + REQUEST_ADAPTERS + "' entries must be non-empty strings");
				}
				names.add(name.trim());
			}
			return names;
		}
		throw new PipelineSettingsException("'" + REQUEST_ADAPTERS + "' must be a list or a whitespace-separated string");
	}

	private static Map<String, Map<String, Object>> adapterParameters(Object value) {
		Map<String, Map<String, Object>> result = new LinkedHashMap<>();
		for (Map.Entry<String, Object> entry : optionalMap(value, ADAPTER_PARAMETERS).entrySet()) {
			result.put(entry.getKey(), optionalMap(entry.getValue(), ADAPTER_PARAMETERS + "." + entry.getKey()));
		}
		return result;
	}

	private static boolean flag(Map<String, Object> section, String key, boolean defaultValue) {
		Object value = section.get(key);
		if (value == null) {
			return defaultValue;
		}
		if (value instanceof Boolean b) {
			return b;
		}
		throw new PipelineSettingsException("'" + key + "' must be a boolean but was: " + value);
	}

	private static Map<String, Object> optionalMap(Object value, String what) {
		if (value == null) {
			return Map.of();
		}
		return asMap(value, what);
	}

	private static Map<String, Object> asMap(Object value, String what) {
		if (!(value instanceof Map<?, ?> map)) {
			throw new PipelineSettingsException("Expected a mapping for '" + what + "'");
		}
		Map<String, Object> result = new LinkedHashMap<>();
		for (Map.Entry<?, ?> entry : map.entrySet()) {
			result.put(String.valueOf(entry.getKey()), entry.getValue());
		}
		return result;
	}
}
