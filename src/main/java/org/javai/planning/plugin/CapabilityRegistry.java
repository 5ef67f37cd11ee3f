package org.javai.planning.plugin;

import org.javai.planning.api.PlannerManager;
import org.javai.planning.api.PlanningRequestAdapter;

/**
 * Resolves planner and adapter implementations by name.
 * <p>
 * Every resolution returns a fresh instance; the caller owns it.
 */
public interface CapabilityRegistry {

	/**
	 * @throws UnknownPluginException if no planner is registered under {@code name} or it cannot be created
	 */
	PlannerManager resolvePlanner(String name);

	/**
	 * @throws UnknownPluginException if no adapter is registered under {@code name} or it cannot be created
	 */
	PlanningRequestAdapter resolveAdapter(String name);
}
