package org.javai.planning.plugin;

import org.javai.planning.api.PlannerManager;

/**
 * Service provider interface for planners discovered through {@link java.util.ServiceLoader}.
 * <p>
 * Register implementations in {@code META-INF/services/org.javai.planning.plugin.PlannerProvider}.
 */
public interface PlannerProvider {

	/**
	 * The name pipelines use to select this planner, e.g. {@code ompl_interface/OMPLPlanner}.
	 */
	String name();

	PlannerManager create();
}
