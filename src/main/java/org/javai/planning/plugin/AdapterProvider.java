package org.javai.planning.plugin;

import org.javai.planning.api.PlanningRequestAdapter;

/**
 * Service provider interface for request adapters discovered through {@link java.util.ServiceLoader}.
 * <p>
 * Register implementations in {@code META-INF/services/org.javai.planning.plugin.AdapterProvider}.
 */
public interface AdapterProvider {

	String name();

	PlanningRequestAdapter create();
}
