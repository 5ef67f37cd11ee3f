/**
 * Name to implementation lookup for planners and request adapters.
 * <p>
 * Plugins are contributed through {@link org.javai.planning.plugin.PlannerProvider} and
 * {@link org.javai.planning.plugin.AdapterProvider} service files, or registered by hand on a
 * {@link org.javai.planning.plugin.DefaultCapabilityRegistry}.
 */
package org.javai.planning.plugin;
