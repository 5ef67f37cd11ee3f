/**
 * Capabilities a planning pipeline composes.
 * <p>
 * Planners implement {@link org.javai.planning.api.PlannerManager} and hand out one
 * {@link org.javai.planning.api.PlanningContext} per request. Request adapters implement
 * {@link org.javai.planning.api.PlanningRequestAdapter} and wrap the next stage of the chain.
 * Both are looked up by name; see {@link org.javai.planning.plugin.CapabilityRegistry}.
 */
package org.javai.planning.api;
