package org.javai.planning.pipeline;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import org.javai.planning.api.AddedWaypoints;
import org.javai.planning.api.PlannerFunction;
import org.javai.planning.api.PlanningRequestAdapter;
import org.javai.planning.api.PlanningScene;
import org.javai.planning.model.MotionPlanRequest;
import org.javai.planning.model.MotionPlanResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ordered adapters wrapped around a planner function.
 * <p>
 * The first adapter is the outermost: it sees the request first and the response last. Each call
 * composes the stages right to left, so every adapter is handed a downstream function that is already
 * complete. The adapter list itself is fixed at construction.
 */
public final class AdapterChain {

	private static final Logger logger = LoggerFactory.getLogger(AdapterChain.class);

	private final List<PlanningRequestAdapter> adapters;

	public AdapterChain(List<PlanningRequestAdapter> adapters) {
		Objects.requireNonNull(adapters, "adapters must not be null");
		for (PlanningRequestAdapter adapter : adapters) {
			Objects.requireNonNull(adapter, "adapters must not contain null");
		}
		this.adapters = List.copyOf(adapters);
	}

	public static AdapterChain empty() {
		return new AdapterChain(List.of());
	}

	public List<PlanningRequestAdapter> adapters() {
		return adapters;
	}

	public int size() {
		return adapters.size();
	}

	public boolean isEmpty() {
		return adapters.isEmpty();
	}

	/**
	 * Run {@code request} through every adapter and finally {@code planner}.
	 */
	public ChainResult adaptAndPlan(PlannerFunction planner, PlanningScene scene, MotionPlanRequest request) {
		Objects.requireNonNull(planner, "planner must not be null");
		MotionPlanResponse response = new MotionPlanResponse();

		if (adapters.isEmpty()) {
			boolean solved = planner.plan(scene, request, response);
			return new ChainResult(solved, response, List.of());
		}

		List<AddedWaypoints> addedByAdapter = new ArrayList<>(adapters.size());
		for (int i = 0; i < adapters.size(); i++) {
			addedByAdapter.add(new AddedWaypoints());
		}

		PlannerFunction chain = planner;
		for (int i = adapters.size() - 1; i >= 0; i--) {
			chain = link(adapters.get(i), chain, addedByAdapter.get(i));
		}

		logger.debug("Calling planner through {} request adapter(s)", adapters.size());
		boolean solved = chain.plan(scene, request, response);
		return new ChainResult(solved, response, mergeAddedWaypoints(addedByAdapter));
	}

	private static PlannerFunction link(PlanningRequestAdapter adapter, PlannerFunction next, AddedWaypoints added) {
		return (scene, request, response) -> adapter.adaptAndPlan(next, scene, request, response, added);
	}

	/**
	 * Merge the per-adapter indices, outermost adapter first. Every index an inner adapter added
	 * shifts the already merged indices at or after it by one.
	 */
	static List<Integer> mergeAddedWaypoints(List<AddedWaypoints> addedByAdapter) {
		List<Integer> merged = new ArrayList<>();
		for (AddedWaypoints added : addedByAdapter) {
			for (int addedIndex : added.indices()) {
				for (int i = 0; i < merged.size(); i++) {
					int existing = merged.get(i);
					if (addedIndex <= existing) {
						merged.set(i, existing + 1);
					}
				}
				merged.add(addedIndex);
			}
		}
		Collections.sort(merged);
		return merged;
	}
}
