package org.javai.planning.pipeline;

import java.util.List;
import org.javai.planning.model.MotionPlanResponse;

/**
 * Outcome of one pass through an {@link AdapterChain}.
 *
 * @param success what the outermost stage reported
 * @param response the response every stage wrote into
 * @param addedWaypointIndices sorted indices of trajectory waypoints inserted by adapters
 */
public record ChainResult(boolean success, MotionPlanResponse response, List<Integer> addedWaypointIndices) {

	public ChainResult {
		addedWaypointIndices = addedWaypointIndices != null ? List.copyOf(addedWaypointIndices) : List.of();
	}
}
