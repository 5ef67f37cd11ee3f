package org.javai.planning.api;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Indices of waypoints an adapter inserted into the trajectory it returned.
 * <p>
 * Indices are relative to the trajectory as seen by the adapter that recorded them. States added by
 * adapters are excluded when the pipeline re-validates a solution.
 */
public final class AddedWaypoints {

	private final List<Integer> indices = new ArrayList<>();

	public void record(int index) {
		if (index < 0) {
			throw new IllegalArgumentException("index must not be negative: " + index);
		}
		indices.add(index);
	}

	public List<Integer> indices() {
		return Collections.unmodifiableList(indices);
	}

	public boolean isEmpty() {
		return indices.isEmpty();
	}

	public void clear() {
		indices.clear();
	}
}
