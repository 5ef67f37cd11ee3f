package org.javai.planning.pipeline;

import java.util.List;
import org.javai.planning.model.Contact;

/**
 * Findings of re-checking a computed path against the scene.
 *
 * @param valid whether the path is acceptable
 * @param invalidWaypoints indices of waypoints that failed the check, adapter-added ones included
 * @param contacts contacts found at the offending waypoints, empty when valid
 */
public record SolutionCheckResult(boolean valid, List<Integer> invalidWaypoints, List<Contact> contacts) {

	public SolutionCheckResult {
		invalidWaypoints = invalidWaypoints != null ? List.copyOf(invalidWaypoints) : List.of();
		contacts = contacts != null ? List.copyOf(contacts) : List.of();
	}

	public static SolutionCheckResult passed(List<Integer> tolerated) {
		return new SolutionCheckResult(true, tolerated, List.of());
	}
}
