package org.javai.planning.api;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation token shared between a pipeline and the planning contexts it creates.
 * <p>
 * The pipeline sets and clears the signal; planners poll {@link #shouldStop()} at safe points and
 * return early (typically with {@code PREEMPTED}) once it is raised. Nothing is interrupted forcibly.
 */
public final class TerminationSignal {

	private final AtomicBoolean stopRequested = new AtomicBoolean(false);

	public void requestStop() {
		stopRequested.set(true);
	}

	public boolean shouldStop() {
		return stopRequested.get();
	}

	/**
	 * Clears a previous stop request so the signal can serve the next planning call.
	 */
	public void reset() {
		stopRequested.set(false);
	}
}
