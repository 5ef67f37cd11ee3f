package org.javai.planning.diagnostics;

/**
 * Channel for diagnostic messages a pipeline emits while planning: the received request, the
 * computed trajectory and contacts found while re-checking it.
 * <p>
 * Publishing is best effort. A pipeline logs any exception a sink throws and carries on.
 */
@FunctionalInterface
public interface DiagnosticSink {

	DiagnosticSink NO_OP = (channel, message) -> {
	};

	/**
	 * @param channel logical channel name, e.g. {@code display_planned_path}
	 * @param message the payload: a request, a {@link DisplayTrajectory} or {@link ContactMarkers}
	 */
	void publish(String channel, Object message);
}
