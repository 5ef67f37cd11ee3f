package org.javai.planning.diagnostics;

/**
 * Thrown by a sink that could not deliver a message.
 */
public class DiagnosticPublishException extends RuntimeException {

	public DiagnosticPublishException(String message, Throwable cause) {
		super(message, cause);
	}
}
