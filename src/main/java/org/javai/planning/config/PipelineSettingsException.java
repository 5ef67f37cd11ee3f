package org.javai.planning.config;

import org.javai.planning.api.ConfigurationException;

/**
 * Thrown when pipeline settings cannot be read or are malformed.
 */
public class PipelineSettingsException extends ConfigurationException {

	public PipelineSettingsException(String message) {
		super(message);
	}

	public PipelineSettingsException(String message, Throwable cause) {
		super(message, cause);
	}
}
