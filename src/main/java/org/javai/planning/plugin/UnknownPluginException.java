package org.javai.planning.plugin;

import org.javai.planning.api.ConfigurationException;

/**
 * Thrown when a registry has no planner or adapter under the requested name, or the plugin could not
 * be instantiated.
 */
public class UnknownPluginException extends ConfigurationException {

	private final String pluginName;

	public UnknownPluginException(String pluginName, String message) {
		super(message);
		this.pluginName = pluginName;
	}

	public UnknownPluginException(String pluginName, String message, Throwable cause) {
		super(message, cause);
		this.pluginName = pluginName;
	}

	public String pluginName() {
		return pluginName;
	}
}
