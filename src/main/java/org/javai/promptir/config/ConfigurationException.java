package org.javai.promptir.config;

import org.javai.promptir.PirException;

/**
 * Raised when settings cannot be located or do not have the expected shape.
 */
public class ConfigurationException extends PirException {

	public ConfigurationException(String message) {
		super(message);
	}

	public ConfigurationException(String message, Throwable cause) {
		super(message, cause);
	}
}
