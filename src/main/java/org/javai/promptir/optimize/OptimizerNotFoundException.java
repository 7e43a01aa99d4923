package org.javai.promptir.optimize;

import org.javai.promptir.PirException;

/**
 * Raised when no optimizer back-end is registered under the requested name.
 */
public class OptimizerNotFoundException extends PirException {

	public OptimizerNotFoundException(String name) {
		super("No optimizer registered as '" + name + "'");
	}
}
