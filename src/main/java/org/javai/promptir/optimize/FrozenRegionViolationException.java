package org.javai.promptir.optimize;

import org.javai.promptir.PirException;

/**
 * Raised when an optimizer changed something it was not allowed to touch.
 */
public class FrozenRegionViolationException extends PirException {

	private final String entity;

	public FrozenRegionViolationException(String entity, String message) {
		super(message);
		this.entity = entity;
	}

	/**
	 * The section, input, template or setting that changed.
	 */
	public String entity() {
		return entity;
	}
}
