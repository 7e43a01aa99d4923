package org.javai.promptir.graph;

import org.javai.promptir.PirException;

/**
 * Thrown when a loop has no positive bound known at compile time.
 */
public class LoopNotBoundedException extends PirException {

	public LoopNotBoundedException(String loop, Integer bound) {
		super(bound == null
				? "Loop '" + loop + "' has no bound"
				: "Loop '" + loop + "' must have a positive bound, got " + bound);
	}
}
