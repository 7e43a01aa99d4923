package org.javai.promptir.graph;

import org.javai.promptir.PirException;

/**
 * Thrown when no iteration satisfies a first-success predicate. The harness decides
 * whether this is fatal or falls back to something else.
 */
public class NoSuccessfulIterationException extends PirException {

	private final int iterations;

	public NoSuccessfulIterationException(String predicate, int iterations) {
		super("None of " + iterations + " iterations satisfied '" + predicate + "'");
		this.iterations = iterations;
	}

	public int iterations() {
		return iterations;
	}
}
