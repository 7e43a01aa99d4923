package org.javai.promptir.graph;

import org.javai.promptir.PirException;

/**
 * Thrown when argmax selection runs over zero iteration results.
 */
public class EmptyCandidateSetException extends PirException {

	public EmptyCandidateSetException(String scoreField) {
		super("No iteration results to select from by '" + scoreField + "'");
	}
}
