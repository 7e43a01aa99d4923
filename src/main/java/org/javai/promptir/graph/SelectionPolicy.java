package org.javai.promptir.graph;

import java.util.Objects;
import org.javai.promptir.spec.PromptSpec;

/**
 * Rule picking one iteration's result out of an unrolled loop.
 */
public sealed interface SelectionPolicy {

	/**
	 * Scores every iteration with a judge prompt and keeps the best.
	 *
	 * @param judge prompt run once per iteration
	 * @param scoreField field of the judge's result holding the numeric score
	 * @param candidateInput judge input receiving the iteration's output
	 */
	record Argmax(PromptSpec judge, String scoreField, String candidateInput) implements SelectionPolicy {
		public Argmax {
			Objects.requireNonNull(judge, "judge must not be null");
			Objects.requireNonNull(scoreField, "scoreField must not be null");
			Objects.requireNonNull(candidateInput, "candidateInput must not be null");
		}
	}

	/**
	 * Keeps the first iteration, in iteration order, whose output satisfies the predicate.
	 *
	 * @param predicate dotted path to a boolean in the iteration output, e.g. {@code output.valid}
	 */
	record FirstSuccess(String predicate) implements SelectionPolicy {
		public FirstSuccess {
			Objects.requireNonNull(predicate, "predicate must not be null");
		}
	}

	static SelectionPolicy argmax(PromptSpec judge, String scoreField, String candidateInput) {
		return new Argmax(judge, scoreField, candidateInput);
	}

	static SelectionPolicy firstSuccess(String predicate) {
		return new FirstSuccess(predicate);
	}
}
