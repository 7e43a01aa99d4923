package org.javai.promptir.optimize;

import java.util.List;
import org.javai.promptir.render.RenderedMessage;

/**
 * How an optimizer back-end exercises candidate prompts.
 */
public interface Evaluator {

	/**
	 * Sends rendered messages to a model and returns its output.
	 */
	String run(List<RenderedMessage> messages);

	/**
	 * Scores an output against the expected label; higher is better.
	 */
	double score(String output, String label);
}
