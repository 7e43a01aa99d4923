package org.javai.promptir.graph;

/**
 * What a graph node invokes.
 */
public enum NodeKind {
	/** A prompt rendered from a {@link org.javai.promptir.spec.PromptSpec}. */
	PROMPT,
	/** A tool or service outside the prompt layer, described only by its schemas. */
	EXTERNAL
}
