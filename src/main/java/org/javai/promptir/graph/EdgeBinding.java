package org.javai.promptir.graph;

import java.util.Objects;

/**
 * Moves a value from one node's result into another node's input.
 *
 * @param source id of the producing node
 * @param path expression selecting the value from the source's result, e.g. {@code output}
 * @param targetNode id of the consuming node
 * @param targetField input field of the consuming node, e.g. {@code candidate} or {@code state.best}
 */
public record EdgeBinding(String source, String path, String targetNode, String targetField) {

	private static final String INPUTS = ".inputs.";

	public EdgeBinding {
		Objects.requireNonNull(source, "source must not be null");
		Objects.requireNonNull(path, "path must not be null");
		Objects.requireNonNull(targetNode, "targetNode must not be null");
		Objects.requireNonNull(targetField, "targetField must not be null");
	}

	/**
	 * Creates an edge from a destination written as {@code node.inputs.field}.
	 *
	 * @throws IllegalArgumentException if the destination has another shape
	 */
	public static EdgeBinding parse(String source, String path, String destination) {
		int at = destination.indexOf(INPUTS);
		if (at <= 0 || at + INPUTS.length() >= destination.length()) {
			throw new IllegalArgumentException("Edge destination must read node.inputs.field: " + destination);
		}
		return new EdgeBinding(source, path, destination.substring(0, at), destination.substring(at + INPUTS.length()));
	}

	public String destination() {
		return targetNode + INPUTS + targetField;
	}

	@Override
	public String toString() {
		return source + "." + path + " -> " + destination();
	}
}
