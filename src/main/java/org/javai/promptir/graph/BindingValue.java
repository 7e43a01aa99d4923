package org.javai.promptir.graph;

import java.util.Objects;

/**
 * Value of a node input fixed when the graph is compiled.
 */
public sealed interface BindingValue {

	/** A constant known at compile time. */
	record Literal(String value) implements BindingValue {
		public Literal {
			Objects.requireNonNull(value, "value must not be null");
		}
	}

	/** Reads an input of the graph itself. */
	record GraphInput(String name) implements BindingValue {
		public GraphInput {
			Objects.requireNonNull(name, "name must not be null");
		}
	}

	/** Reads the loop state delivered to this node under {@code state.<key>}. */
	record StateRef(String key) implements BindingValue {
		public StateRef {
			Objects.requireNonNull(key, "key must not be null");
		}
	}
}
