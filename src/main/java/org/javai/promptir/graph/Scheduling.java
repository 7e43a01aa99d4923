package org.javai.promptir.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Execution contract a node exposes to the harness that runs the graph.
 *
 * @param iteration loop iteration this node instantiates; null outside loops
 * @param parallelSafe whether the node may run concurrently with its siblings
 * @param skippableAfterSuccess whether the harness may skip the node once an earlier
 * iteration succeeded; iteration order still decides which success is first
 * @param bindings input field to statically bound value, in insertion order
 */
public record Scheduling(Integer iteration, boolean parallelSafe, boolean skippableAfterSuccess,
		Map<String, BindingValue> bindings) {

	private static final Scheduling STANDALONE = new Scheduling(null, true, false, Map.of());

	public Scheduling {
		bindings = bindings == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(bindings));
	}

	public static Scheduling standalone() {
		return STANDALONE;
	}

	public Scheduling withSkippableAfterSuccess(boolean skippable) {
		return new Scheduling(iteration, parallelSafe, skippable, bindings);
	}
}
