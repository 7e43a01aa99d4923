package org.javai.promptir.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What the harness observed for one executed loop iteration.
 *
 * @param index iteration index
 * @param output the iteration's structured result; nested maps are traversed by {@link #value}
 */
public record IterationResult(int index, Map<String, Object> output) {

	private static final String OUTPUT_PREFIX = "output.";

	public IterationResult {
		if (index < 0) {
			throw new IllegalArgumentException("index must be >= 0: " + index);
		}
		output = output == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(output));
	}

	/**
	 * Resolves a dotted path such as {@code score} or {@code output.verdict.ok}.
	 *
	 * @return the value, or null when any segment is missing
	 */
	public Object value(String path) {
		String relative = path.startsWith(OUTPUT_PREFIX) ? path.substring(OUTPUT_PREFIX.length()) : path;
		Object current = output;
		for (String segment : relative.split("\\.")) {
			if (!(current instanceof Map<?, ?> map)) {
				return null;
			}
			current = map.get(segment);
		}
		return current;
	}
}
