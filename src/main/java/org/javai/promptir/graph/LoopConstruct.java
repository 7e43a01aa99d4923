package org.javai.promptir.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.javai.promptir.spec.PromptSpec;

/**
 * A bounded loop over a prompt body, before unrolling.
 *
 * @param bound number of iterations; must be positive to compile
 * @param feed body input to feed expression: {@code inputs.X}, {@code state.K},
 * {@code iteration} or a double-quoted literal
 * @param initialState state key to the expression it starts from, using the same
 * expressions as {@code feed} except {@code state.K}
 * @param stateUpdate state key to the path, in the previous iteration's result, of its next value
 */
public record LoopConstruct(
		String name,
		Integer bound,
		PromptSpec body,
		Map<String, String> feed,
		Map<String, String> initialState,
		Map<String, String> stateUpdate,
		SelectionPolicy selection
) {

	public LoopConstruct {
		Objects.requireNonNull(name, "name must not be null");
		Objects.requireNonNull(body, "body must not be null");
		Objects.requireNonNull(selection, "selection must not be null");
		feed = ordered(feed);
		initialState = ordered(initialState);
		stateUpdate = ordered(stateUpdate);
	}

	/**
	 * A loop without state: iterations are independent.
	 */
	public static LoopConstruct stateless(String name, Integer bound, PromptSpec body, Map<String, String> feed,
			SelectionPolicy selection) {
		return new LoopConstruct(name, bound, body, feed, Map.of(), Map.of(), selection);
	}

	public boolean isStateful() {
		return !initialState.isEmpty() || !stateUpdate.isEmpty();
	}

	private static Map<String, String> ordered(Map<String, String> map) {
		return map == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(map));
	}
}
