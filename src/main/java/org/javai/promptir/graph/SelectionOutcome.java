package org.javai.promptir.graph;

import java.util.List;

/**
 * The chosen iteration and the iterations the harness may skip.
 */
public record SelectionOutcome(int selectedIndex, List<Integer> skippedIndices) {

	public SelectionOutcome {
		skippedIndices = skippedIndices == null ? List.of() : List.copyOf(skippedIndices);
	}
}
