package org.javai.promptir.graph;

import java.util.List;
import java.util.Objects;

/**
 * An unrolled loop: the graph plus what the harness needs to pick a result.
 *
 * @param bodyNodeIds body node ids in iteration order
 * @param judgeNodeIds judge node ids in iteration order; empty unless the policy is argmax
 * @param stateful whether iterations depend on their predecessor
 */
public record CompiledLoop(PromptGraph graph, SelectionPolicy policy, List<String> bodyNodeIds,
		List<String> judgeNodeIds, boolean stateful) {

	public CompiledLoop {
		Objects.requireNonNull(graph, "graph must not be null");
		Objects.requireNonNull(policy, "policy must not be null");
		bodyNodeIds = List.copyOf(bodyNodeIds);
		judgeNodeIds = judgeNodeIds == null ? List.of() : List.copyOf(judgeNodeIds);
	}

	public int bound() {
		return bodyNodeIds.size();
	}
}
