package org.javai.promptir.graph;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A directed graph of prompt and external nodes.
 */
public record PromptGraph(String id, List<GraphNode> nodes, List<EdgeBinding> edges) {

	public PromptGraph {
		Objects.requireNonNull(id, "id must not be null");
		nodes = nodes == null ? List.of() : List.copyOf(nodes);
		edges = edges == null ? List.of() : List.copyOf(edges);
	}

	public Optional<GraphNode> node(String nodeId) {
		return nodes.stream().filter(n -> n.id().equals(nodeId)).findFirst();
	}

	public List<GraphNode> entryNodes() {
		return nodes.stream().filter(GraphNode::entry).toList();
	}

	public List<EdgeBinding> incoming(String nodeId) {
		return edges.stream().filter(e -> e.targetNode().equals(nodeId)).toList();
	}

	public List<EdgeBinding> outgoing(String nodeId) {
		return edges.stream().filter(e -> e.source().equals(nodeId)).toList();
	}
}
