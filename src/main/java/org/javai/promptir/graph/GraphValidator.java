package org.javai.promptir.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.javai.promptir.symbol.DuplicateSymbolException;
import org.javai.promptir.symbol.UnknownSymbolException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks that a graph is well formed and orders its nodes.
 */
public final class GraphValidator {

	private static final Logger logger = LoggerFactory.getLogger(GraphValidator.class);

	private GraphValidator() {
	}

	/**
	 * @return node ids in a topological order; ties keep graph order
	 * @throws DuplicateSymbolException if two nodes share an id
	 * @throws UnknownSymbolException if an edge names a missing node
	 * @throws CyclicGraphException if the edges form a cycle
	 */
	public static List<String> validate(PromptGraph graph) {
		Map<String, Integer> indegree = new LinkedHashMap<>();
		for (GraphNode node : graph.nodes()) {
			if (indegree.putIfAbsent(node.id(), 0) != null) {
				throw new DuplicateSymbolException(node.id(),
						"Duplicate node '" + node.id() + "' in graph '" + graph.id() + "'");
			}
		}
		Map<String, List<String>> successors = new LinkedHashMap<>();
		for (EdgeBinding edge : graph.edges()) {
			requireNode(indegree, edge.source(), edge, graph);
			requireNode(indegree, edge.targetNode(), edge, graph);
			successors.computeIfAbsent(edge.source(), k -> new ArrayList<>()).add(edge.targetNode());
			indegree.merge(edge.targetNode(), 1, Integer::sum);
		}

		// Kahn's algorithm
		Deque<String> ready = new ArrayDeque<>();
		indegree.forEach((id, degree) -> {
			if (degree == 0) {
				ready.add(id);
			}
		});
		List<String> ordered = new ArrayList<>(indegree.size());
		while (!ready.isEmpty()) {
			String id = ready.poll();
			ordered.add(id);
			for (String next : successors.getOrDefault(id, List.of())) {
				if (indegree.merge(next, -1, Integer::sum) == 0) {
					ready.add(next);
				}
			}
		}
		if (ordered.size() != indegree.size()) {
			List<String> cycle = indegree.entrySet().stream()
					.filter(e -> e.getValue() > 0)
					.map(Map.Entry::getKey)
					.toList();
			throw new CyclicGraphException(graph.id(), cycle);
		}
		logger.debug("Graph '{}' is acyclic: {} nodes, {} edges", graph.id(), ordered.size(), graph.edges().size());
		return ordered;
	}

	private static void requireNode(Map<String, Integer> nodes, String id, EdgeBinding edge, PromptGraph graph) {
		if (!nodes.containsKey(id)) {
			throw new UnknownSymbolException(id, "Edge " + edge + " in graph '" + graph.id() + "' names unknown node '" + id + "'");
		}
	}
}
