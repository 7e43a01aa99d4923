package org.javai.promptir.graph;

import java.util.List;
import org.javai.promptir.PirException;

/**
 * Thrown when a graph's edges form a cycle.
 */
public class CyclicGraphException extends PirException {

	private final List<String> cycleNodes;

	public CyclicGraphException(String graphId, List<String> cycleNodes) {
		super("Graph '" + graphId + "' contains a cycle through " + cycleNodes);
		this.cycleNodes = List.copyOf(cycleNodes);
	}

	/**
	 * Nodes left unordered when the cycle was detected, in graph order.
	 */
	public List<String> cycleNodes() {
		return cycleNodes;
	}
}
