package org.javai.promptir.graph;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.javai.promptir.ir.SymbolKind;
import org.javai.promptir.spec.PromptSpec;
import org.javai.promptir.symbol.UnknownSymbolException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Unrolls a {@link LoopConstruct} into an acyclic {@link PromptGraph}.
 * <p>
 * Body nodes are named {@code <loop>_<i>} and judge nodes {@code <loop>_judge_<i>}. A loop
 * with state chains its iterations with one edge per state key, so its nodes run in order
 * even when the selection policy itself ignores order. A loop without state yields
 * independent, parallel-safe iterations.
 */
public final class LoopCompiler {

	private static final Logger logger = LoggerFactory.getLogger(LoopCompiler.class);

	static final String INPUTS_PREFIX = "inputs.";
	static final String STATE_PREFIX = "state.";
	static final String ITERATION = "iteration";
	static final String OUTPUT_PATH = "output";

	/**
	 * @throws LoopNotBoundedException if the bound is missing or not positive
	 * @throws UnknownSymbolException if the feed targets a field the body does not declare,
	 * reads an undefined state key, or the judge lacks its candidate input
	 * @throws IllegalArgumentException if a feed expression has an unsupported form
	 */
	public CompiledLoop compile(LoopConstruct loop) {
		if (loop.bound() == null || loop.bound() <= 0) {
			throw new LoopNotBoundedException(loop.name(), loop.bound());
		}
		validateFeed(loop);
		if (loop.selection() instanceof SelectionPolicy.Argmax argmax && argmax.judge().input(argmax.candidateInput()).isEmpty()) {
			throw new UnknownSymbolException(SymbolKind.INPUT, argmax.candidateInput(), argmax.judge().name());
		}

		boolean stateful = loop.isStateful();
		List<GraphNode> nodes = new ArrayList<>();
		List<EdgeBinding> edges = new ArrayList<>();
		List<String> bodyIds = new ArrayList<>();
		List<String> judgeIds = new ArrayList<>();
		Set<String> stateKeys = stateKeys(loop);

		for (int i = 0; i < loop.bound(); i++) {
			String bodyId = bodyNodeId(loop.name(), i);
			Map<String, BindingValue> bindings = new LinkedHashMap<>();
			for (Map.Entry<String, String> feed : loop.feed().entrySet()) {
				bindings.put(feed.getKey(), resolve(loop, feed.getValue(), i));
			}
			if (stateful && i == 0) {
				loop.initialState().forEach((key, expression) -> bindings.put(STATE_PREFIX + key, resolve(loop, expression, 0)));
			}
			boolean skippable = loop.selection() instanceof SelectionPolicy.FirstSuccess && i > 0;
			Scheduling scheduling = new Scheduling(i, !stateful, skippable, bindings);
			nodes.add(GraphNode.prompt(bodyId, loop.body(), !stateful || i == 0).withScheduling(scheduling));
			bodyIds.add(bodyId);

			if (stateful && i > 0) {
				String previous = bodyNodeId(loop.name(), i - 1);
				for (String key : stateKeys) {
					String path = loop.stateUpdate().getOrDefault(key, STATE_PREFIX + key);
					edges.add(new EdgeBinding(previous, path, bodyId, STATE_PREFIX + key));
				}
			}

			if (loop.selection() instanceof SelectionPolicy.Argmax argmax) {
				String judgeId = judgeNodeId(loop.name(), i);
				nodes.add(GraphNode.prompt(judgeId, argmax.judge(), false)
						.withScheduling(new Scheduling(i, true, false, Map.of())));
				edges.add(new EdgeBinding(bodyId, OUTPUT_PATH, judgeId, argmax.candidateInput()));
				judgeIds.add(judgeId);
			}
		}

		PromptGraph graph = new PromptGraph(loop.name(), nodes, edges);
		GraphValidator.validate(graph);
		logger.debug("Unrolled loop '{}': {} body nodes, {} judge nodes, {} edges, stateful={}",
				loop.name(), bodyIds.size(), judgeIds.size(), edges.size(), stateful);
		return new CompiledLoop(graph, loop.selection(), bodyIds, judgeIds, stateful);
	}

	public static String bodyNodeId(String loop, int iteration) {
		return loop + "_" + iteration;
	}

	public static String judgeNodeId(String loop, int iteration) {
		return loop + "_judge_" + iteration;
	}

	private void validateFeed(LoopConstruct loop) {
		PromptSpec body = loop.body();
		Set<String> stateKeys = stateKeys(loop);
		for (Map.Entry<String, String> feed : loop.feed().entrySet()) {
			if (body.input(feed.getKey()).isEmpty()) {
				throw new UnknownSymbolException(SymbolKind.INPUT, feed.getKey(), body.name());
			}
			String expression = feed.getValue();
			if (expression.startsWith(STATE_PREFIX)) {
				String key = expression.substring(STATE_PREFIX.length());
				if (!stateKeys.contains(key)) {
					throw new UnknownSymbolException(key, "Loop '" + loop.name() + "' feeds '" + feed.getKey()
							+ "' from state key '" + key + "', which is neither initialised nor updated");
				}
			}
		}
		for (Map.Entry<String, String> initial : loop.initialState().entrySet()) {
			if (initial.getValue().startsWith(STATE_PREFIX)) {
				throw new IllegalArgumentException("Initial state '" + initial.getKey() + "' of loop '" + loop.name()
						+ "' cannot read state: " + initial.getValue());
			}
		}
	}

	private static Set<String> stateKeys(LoopConstruct loop) {
		Set<String> keys = new LinkedHashSet<>(loop.initialState().keySet());
		keys.addAll(loop.stateUpdate().keySet());
		return keys;
	}

	private static BindingValue resolve(LoopConstruct loop, String expression, int iteration) {
		if (expression.equals(ITERATION)) {
			return new BindingValue.Literal(String.valueOf(iteration));
		}
		if (expression.startsWith(INPUTS_PREFIX) && expression.length() > INPUTS_PREFIX.length()) {
			return new BindingValue.GraphInput(expression.substring(INPUTS_PREFIX.length()));
		}
		if (expression.startsWith(STATE_PREFIX) && expression.length() > STATE_PREFIX.length()) {
			return new BindingValue.StateRef(expression.substring(STATE_PREFIX.length()));
		}
		if (expression.length() >= 2 && expression.startsWith("\"") && expression.endsWith("\"")) {
			return new BindingValue.Literal(expression.substring(1, expression.length() - 1));
		}
		throw new IllegalArgumentException("Unsupported feed expression in loop '" + loop.name() + "': " + expression);
	}
}
