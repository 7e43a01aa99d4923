package org.javai.promptir.graph;

import java.util.List;
import java.util.Objects;
import org.javai.promptir.ir.OutputField;
import org.javai.promptir.spec.PromptSpec;

/**
 * A node of a {@link PromptGraph}: either a prompt or an external call.
 * <p>
 * Prompt nodes carry their {@link PromptSpec}; their input surface is the spec's inputs and
 * their output surface the spec's output schema. External nodes carry both surfaces explicitly.
 *
 * @param spec the prompt; null for external nodes
 * @param entry whether the node can start without any incoming edge
 */
public record GraphNode(
		String id,
		NodeKind kind,
		PromptSpec spec,
		List<OutputField> inputSchema,
		List<OutputField> outputSchema,
		boolean entry,
		Scheduling scheduling
) {

	public GraphNode {
		Objects.requireNonNull(id, "id must not be null");
		Objects.requireNonNull(kind, "kind must not be null");
		if (kind == NodeKind.PROMPT && spec == null) {
			throw new IllegalArgumentException("Prompt node '" + id + "' requires a spec");
		}
		if (kind == NodeKind.EXTERNAL && spec != null) {
			throw new IllegalArgumentException("External node '" + id + "' cannot carry a spec");
		}
		inputSchema = inputSchema == null ? List.of() : List.copyOf(inputSchema);
		outputSchema = outputSchema == null ? List.of() : List.copyOf(outputSchema);
		scheduling = scheduling == null ? Scheduling.standalone() : scheduling;
	}

	public static GraphNode prompt(String id, PromptSpec spec, boolean entry) {
		List<OutputField> inputs = spec.inputs().stream()
				.map(input -> new OutputField(input.name(), input.kind(), input.required(), null))
				.toList();
		return new GraphNode(id, NodeKind.PROMPT, spec, inputs, spec.outputSchema(), entry, null);
	}

	public static GraphNode external(String id, List<OutputField> inputSchema, List<OutputField> outputSchema) {
		return new GraphNode(id, NodeKind.EXTERNAL, null, inputSchema, outputSchema, true, null);
	}

	public boolean isPrompt() {
		return kind == NodeKind.PROMPT;
	}

	public boolean acceptsInput(String field) {
		return inputSchema.stream().anyMatch(f -> f.key().equals(field));
	}

	public GraphNode withEntry(boolean isEntry) {
		return new GraphNode(id, kind, spec, inputSchema, outputSchema, isEntry, scheduling);
	}

	public GraphNode withScheduling(Scheduling newScheduling) {
		return new GraphNode(id, kind, spec, inputSchema, outputSchema, entry, newScheduling);
	}
}
