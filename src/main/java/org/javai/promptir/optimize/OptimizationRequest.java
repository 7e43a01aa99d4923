package org.javai.promptir.optimize;

import java.util.List;
import java.util.Objects;
import org.javai.promptir.lint.Diagnostic;
import org.javai.promptir.spec.PromptSpec;

/**
 * What a back-end receives: the spec to improve, its lint findings and an evaluator.
 */
public record OptimizationRequest(PromptSpec spec, List<Diagnostic> diagnostics, Evaluator evaluator) {

	public OptimizationRequest {
		Objects.requireNonNull(spec, "spec must not be null");
		Objects.requireNonNull(evaluator, "evaluator must not be null");
		diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
	}
}
