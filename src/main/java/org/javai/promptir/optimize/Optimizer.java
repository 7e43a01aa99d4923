package org.javai.promptir.optimize;

import java.util.List;
import java.util.Objects;
import org.javai.promptir.lint.Diagnostic;
import org.javai.promptir.lint.LintEngine;
import org.javai.promptir.spec.PromptLowering;
import org.javai.promptir.spec.PromptSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs an optimizer back-end over a spec and checks the result.
 * <p>
 * The back-end receives the spec's lint diagnostics. Its result is accepted only if every
 * frozen entity survived unchanged.
 */
public class Optimizer {

	private static final Logger logger = LoggerFactory.getLogger(Optimizer.class);

	private final PromptLowering lowering;
	private final LintEngine lintEngine;
	private final FrozenRegionGuard guard;

	public Optimizer() {
		this(new PromptLowering(), LintEngine.standard(), new FrozenRegionGuard());
	}

	public Optimizer(PromptLowering lowering, LintEngine lintEngine, FrozenRegionGuard guard) {
		this.lowering = Objects.requireNonNull(lowering, "lowering must not be null");
		this.lintEngine = Objects.requireNonNull(lintEngine, "lintEngine must not be null");
		this.guard = Objects.requireNonNull(guard, "guard must not be null");
	}

	/**
	 * @throws OptimizerNotFoundException if {@code name} is not registered
	 * @throws FrozenRegionViolationException if the back-end touched a frozen entity
	 * @throws org.javai.promptir.spec.UnsupportedConstructException if the spec does not lower
	 */
	public PromptSpec optimize(OptimizerRegistry registry, String name, PromptSpec spec, Evaluator evaluator) {
		OptimizerBackend backend = registry.create(name).orElseThrow(() -> new OptimizerNotFoundException(name));
		List<Diagnostic> diagnostics = lintEngine.run(lowering.lower(spec));
		logger.debug("Optimizing '{}' with '{}' ({} diagnostics)", spec.name(), name, diagnostics.size());

		PromptSpec optimized = backend.optimize(new OptimizationRequest(spec, diagnostics, evaluator));
		if (optimized == null) {
			throw new IllegalStateException("Optimizer '" + name + "' returned no spec for '" + spec.name() + "'");
		}
		guard.check(spec, optimized);
		// the result must still lower
		lowering.lower(optimized);
		logger.debug("Optimizer '{}' finished '{}'", name, spec.name());
		return optimized;
	}
}
