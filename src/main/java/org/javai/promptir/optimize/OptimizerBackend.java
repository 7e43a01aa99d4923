package org.javai.promptir.optimize;

import org.javai.promptir.spec.PromptSpec;

/**
 * A prompt optimizer. Implementations may only change entities marked optimizable;
 * {@link Optimizer} rejects anything else.
 */
@FunctionalInterface
public interface OptimizerBackend {

	PromptSpec optimize(OptimizationRequest request);
}
