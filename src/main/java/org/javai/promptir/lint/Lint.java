package org.javai.promptir.lint;

import java.util.List;

/**
 * A static check over a validated module.
 * <p>
 * Implementations return diagnostics in module declaration order, or message order for
 * checks driven by emit operations, so that the engine's output is deterministic.
 */
@FunctionalInterface
public interface Lint {

	List<Diagnostic> check(LintContext context);
}
