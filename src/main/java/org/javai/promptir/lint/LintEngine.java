package org.javai.promptir.lint;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.javai.promptir.ir.PirModule;
import org.javai.promptir.pirtxt.ParsedModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a fixed, ordered list of lints over a module.
 * <p>
 * Every lint runs regardless of what earlier lints report; the combined diagnostics are
 * ordered by lint, then by the order each lint reports them. The same module always yields
 * the same list.
 */
public final class LintEngine {

	private static final Logger logger = LoggerFactory.getLogger(LintEngine.class);

	private final List<Lint> lints;

	public LintEngine(List<Lint> lints) {
		Objects.requireNonNull(lints, "lints must not be null");
		this.lints = List.copyOf(lints);
	}

	/**
	 * Engine with all built-in lints.
	 */
	public static LintEngine standard() {
		return new LintEngine(List.of(
				new UnknownSymbolReferenceLint(),
				new UnusedSectionLint(),
				new UnusedInputLint(),
				new ChannelViolationLint(),
				new IncompleteSwitchLint(),
				new SchemaCollisionLint()));
	}

	/**
	 * @throws org.javai.promptir.symbol.DuplicateSymbolException if the module declares a name twice
	 */
	public List<Diagnostic> run(PirModule module) {
		return run(LintContext.of(module));
	}

	public List<Diagnostic> run(ParsedModule parsed) {
		return run(LintContext.of(parsed));
	}

	public List<Diagnostic> run(LintContext context) {
		List<Diagnostic> diagnostics = new ArrayList<>();
		for (Lint lint : lints) {
			diagnostics.addAll(lint.check(context));
		}
		if (logger.isDebugEnabled()) {
			logger.debug("Linted module '{}' with {} lints: {} diagnostics",
					context.module().name(), lints.size(), diagnostics.size());
		}
		return List.copyOf(diagnostics);
	}

	public List<Lint> lints() {
		return lints;
	}
}
