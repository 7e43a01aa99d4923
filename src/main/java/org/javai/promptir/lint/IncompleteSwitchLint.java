package org.javai.promptir.lint;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.javai.promptir.ir.InputDecl;
import org.javai.promptir.ir.ScalarKind;
import org.javai.promptir.ir.SwitchCase;
import org.javai.promptir.ir.SymbolKind;

/**
 * Flags switches over an enum input that miss a value and have no default branch.
 */
public class IncompleteSwitchLint implements Lint {

	@Override
	public List<Diagnostic> check(LintContext context) {
		List<Diagnostic> diagnostics = new ArrayList<>();
		for (ModuleReferences.Reference reference : ModuleReferences.collect(context.module())) {
			if (!reference.isSwitchSubject() || reference.switchOp().hasDefault()) {
				continue;
			}
			InputDecl input = context.symbols().find(SymbolKind.INPUT, reference.name())
					.map(InputDecl.class::cast)
					.orElse(null);
			if (input == null || input.kind() != ScalarKind.ENUM) {
				continue;
			}
			Set<String> covered = reference.switchOp().cases().stream()
					.map(SwitchCase::value)
					.collect(Collectors.toSet());
			List<String> missing = input.values().stream()
					.filter(value -> !covered.contains(value))
					.toList();
			if (!missing.isEmpty()) {
				diagnostics.add(new Diagnostic(DiagnosticCode.INCOMPLETE_SWITCH,
						"Switch on '" + input.name() + "' has no default and misses " + missing,
						context.referenceLocation(reference)));
			}
		}
		return diagnostics;
	}
}
