package org.javai.promptir.lint;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.javai.promptir.ir.InputDecl;
import org.javai.promptir.ir.SymbolKind;

/**
 * Flags inputs that are neither emitted nor switched on.
 */
public class UnusedInputLint implements Lint {

	@Override
	public List<Diagnostic> check(LintContext context) {
		Set<String> referenced = ModuleReferences.collect(context.module()).stream()
				.filter(reference -> reference.kind() == SymbolKind.INPUT)
				.map(ModuleReferences.Reference::name)
				.collect(Collectors.toSet());
		List<Diagnostic> diagnostics = new ArrayList<>();
		for (InputDecl input : context.module().inputs()) {
			if (!referenced.contains(input.name())) {
				diagnostics.add(new Diagnostic(DiagnosticCode.UNUSED_INPUT,
						"Input '" + input.name() + "' is declared but never emitted or switched on",
						context.declarationLocation(SymbolKind.INPUT, input.name())));
			}
		}
		return diagnostics;
	}
}
