package org.javai.promptir.lint;

import java.util.ArrayList;
import java.util.List;

/**
 * Flags emit and switch references to names absent from the symbol table.
 */
public class UnknownSymbolReferenceLint implements Lint {

	@Override
	public List<Diagnostic> check(LintContext context) {
		List<Diagnostic> diagnostics = new ArrayList<>();
		for (ModuleReferences.Reference reference : ModuleReferences.collect(context.module())) {
			if (!context.symbols().contains(reference.kind(), reference.name())) {
				diagnostics.add(new Diagnostic(DiagnosticCode.UNKNOWN_SYMBOL_REFERENCE,
						"Unknown " + reference.kind().label() + " '" + reference.name() + "' referenced in a '"
								+ reference.channel() + "' message",
						context.referenceLocation(reference)));
			}
		}
		return diagnostics;
	}
}
