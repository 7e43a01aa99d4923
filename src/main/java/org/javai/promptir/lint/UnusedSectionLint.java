package org.javai.promptir.lint;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.javai.promptir.ir.SectionDecl;
import org.javai.promptir.ir.SymbolKind;

/**
 * Flags sections that no message emits, switch branches included.
 * <p>
 * A section emitted on the wrong channel still counts as used; {@link ChannelViolationLint}
 * reports that case.
 */
public class UnusedSectionLint implements Lint {

	@Override
	public List<Diagnostic> check(LintContext context) {
		Set<String> emitted = ModuleReferences.collect(context.module()).stream()
				.filter(reference -> reference.kind() == SymbolKind.SECTION)
				.map(ModuleReferences.Reference::name)
				.collect(Collectors.toSet());
		List<Diagnostic> diagnostics = new ArrayList<>();
		for (SectionDecl section : context.module().sections()) {
			if (!emitted.contains(section.name())) {
				diagnostics.add(new Diagnostic(DiagnosticCode.UNUSED_SECTION,
						"Section '" + section.name() + "' is declared but never emitted",
						context.declarationLocation(SymbolKind.SECTION, section.name())));
			}
		}
		return diagnostics;
	}
}
