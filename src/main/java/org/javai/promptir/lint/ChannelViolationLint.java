package org.javai.promptir.lint;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.javai.promptir.ir.Declaration;
import org.javai.promptir.ir.InputDecl;
import org.javai.promptir.ir.SectionDecl;
import org.javai.promptir.ir.SymbolKind;

/**
 * Flags sections and inputs emitted into a message whose channel differs from the one they
 * declare. Declarations without a channel may go anywhere.
 */
public class ChannelViolationLint implements Lint {

	@Override
	public List<Diagnostic> check(LintContext context) {
		List<Diagnostic> diagnostics = new ArrayList<>();
		for (ModuleReferences.Reference reference : ModuleReferences.collect(context.module())) {
			if (reference.isSwitchSubject() || reference.kind() == SymbolKind.SLOT) {
				continue;
			}
			Optional<Declaration> declaration = context.symbols().find(reference.kind(), reference.name());
			if (declaration.isEmpty()) {
				continue;
			}
			String declared = declaredChannel(declaration.get());
			if (declared != null && !declared.equals(reference.channel())) {
				diagnostics.add(new Diagnostic(DiagnosticCode.CHANNEL_VIOLATION,
						capitalize(reference.kind().label()) + " '" + reference.name() + "' belongs to channel '"
								+ declared + "' but is emitted in a '" + reference.channel() + "' message",
						context.referenceLocation(reference)));
			}
		}
		return diagnostics;
	}

	private static String declaredChannel(Declaration declaration) {
		if (declaration instanceof SectionDecl section) {
			return section.channel();
		}
		return ((InputDecl) declaration).channel();
	}

	private static String capitalize(String label) {
		return Character.toUpperCase(label.charAt(0)) + label.substring(1);
	}
}
