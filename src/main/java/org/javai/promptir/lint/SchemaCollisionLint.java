package org.javai.promptir.lint;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.javai.promptir.ir.OutputField;
import org.javai.promptir.ir.SectionDecl;
import org.javai.promptir.ir.SymbolKind;

/**
 * Flags sections whose output key was already claimed by an earlier section.
 */
public class SchemaCollisionLint implements Lint {

	@Override
	public List<Diagnostic> check(LintContext context) {
		Map<String, SectionDecl> claims = new LinkedHashMap<>();
		List<Diagnostic> diagnostics = new ArrayList<>();
		for (SectionDecl section : context.module().sections()) {
			OutputField output = section.output();
			if (output == null) {
				continue;
			}
			SectionDecl owner = claims.putIfAbsent(output.key(), section);
			if (owner == null) {
				continue;
			}
			String message = "Section '" + section.name() + "' declares output key '" + output.key()
					+ "' already claimed by section '" + owner.name() + "'";
			if (owner.output().kind() != output.kind()) {
				message += " with conflicting kinds " + owner.output().kind().keyword()
						+ " and " + output.kind().keyword();
			}
			diagnostics.add(new Diagnostic(DiagnosticCode.SCHEMA_COLLISION, message,
					context.declarationLocation(SymbolKind.SECTION, section.name())));
		}
		return diagnostics;
	}
}
