package org.javai.promptir.lint;

import java.util.Objects;
import java.util.Optional;
import org.javai.promptir.ir.PirModule;
import org.javai.promptir.ir.SourceSpan;
import org.javai.promptir.ir.SymbolKind;
import org.javai.promptir.pirtxt.ParsedModule;
import org.javai.promptir.pirtxt.SourceMap;
import org.javai.promptir.symbol.SymbolTable;

/**
 * Everything a lint may read: the module, its symbol table and the spans recorded by the parser.
 */
public record LintContext(PirModule module, SymbolTable symbols, SourceMap sourceMap) {

	public LintContext {
		Objects.requireNonNull(module, "module must not be null");
		Objects.requireNonNull(symbols, "symbols must not be null");
		sourceMap = sourceMap == null ? SourceMap.empty() : sourceMap;
	}

	/**
	 * @throws org.javai.promptir.symbol.DuplicateSymbolException if the module declares a name twice
	 */
	public static LintContext of(PirModule module) {
		return new LintContext(module, SymbolTable.of(module), SourceMap.empty());
	}

	public static LintContext of(ParsedModule parsed) {
		return new LintContext(parsed.module(), SymbolTable.of(parsed.module()), parsed.sourceMap());
	}

	Location declarationLocation(SymbolKind kind, String name) {
		return Location.of(name, sourceMap.declaration(kind, name));
	}

	Location referenceLocation(ModuleReferences.Reference reference) {
		Optional<SourceSpan> span = sourceMap.reference(reference.kind(), reference.name(), reference.occurrence());
		return Location.of(reference.name(), span);
	}
}
