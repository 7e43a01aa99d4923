package org.javai.promptir.symbol;

import org.javai.promptir.PirException;
import org.javai.promptir.ir.SymbolKind;

/**
 * Raised when a name is declared twice in the same namespace of a scope.
 */
public class DuplicateSymbolException extends PirException {

	private final SymbolKind kind;
	private final String symbol;

	public DuplicateSymbolException(SymbolKind kind, String symbol, String scope) {
		super("Duplicate " + kind.label() + " '" + symbol + "' in " + scope);
		this.kind = kind;
		this.symbol = symbol;
	}

	/**
	 * For names outside the module namespaces, such as graph node ids.
	 */
	public DuplicateSymbolException(String symbol, String message) {
		super(message);
		this.kind = null;
		this.symbol = symbol;
	}

	/**
	 * The namespace of the duplicate, or null for non-module names.
	 */
	public SymbolKind kind() {
		return kind;
	}

	public String symbol() {
		return symbol;
	}
}
