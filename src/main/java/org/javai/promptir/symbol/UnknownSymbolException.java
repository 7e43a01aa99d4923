package org.javai.promptir.symbol;

import org.javai.promptir.PirException;
import org.javai.promptir.ir.SymbolKind;

/**
 * Raised when a reference does not resolve in its scope.
 */
public class UnknownSymbolException extends PirException {

	private final SymbolKind kind;
	private final String symbol;

	public UnknownSymbolException(SymbolKind kind, String symbol, String scope) {
		super("Unknown " + kind.label() + " '" + symbol + "' in " + scope);
		this.kind = kind;
		this.symbol = symbol;
	}

	/**
	 * For references outside the module namespaces, such as graph node ids or loop state keys.
	 */
	public UnknownSymbolException(String symbol, String message) {
		super(message);
		this.kind = null;
		this.symbol = symbol;
	}

	/**
	 * The namespace the reference was resolved against, or null for non-module references.
	 */
	public SymbolKind kind() {
		return kind;
	}

	public String symbol() {
		return symbol;
	}
}
