package org.javai.promptir.ir;

/**
 * Namespaces of a module's symbol table. Names are unique per kind, not across kinds.
 */
public enum SymbolKind {
	INPUT,
	SECTION,
	SLOT;

	public String label() {
		return name().toLowerCase();
	}
}
