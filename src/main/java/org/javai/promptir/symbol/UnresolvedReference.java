package org.javai.promptir.symbol;

import org.javai.promptir.ir.SymbolKind;

/**
 * A reference from a message to a name missing from the module's symbol table.
 *
 * @param kind namespace the reference targets
 * @param symbol referenced name
 * @param channel channel of the message holding the reference
 * @param occurrence zero-based index of this reference among the references to the same name
 */
public record UnresolvedReference(SymbolKind kind, String symbol, String channel, int occurrence) {
}
