package org.javai.promptir.symbol;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.javai.promptir.ir.EmitOp;
import org.javai.promptir.ir.EmitOpAdapter;
import org.javai.promptir.ir.EmitOpWalker;
import org.javai.promptir.ir.Message;
import org.javai.promptir.ir.PirModule;
import org.javai.promptir.ir.SymbolKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves the name references of a module against its symbol table.
 * <p>
 * Validation is a separate pass from parsing: the parser accepts references to undeclared
 * names and this class reports them.
 */
public final class ModuleValidator {

	private static final Logger logger = LoggerFactory.getLogger(ModuleValidator.class);

	private ModuleValidator() {
	}

	/**
	 * Builds the symbol table and resolves every reference.
	 *
	 * @return the module's symbol table
	 * @throws DuplicateSymbolException if a name is declared twice in a namespace
	 * @throws UnknownSymbolException for the first unresolved reference, in message order
	 */
	public static SymbolTable validate(PirModule module) {
		SymbolTable table = SymbolTable.of(module);
		List<UnresolvedReference> unresolved = unresolvedReferences(module, table);
		if (!unresolved.isEmpty()) {
			UnresolvedReference first = unresolved.get(0);
			throw new UnknownSymbolException(first.kind(), first.symbol(), module.name());
		}
		logger.debug("Module '{}' validated: {} declarations, {} messages",
				module.name(), module.declarations().size(), module.messages().size());
		return table;
	}

	/**
	 * Lists every unresolved reference without failing.
	 *
	 * @throws DuplicateSymbolException if a name is declared twice in a namespace
	 */
	public static List<UnresolvedReference> unresolvedReferences(PirModule module) {
		return unresolvedReferences(module, SymbolTable.of(module));
	}

	public static List<UnresolvedReference> unresolvedReferences(PirModule module, SymbolTable table) {
		List<UnresolvedReference> unresolved = new ArrayList<>();
		Map<String, Integer> occurrences = new HashMap<>();
		for (Message message : module.messages()) {
			EmitOpWalker.walkPreOrder(message.ops(), new EmitOpAdapter() {
				@Override
				public Void visitSection(String name) {
					check(SymbolKind.SECTION, name);
					return null;
				}

				@Override
				public Void visitInput(String name) {
					check(SymbolKind.INPUT, name);
					return null;
				}

				@Override
				public Void visitSlot(String name) {
					check(SymbolKind.SLOT, name);
					return null;
				}

				@Override
				public Void visitSwitch(EmitOp.Switch switchOp) {
					check(SymbolKind.INPUT, switchOp.input());
					return null;
				}

				private void check(SymbolKind kind, String name) {
					String key = kind + ":" + name;
					int occurrence = occurrences.merge(key, 1, Integer::sum) - 1;
					if (!table.contains(kind, name)) {
						unresolved.add(new UnresolvedReference(kind, name, message.channel(), occurrence));
					}
				}
			});
		}
		return unresolved;
	}
}
