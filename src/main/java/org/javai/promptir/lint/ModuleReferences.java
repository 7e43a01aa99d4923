package org.javai.promptir.lint;

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

/**
 * Collects the name references of a module in the order the parser records their spans.
 */
final class ModuleReferences {

	/**
	 * @param switchOp the switch, when this reference is a switch subject
	 * @param occurrence zero-based index among references to the same kind and name
	 */
	record Reference(SymbolKind kind, String name, String channel, int occurrence, EmitOp.Switch switchOp) {

		boolean isSwitchSubject() {
			return switchOp != null;
		}
	}

	private ModuleReferences() {
	}

	static List<Reference> collect(PirModule module) {
		List<Reference> references = new ArrayList<>();
		Map<String, Integer> occurrences = new HashMap<>();
		for (Message message : module.messages()) {
			EmitOpWalker.walkPreOrder(message.ops(), new EmitOpAdapter() {
				@Override
				public Void visitSection(String name) {
					add(SymbolKind.SECTION, name, null);
					return null;
				}

				@Override
				public Void visitInput(String name) {
					add(SymbolKind.INPUT, name, null);
					return null;
				}

				@Override
				public Void visitSlot(String name) {
					add(SymbolKind.SLOT, name, null);
					return null;
				}

				@Override
				public Void visitSwitch(EmitOp.Switch switchOp) {
					add(SymbolKind.INPUT, switchOp.input(), switchOp);
					return null;
				}

				private void add(SymbolKind kind, String name, EmitOp.Switch switchOp) {
					int occurrence = occurrences.merge(kind + ":" + name, 1, Integer::sum) - 1;
					references.add(new Reference(kind, name, message.channel(), occurrence, switchOp));
				}
			});
		}
		return references;
	}
}
