package org.javai.promptir.ir;

import java.util.List;

/**
 * Walks emit operations, including the operations nested in switch branches.
 */
public final class EmitOpWalker {

	private EmitOpWalker() {
		// Utility class - no instantiation
	}

	/**
	 * Visits every operation in pre-order: a switch is visited before its cases, cases in
	 * declaration order, then the default branch.
	 */
	public static <R> void walkPreOrder(List<EmitOp> ops, EmitOpVisitor<R> visitor) {
		if (ops == null) {
			return;
		}
		for (EmitOp op : ops) {
			op.accept(visitor);
			if (op instanceof EmitOp.Switch switchOp) {
				for (SwitchCase switchCase : switchOp.cases()) {
					walkPreOrder(switchCase.ops(), visitor);
				}
				walkPreOrder(switchOp.defaultOps(), visitor);
			}
		}
	}

	/**
	 * Visits every operation of every message, messages in module order.
	 */
	public static <R> void walkModule(PirModule module, EmitOpVisitor<R> visitor) {
		for (Message message : module.messages()) {
			walkPreOrder(message.ops(), visitor);
		}
	}
}
