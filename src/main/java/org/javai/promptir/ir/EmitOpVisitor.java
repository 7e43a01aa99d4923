package org.javai.promptir.ir;

/**
 * Visitor over emit operations.
 *
 * @param <R> the return type of the visitor operations
 */
public interface EmitOpVisitor<R> {

	R visitLiteral(String text);

	R visitSection(String name);

	R visitInput(String name);

	R visitSlot(String name);

	/**
	 * Visits a switch. Walkers descend into the branches after this call.
	 */
	R visitSwitch(EmitOp.Switch switchOp);
}
