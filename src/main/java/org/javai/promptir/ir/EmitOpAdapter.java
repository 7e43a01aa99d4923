package org.javai.promptir.ir;

/**
 * Visitor with no-op defaults, for callers interested in a few operation kinds only.
 */
public abstract class EmitOpAdapter implements EmitOpVisitor<Void> {

	@Override
	public Void visitLiteral(String text) {
		return null;
	}

	@Override
	public Void visitSection(String name) {
		return null;
	}

	@Override
	public Void visitInput(String name) {
		return null;
	}

	@Override
	public Void visitSlot(String name) {
		return null;
	}

	@Override
	public Void visitSwitch(EmitOp.Switch switchOp) {
		return null;
	}
}
