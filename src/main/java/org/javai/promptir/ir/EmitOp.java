package org.javai.promptir.ir;

import java.util.List;
import java.util.Objects;

/**
 * A single step of a message: emit literal text, a section, an input, a slot choice, or
 * branch on the value of an input.
 */
public sealed interface EmitOp {

	/**
	 * Accepts a visitor and dispatches to the method matching this operation.
	 *
	 * @param <R> the return type of the visitor
	 * @param visitor the visitor to accept
	 * @return the result of the visitor operation
	 */
	<R> R accept(EmitOpVisitor<R> visitor);

	record Literal(String text) implements EmitOp {
		public Literal {
			Objects.requireNonNull(text, "text must not be null");
		}

		@Override
		public <R> R accept(EmitOpVisitor<R> visitor) {
			return visitor.visitLiteral(text);
		}
	}

	record Section(String name) implements EmitOp {
		public Section {
			Identifiers.require(name, "section name");
		}

		@Override
		public <R> R accept(EmitOpVisitor<R> visitor) {
			return visitor.visitSection(name);
		}
	}

	record Input(String name) implements EmitOp {
		public Input {
			Identifiers.require(name, "input name");
		}

		@Override
		public <R> R accept(EmitOpVisitor<R> visitor) {
			return visitor.visitInput(name);
		}
	}

	record Slot(String name) implements EmitOp {
		public Slot {
			Identifiers.require(name, "slot name");
		}

		@Override
		public <R> R accept(EmitOpVisitor<R> visitor) {
			return visitor.visitSlot(name);
		}
	}

	/**
	 * Route on the value of an input.
	 *
	 * @param input name of the input whose value selects the branch
	 * @param cases branches in declaration order
	 * @param defaultOps operations used when no case matches; null when there is no default branch
	 */
	record Switch(String input, List<SwitchCase> cases, List<EmitOp> defaultOps) implements EmitOp {
		public Switch {
			Identifiers.require(input, "switched input name");
			cases = cases == null ? List.of() : List.copyOf(cases);
			defaultOps = defaultOps == null ? null : List.copyOf(defaultOps);
		}

		public boolean hasDefault() {
			return defaultOps != null;
		}

		@Override
		public <R> R accept(EmitOpVisitor<R> visitor) {
			return visitor.visitSwitch(this);
		}
	}

	static EmitOp literal(String text) {
		return new Literal(text);
	}

	static EmitOp section(String name) {
		return new Section(name);
	}

	static EmitOp input(String name) {
		return new Input(name);
	}

	static EmitOp slot(String name) {
		return new Slot(name);
	}
}
