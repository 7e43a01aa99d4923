package org.javai.promptir.ir;

import java.util.List;
import java.util.Objects;

/**
 * One branch of a {@link EmitOp.Switch}, taken when the switched input equals {@code value}.
 */
public record SwitchCase(String value, List<EmitOp> ops) {

	public SwitchCase {
		Objects.requireNonNull(value, "value must not be null");
		ops = ops == null ? List.of() : List.copyOf(ops);
	}
}
