package org.javai.promptir.ir;

import java.util.Objects;

/**
 * Describes the response field a section contributes to the module's output contract.
 */
public record OutputField(String key, ScalarKind kind, boolean required, String description) {

	public OutputField {
		Objects.requireNonNull(key, "key must not be null");
		Objects.requireNonNull(kind, "kind must not be null");
	}

	public static OutputField of(String key, ScalarKind kind) {
		return new OutputField(key, kind, false, null);
	}
}
