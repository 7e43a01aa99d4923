package org.javai.promptir.ir;

import java.util.Objects;

/**
 * Render configuration of a module.
 *
 * @param engine opaque renderer identifier
 * @param strict when set, referencing an undefined template variable is an error rather than empty output
 */
public record RenderConfig(String engine, boolean strict) {

	public RenderConfig {
		Objects.requireNonNull(engine, "engine must not be null");
	}
}
