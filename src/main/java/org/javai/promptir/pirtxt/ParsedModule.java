package org.javai.promptir.pirtxt;

import java.util.Objects;
import org.javai.promptir.ir.PirModule;

/**
 * Result of parsing PIR-TXT: the module and the spans it was parsed from.
 * <p>
 * Spans are kept apart from the module so that module equality is independent of layout.
 */
public record ParsedModule(PirModule module, SourceMap sourceMap) {

	public ParsedModule {
		Objects.requireNonNull(module, "module must not be null");
		sourceMap = sourceMap == null ? SourceMap.empty() : sourceMap;
	}
}
