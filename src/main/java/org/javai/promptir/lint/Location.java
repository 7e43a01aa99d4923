package org.javai.promptir.lint;

import java.util.Objects;
import java.util.Optional;
import org.javai.promptir.ir.SourceSpan;

/**
 * Where a diagnostic points: the symbol involved and, for parsed modules, its span.
 *
 * @param symbol name of the declaration or referenced symbol
 * @param span source position; null when the module was built in code
 */
public record Location(String symbol, SourceSpan span) {

	public Location {
		Objects.requireNonNull(symbol, "symbol must not be null");
	}

	public static Location of(String symbol, Optional<SourceSpan> span) {
		return new Location(symbol, span.orElse(null));
	}

	public Optional<SourceSpan> sourceSpan() {
		return Optional.ofNullable(span);
	}

	@Override
	public String toString() {
		return span == null ? symbol : symbol + "@" + span;
	}
}
