package org.javai.promptir.render;

import java.util.Optional;
import org.javai.promptir.PirException;
import org.javai.promptir.ir.SourceSpan;

/**
 * Raised when a template cannot be rendered. Carries the symbol the failure originates from.
 */
public class TemplateException extends PirException {

	public enum Kind {
		/** A referenced input has no binding while rendering strictly. */
		MISSING_VARIABLE,
		/** A binding or reference names an input the module does not declare. */
		UNKNOWN_VARIABLE,
		/** Sections embed each other in a cycle. */
		SECTION_CYCLE,
		/** The template engine rejected the template. */
		ENGINE_FAILURE
	}

	private final Kind kind;
	private final String symbol;
	private final SourceSpan span;

	public TemplateException(Kind kind, String symbol, String message) {
		this(kind, symbol, null, message, null);
	}

	public TemplateException(Kind kind, String symbol, SourceSpan span, String message, Throwable cause) {
		super(message, cause);
		this.kind = kind;
		this.symbol = symbol;
		this.span = span;
	}

	public Kind kind() {
		return kind;
	}

	public String symbol() {
		return symbol;
	}

	public Optional<SourceSpan> span() {
		return Optional.ofNullable(span);
	}
}
