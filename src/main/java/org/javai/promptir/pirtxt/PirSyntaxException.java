package org.javai.promptir.pirtxt;

import org.javai.promptir.PirException;
import org.javai.promptir.ir.SourceSpan;

/**
 * Raised when PIR-TXT is malformed. Parsing aborts; no partial module is returned.
 */
public class PirSyntaxException extends PirException {

	private final SourceSpan span;
	private final String expected;
	private final String found;

	public PirSyntaxException(String message, SourceSpan span, String expected, String found) {
		super("line " + span.line() + ", column " + span.column() + ": " + message);
		this.span = span;
		this.expected = expected;
		this.found = found;
	}

	public SourceSpan span() {
		return span;
	}

	/**
	 * Description of what the parser expected at {@link #span()}.
	 */
	public String expected() {
		return expected;
	}

	public String found() {
		return found;
	}
}
