package org.javai.promptir.pirtxt;

import org.javai.promptir.PirException;
import org.javai.promptir.ir.SourceSpan;

/**
 * Raised when a PIR-TXT document declares a major format version the parser does not support.
 */
public class UnsupportedVersionException extends PirException {

	private final String version;
	private final SourceSpan span;

	public UnsupportedVersionException(String version, SourceSpan span) {
		super("Unsupported PIR-TXT version '" + version + "' at line " + span.line() + ", column " + span.column());
		this.version = version;
		this.span = span;
	}

	public String version() {
		return version;
	}

	public SourceSpan span() {
		return span;
	}
}
