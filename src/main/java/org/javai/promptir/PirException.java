package org.javai.promptir;

/**
 * Base type of every error raised by the PromptIR core.
 * <p>
 * All core errors are unchecked and are surfaced to the immediate caller; the core never
 * retries and never swallows them. Lint diagnostics are not errors and never use this type.
 */
public class PirException extends RuntimeException {

	public PirException(String message) {
		super(message);
	}

	public PirException(String message, Throwable cause) {
		super(message, cause);
	}
}
