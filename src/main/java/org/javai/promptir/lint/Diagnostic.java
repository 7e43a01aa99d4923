package org.javai.promptir.lint;

import java.util.Objects;

/**
 * A single lint finding.
 */
public record Diagnostic(DiagnosticCode code, String message, Location location) {

	public Diagnostic {
		Objects.requireNonNull(code, "code must not be null");
		Objects.requireNonNull(message, "message must not be null");
		Objects.requireNonNull(location, "location must not be null");
	}

	public Severity severity() {
		return code.severity();
	}

	public String symbol() {
		return location.symbol();
	}
}
