package org.javai.promptir.lint;

/**
 * Lint diagnostic codes. The string ids are stable and safe to match on in tools.
 */
public enum DiagnosticCode {
	UNUSED_SECTION("PIR-L001", Severity.WARNING),
	UNUSED_INPUT("PIR-L002", Severity.WARNING),
	CHANNEL_VIOLATION("PIR-L003", Severity.ERROR),
	INCOMPLETE_SWITCH("PIR-L004", Severity.WARNING),
	SCHEMA_COLLISION("PIR-L005", Severity.ERROR),
	UNKNOWN_SYMBOL_REFERENCE("PIR-L006", Severity.ERROR);

	private final String id;
	private final Severity severity;

	DiagnosticCode(String id, Severity severity) {
		this.id = id;
		this.severity = severity;
	}

	public String id() {
		return id;
	}

	public Severity severity() {
		return severity;
	}
}
