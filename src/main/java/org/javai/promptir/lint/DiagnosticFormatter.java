package org.javai.promptir.lint;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Formats diagnostics one per line as {@code PIR-L001 warning persona@3:2: message}.
 */
public final class DiagnosticFormatter {

	private DiagnosticFormatter() {
	}

	public static String format(Diagnostic diagnostic) {
		return diagnostic.code().id() + " " + diagnostic.severity().name().toLowerCase() + " "
				+ diagnostic.location() + ": " + diagnostic.message();
	}

	public static String format(List<Diagnostic> diagnostics) {
		return diagnostics.stream()
				.map(DiagnosticFormatter::format)
				.collect(Collectors.joining("\n"));
	}
}
