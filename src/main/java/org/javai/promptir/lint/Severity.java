package org.javai.promptir.lint;

/**
 * How seriously a tool should treat a diagnostic.
 */
public enum Severity {
	WARNING,
	ERROR
}
