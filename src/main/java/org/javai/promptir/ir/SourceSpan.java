package org.javai.promptir.ir;

/**
 * Location of a construct in PIR-TXT source.
 *
 * @param offset zero-based character offset of the first character
 * @param line one-based line number
 * @param column one-based column number
 * @param length number of characters covered
 */
public record SourceSpan(int offset, int line, int column, int length) {

	public SourceSpan {
		if (offset < 0 || line < 1 || column < 1 || length < 0) {
			throw new IllegalArgumentException("Invalid span: offset=" + offset + ", line=" + line
					+ ", column=" + column + ", length=" + length);
		}
	}

	@Override
	public String toString() {
		return line + ":" + column;
	}
}
