package org.javai.promptir.pirtxt;

import org.javai.promptir.ir.SourceSpan;

/**
 * A token of PIR-TXT.
 *
 * @param type the token type
 * @param value the token value; unescaped content for strings
 * @param span where the token appears in the input
 */
public record PirToken(TokenType type, String value, SourceSpan span) {

	public enum TokenType {
		IDENTIFIER,    // keywords, names, version tags
		STRING,        // "double quoted"
		NUMBER,        // integers and decimals
		LBRACE,        // {
		RBRACE,        // }
		LBRACKET,      // [
		RBRACKET,      // ]
		COLON,         // :
		EQUALS,        // =
		COMMA,         // ,
		AT,            // @
		EOF            // end of input
	}

	@Override
	public String toString() {
		return switch (type) {
			case STRING -> "STRING(\"" + value + "\")";
			case NUMBER, IDENTIFIER -> type + "(" + value + ")";
			case EOF -> "end of input";
			default -> "'" + value + "'";
		};
	}

	public boolean isType(TokenType expectedType) {
		return this.type == expectedType;
	}

	public boolean isIdentifier(String expected) {
		return type == TokenType.IDENTIFIER && value.equals(expected);
	}
}
