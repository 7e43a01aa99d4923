package org.javai.promptir.pirtxt;

import java.util.ArrayList;
import java.util.List;
import org.javai.promptir.ir.SourceSpan;

/**
 * Converts PIR-TXT into a stream of tokens.
 * <p>
 * Whitespace, newlines and {@code //} line comments separate tokens and are dropped.
 */
public class PirTokenizer {

	private final String input;
	private int pos = 0;
	private int line = 1;
	private int column = 1;

	public PirTokenizer(String input) {
		this.input = input != null ? input : "";
	}

	/**
	 * Tokenizes the entire input string.
	 *
	 * @return list of tokens (includes EOF token at end)
	 * @throws PirSyntaxException if invalid syntax is encountered
	 */
	public List<PirToken> tokenize() {
		List<PirToken> tokens = new ArrayList<>();

		while (!isAtEnd()) {
			skipWhitespaceAndComments();
			if (isAtEnd()) break;

			tokens.add(nextToken());
		}

		tokens.add(new PirToken(PirToken.TokenType.EOF, "", new SourceSpan(pos, line, column, 0)));
		return tokens;
	}

	private PirToken nextToken() {
		int start = pos;
		int startLine = line;
		int startColumn = column;
		char c = peek();

		PirToken.TokenType punctuation = switch (c) {
			case '{' -> PirToken.TokenType.LBRACE;
			case '}' -> PirToken.TokenType.RBRACE;
			case '[' -> PirToken.TokenType.LBRACKET;
			case ']' -> PirToken.TokenType.RBRACKET;
			case ':' -> PirToken.TokenType.COLON;
			case '=' -> PirToken.TokenType.EQUALS;
			case ',' -> PirToken.TokenType.COMMA;
			case '@' -> PirToken.TokenType.AT;
			default -> null;
		};
		if (punctuation != null) {
			advance();
			return new PirToken(punctuation, String.valueOf(c), new SourceSpan(start, startLine, startColumn, 1));
		}
		if (c == '"') {
			return scanString(start, startLine, startColumn);
		}
		if (isDigit(c) || (c == '-' && pos + 1 < input.length() && isDigit(input.charAt(pos + 1)))) {
			return scanNumber(start, startLine, startColumn);
		}
		if (isIdentifierStart(c)) {
			return scanIdentifier(start, startLine, startColumn);
		}
		throw new PirSyntaxException("Unexpected character '" + c + "'",
				new SourceSpan(start, startLine, startColumn, 1), "a token", "'" + c + "'");
	}

	private PirToken scanString(int start, int startLine, int startColumn) {
		advance(); // consume opening "

		StringBuilder sb = new StringBuilder();
		while (!isAtEnd() && peek() != '"') {
			char c = advance();
			if (c == '\\') {
				if (isAtEnd()) {
					break;
				}
				char next = advance();
				sb.append(switch (next) {
					case 'n' -> '\n';
					case 't' -> '\t';
					case 'r' -> '\r';
					case '"' -> '"';
					case '\\' -> '\\';
					default -> throw new PirSyntaxException("Unsupported escape sequence '\\" + next + "'",
							new SourceSpan(pos - 2, line, Math.max(1, column - 2), 2),
							"one of \\\" \\\\ \\n \\t \\r", "'\\" + next + "'");
				});
			} else {
				sb.append(c);
			}
		}

		if (isAtEnd()) {
			throw new PirSyntaxException("Unterminated string",
					new SourceSpan(start, startLine, startColumn, pos - start), "closing '\"'", "end of input");
		}

		advance(); // consume closing "
		return new PirToken(PirToken.TokenType.STRING, sb.toString(),
				new SourceSpan(start, startLine, startColumn, pos - start));
	}

	private PirToken scanNumber(int start, int startLine, int startColumn) {
		if (peek() == '-') {
			advance();
		}

		while (!isAtEnd() && isDigit(peek())) {
			advance();
		}

		if (!isAtEnd() && peek() == '.' && pos + 1 < input.length() && isDigit(input.charAt(pos + 1))) {
			advance(); // consume '.'
			while (!isAtEnd() && isDigit(peek())) {
				advance();
			}
		}

		String value = input.substring(start, pos);
		return new PirToken(PirToken.TokenType.NUMBER, value, new SourceSpan(start, startLine, startColumn, pos - start));
	}

	private PirToken scanIdentifier(int start, int startLine, int startColumn) {
		while (!isAtEnd() && isIdentifierChar(peek())) {
			advance();
		}

		String value = input.substring(start, pos);
		return new PirToken(PirToken.TokenType.IDENTIFIER, value, new SourceSpan(start, startLine, startColumn, pos - start));
	}

	private void skipWhitespaceAndComments() {
		while (!isAtEnd()) {
			char c = peek();
			if (isWhitespace(c)) {
				advance();
			} else if (c == '/' && pos + 1 < input.length() && input.charAt(pos + 1) == '/') {
				while (!isAtEnd() && peek() != '\n') {
					advance();
				}
			} else {
				return;
			}
		}
	}

	private char peek() {
		return isAtEnd() ? '\0' : input.charAt(pos);
	}

	private char advance() {
		char c = input.charAt(pos++);
		if (c == '\n') {
			line++;
			column = 1;
		} else {
			column++;
		}
		return c;
	}

	private boolean isAtEnd() {
		return pos >= input.length();
	}

	private boolean isWhitespace(char c) {
		return c == ' ' || c == '\t' || c == '\n' || c == '\r';
	}

	private boolean isDigit(char c) {
		return c >= '0' && c <= '9';
	}

	private boolean isIdentifierStart(char c) {
		return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
	}

	private boolean isIdentifierChar(char c) {
		return isIdentifierStart(c) || isDigit(c) || c == '.' || c == '-';
	}
}
