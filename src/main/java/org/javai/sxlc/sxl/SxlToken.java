package org.javai.sxlc.sxl;

/**
 * Represents a token of the s-expression call language.
 *
 * @param type the token type
 * @param value the token value (text content; digits for numbers, unquoted content for strings)
 * @param position the character position in the input string
 */
public record SxlToken(TokenType type, String value, int position) {

	public enum TokenType {
		LPAREN,        // (
		RPAREN,        // )
		NUMBER,        // [0-9]+
		STRING,        // "double quoted", no escapes
		NAME           // [a-zA-Z]+
	}

	public static SxlToken lparen(int position) {
		return new SxlToken(TokenType.LPAREN, "(", position);
	}

	public static SxlToken rparen(int position) {
		return new SxlToken(TokenType.RPAREN, ")", position);
	}

	@Override
	public String toString() {
		return switch (type) {
			case STRING -> "STRING(\"" + value + "\")";
			case NUMBER, NAME -> type + "(" + value + ")";
			default -> type.toString();
		};
	}

	public boolean isType(TokenType expectedType) {
		return this.type == expectedType;
	}
}
