package org.javai.sxlc.sxl;

import java.util.ArrayList;
import java.util.List;

/**
 * Tokenizer for the s-expression call language.
 * Makes a single left-to-right pass over the input and never backtracks.
 */
public class SxlTokenizer {

	private final String input;
	private int pos = 0;

	public SxlTokenizer(String input) {
		this.input = input != null ? input : "";
	}

	/**
	 * Tokenizes the entire input string.
	 *
	 * @return list of tokens in input order (empty for blank input)
	 * @throws UnknownCharacterException if a character belongs to no token class
	 * @throws UnterminatedStringException if input ends inside a string literal
	 */
	public List<SxlToken> tokenize() {
		List<SxlToken> tokens = new ArrayList<>();

		while (!isAtEnd()) {
			char c = peek();
			if (c == '(') {
				tokens.add(SxlToken.lparen(pos));
				advance();
			} else if (c == ')') {
				tokens.add(SxlToken.rparen(pos));
				advance();
			} else if (isWhitespace(c)) {
				advance();
			} else if (isDigit(c)) {
				tokens.add(scanNumber());
			} else if (c == '"') {
				tokens.add(scanString());
			} else if (isLetter(c)) {
				tokens.add(scanName());
			} else {
				throw new UnknownCharacterException(input.codePointAt(pos), pos);
			}
		}

		return tokens;
	}

	private SxlToken scanNumber() {
		int start = pos;
		while (!isAtEnd() && isDigit(peek())) {
			advance();
		}
		return new SxlToken(SxlToken.TokenType.NUMBER, input.substring(start, pos), start);
	}

	private SxlToken scanString() {
		int start = pos;
		advance(); // consume opening "

		// no escapes: the next quote always closes the string
		int close = input.indexOf('"', pos);
		if (close < 0) {
			throw new UnterminatedStringException(start);
		}

		String value = input.substring(pos, close);
		pos = close + 1;
		return new SxlToken(SxlToken.TokenType.STRING, value, start);
	}

	private SxlToken scanName() {
		int start = pos;
		while (!isAtEnd() && isLetter(peek())) {
			advance();
		}
		return new SxlToken(SxlToken.TokenType.NAME, input.substring(start, pos), start);
	}

	private char peek() {
		return input.charAt(pos);
	}

	private void advance() {
		pos++;
	}

	private boolean isAtEnd() {
		return pos >= input.length();
	}

	private boolean isWhitespace(char c) {
		return Character.isWhitespace(c) || Character.isSpaceChar(c);
	}

	private boolean isDigit(char c) {
		return c >= '0' && c <= '9';
	}

	private boolean isLetter(char c) {
		return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
	}
}
