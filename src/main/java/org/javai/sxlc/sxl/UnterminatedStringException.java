package org.javai.sxlc.sxl;

/**
 * Thrown by the tokenizer when input ends inside a string literal.
 * The position is that of the opening quote.
 */
public class UnterminatedStringException extends SxlCompileException {

	public UnterminatedStringException(int position) {
		super("Unterminated string starting at position " + position, position);
	}
}
