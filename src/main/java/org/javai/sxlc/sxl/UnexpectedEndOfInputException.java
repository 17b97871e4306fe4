package org.javai.sxlc.sxl;

/**
 * Thrown by the parser when the tokens run out inside an unfinished call expression.
 */
public class UnexpectedEndOfInputException extends SxlCompileException {

	public UnexpectedEndOfInputException(String expected, int position) {
		super("Unexpected end of input at position " + position + ": expected " + expected, position);
	}
}
