package org.javai.sxlc.sxl;

/**
 * Thrown by the parser when a token does not fit the grammar at its position.
 */
public class UnexpectedTokenException extends SxlCompileException {

	private final SxlToken token;

	public UnexpectedTokenException(SxlToken token, String expected) {
		super("Unexpected token " + token + " at position " + token.position() + ": expected " + expected,
				token.position());
		this.token = token;
	}

	public SxlToken token() {
		return token;
	}
}
