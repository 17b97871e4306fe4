package org.javai.sxlc.sxl;

/**
 * Thrown by the tokenizer when a character belongs to no token class. The
 * character is kept as a code point so supplementary characters are reported whole.
 */
public class UnknownCharacterException extends SxlCompileException {

	private final int codePoint;

	public UnknownCharacterException(int codePoint, int position) {
		super("Unknown character: '" + new String(Character.toChars(codePoint)) + "' at position " + position, position);
		this.codePoint = codePoint;
	}

	public int codePoint() {
		return codePoint;
	}

	public String character() {
		return new String(Character.toChars(codePoint));
	}
}
