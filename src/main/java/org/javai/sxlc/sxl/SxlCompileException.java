package org.javai.sxlc.sxl;

/**
 * Base exception for every failure raised while compiling s-expression input.
 * A failure is terminal for the compilation that raised it.
 */
public class SxlCompileException extends RuntimeException {

	/** Position value used when a failure has no source offset. */
	public static final int NO_POSITION = -1;

	private final int position;

	public SxlCompileException(String message) {
		this(message, NO_POSITION);
	}

	public SxlCompileException(String message, int position) {
		super(message);
		this.position = position;
	}

	public SxlCompileException(String message, Throwable cause) {
		super(message, cause);
		this.position = NO_POSITION;
	}

	/**
	 * The zero-based character offset the failure refers to, or {@link #NO_POSITION}.
	 */
	public int position() {
		return position;
	}
}
