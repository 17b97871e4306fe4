package org.javai.sxlc.sxl;

/**
 * Thrown by the parser when call expressions nest deeper than the configured limit.
 */
public class MaxDepthExceededException extends SxlCompileException {

	private final int limit;

	public MaxDepthExceededException(int limit, int position) {
		super("Call expressions nested deeper than " + limit + " levels at position " + position, position);
		this.limit = limit;
	}

	public int limit() {
		return limit;
	}
}
