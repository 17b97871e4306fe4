package org.javai.sxlc.sxl;

/**
 * Thrown when a tree walk meets a node type it does not know.
 * This signals a defect in whatever built the tree, never bad user input.
 */
public class UnknownNodeKindException extends SxlCompileException {

	public UnknownNodeKindException(Object node) {
		super("Unknown node kind: " + (node == null ? "null" : node.getClass().getName()));
	}
}
