package org.javai.sxlc.transform;

import org.javai.sxlc.sxl.SxlNode;

/**
 * The enter/exit callback pair registered for one node kind. Either side may be absent.
 *
 * @param enter called before the node's children are visited, or {@code null}
 * @param exit called after the node's children are visited, or {@code null}
 * @param <N> the node kind
 */
public record NodeHandler<N extends SxlNode>(NodeCallback<N> enter, NodeCallback<N> exit) {

	public static <N extends SxlNode> NodeHandler<N> onEnter(NodeCallback<N> enter) {
		return new NodeHandler<>(enter, null);
	}

	public static <N extends SxlNode> NodeHandler<N> onExit(NodeCallback<N> exit) {
		return new NodeHandler<>(null, exit);
	}

	void enter(N node, SxlNode parent) {
		if (enter != null) {
			enter.accept(node, parent);
		}
	}

	void exit(N node, SxlNode parent) {
		if (exit != null) {
			exit.accept(node, parent);
		}
	}
}
