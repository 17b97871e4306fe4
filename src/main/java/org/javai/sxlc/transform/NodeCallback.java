package org.javai.sxlc.transform;

import org.javai.sxlc.sxl.SxlNode;

/**
 * Callback invoked by {@link SxlTraverser} for a node of one kind.
 *
 * @param <N> the node kind the callback is registered for
 */
@FunctionalInterface
public interface NodeCallback<N extends SxlNode> {

	/**
	 * @param node the node being visited
	 * @param parent the node's parent, or {@code null} for the root
	 */
	void accept(N node, SxlNode parent);
}
