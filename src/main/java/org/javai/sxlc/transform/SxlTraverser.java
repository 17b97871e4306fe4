package org.javai.sxlc.transform;

import java.util.List;
import org.javai.sxlc.sxl.SxlNode;
import org.javai.sxlc.sxl.UnknownNodeKindException;

/**
 * Depth-first walker over the source AST.
 *
 * For every node the registered enter callback runs before its children are
 * visited (left to right) and the exit callback runs after them. The traverser
 * only walks; what the callbacks build is up to the {@link VisitorTable}.
 */
public final class SxlTraverser {

	/**
	 * Walks the tree rooted at {@code root}; the root is visited with a {@code null} parent.
	 *
	 * @throws UnknownNodeKindException if the tree holds a node outside the source node kinds
	 */
	public void traverse(SxlNode root, VisitorTable visitor) {
		traverseNode(root, null, visitor);
	}

	private void traverseNode(SxlNode node, SxlNode parent, VisitorTable visitor) {
		if (node instanceof SxlNode.Program program) {
			visit(SxlNode.Program.class, program, parent, program.body(), visitor);
		} else if (node instanceof SxlNode.CallExpression call) {
			visit(SxlNode.CallExpression.class, call, parent, call.params(), visitor);
		} else if (node instanceof SxlNode.NumberLiteral number) {
			visit(SxlNode.NumberLiteral.class, number, parent, List.of(), visitor);
		} else if (node instanceof SxlNode.StringLiteral string) {
			visit(SxlNode.StringLiteral.class, string, parent, List.of(), visitor);
		} else {
			throw new UnknownNodeKindException(node);
		}
	}

	private <N extends SxlNode> void visit(Class<N> kind, N node, SxlNode parent, List<SxlNode> children,
			VisitorTable visitor) {
		NodeHandler<N> handler = visitor.handlerFor(kind).orElse(null);

		if (handler != null) {
			handler.enter(node, parent);
		}

		for (SxlNode child : children) {
			traverseNode(child, node, visitor);
		}

		if (handler != null) {
			handler.exit(node, parent);
		}
	}
}
