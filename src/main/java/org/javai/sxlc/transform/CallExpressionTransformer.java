package org.javai.sxlc.transform;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import org.javai.sxlc.sxl.SxlNode;
import org.javai.sxlc.target.CNode;

/**
 * Rewrites a source {@link SxlNode.Program} into a C-style {@link CNode.Program}.
 *
 * Every target node is appended to the attachment point of its nearest
 * enclosing call, or to the program body at the top level. Attachment points
 * live in a side table keyed by source node identity for the duration of one
 * pass; source nodes are never touched.
 */
public class CallExpressionTransformer {

	private final SxlTraverser traverser;

	public CallExpressionTransformer() {
		this(new SxlTraverser());
	}

	public CallExpressionTransformer(SxlTraverser traverser) {
		this.traverser = traverser;
	}

	public CNode.Program transform(SxlNode.Program program) {
		List<CNode> body = new ArrayList<>();
		Pass pass = new Pass();
		pass.attachments.put(program, body);

		traverser.traverse(program, pass.rules());
		return new CNode.Program(body);
	}

	/**
	 * State of a single transformation.
	 */
	private static final class Pass {

		private final Map<SxlNode, List<CNode>> attachments = new IdentityHashMap<>();

		VisitorTable rules() {
			return VisitorTable.builder()
					.onEnter(SxlNode.NumberLiteral.class,
							(node, parent) -> attachmentOf(parent).add(new CNode.NumberLiteral(node.value())))
					.onEnter(SxlNode.StringLiteral.class,
							(node, parent) -> attachmentOf(parent).add(new CNode.StringLiteral(node.value())))
					.onEnter(SxlNode.CallExpression.class, this::enterCall)
					.build();
		}

		private void enterCall(SxlNode.CallExpression node, SxlNode parent) {
			List<CNode> arguments = new ArrayList<>();
			CNode.CallExpression call = new CNode.CallExpression(new CNode.Identifier(node.name()), arguments);
			attachments.put(node, arguments);

			if (parent instanceof SxlNode.CallExpression) {
				attachmentOf(parent).add(call);
			} else {
				attachmentOf(parent).add(new CNode.ExpressionStatement(call));
			}
		}

		private List<CNode> attachmentOf(SxlNode parent) {
			List<CNode> attachment = attachments.get(parent);
			if (attachment == null) {
				throw new IllegalStateException("No attachment point registered for "
						+ (parent == null ? "the root" : parent.getClass().getSimpleName()));
			}
			return attachment;
		}
	}
}
