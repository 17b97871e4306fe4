package org.javai.sxlc.codegen;

import java.util.List;
import org.javai.sxlc.sxl.UnknownNodeKindException;
import org.javai.sxlc.target.CNode;

/**
 * Prints a target AST as C-style call syntax.
 *
 * <pre>
 * Program             statements joined by the statement separator
 * ExpressionStatement expression + ";"
 * CallExpression      callee + "(" + arguments joined by ", " + ")"
 * Identifier          name
 * NumberLiteral       value
 * StringLiteral       '"' + value + '"' (no escaping)
 * </pre>
 */
public class CodeGenerator {

	private final String statementSeparator;

	public CodeGenerator() {
		this("\n");
	}

	public CodeGenerator(String statementSeparator) {
		this.statementSeparator = statementSeparator;
	}

	/**
	 * @throws UnknownNodeKindException for a node outside the target node kinds
	 */
	public String generate(CNode node) {
		StringBuilder out = new StringBuilder();
		generate(node, out);
		return out.toString();
	}

	// One frame per nesting level; the parser's depth limit keeps this within the stack.
	private void generate(CNode node, StringBuilder out) {
		if (node instanceof CNode.Program program) {
			List<CNode> body = program.body();
			for (int i = 0; i < body.size(); i++) {
				if (i > 0) {
					out.append(statementSeparator);
				}
				generate(body.get(i), out);
			}
		} else if (node instanceof CNode.ExpressionStatement statement) {
			generate(statement.expression(), out);
			out.append(';');
		} else if (node instanceof CNode.CallExpression call) {
			out.append(call.callee().name()).append('(');
			List<CNode> arguments = call.arguments();
			for (int i = 0; i < arguments.size(); i++) {
				if (i > 0) {
					out.append(", ");
				}
				generate(arguments.get(i), out);
			}
			out.append(')');
		} else if (node instanceof CNode.Identifier identifier) {
			out.append(identifier.name());
		} else if (node instanceof CNode.NumberLiteral number) {
			out.append(number.value());
		} else if (node instanceof CNode.StringLiteral string) {
			out.append('"').append(string.value()).append('"');
		} else {
			throw new UnknownNodeKindException(node);
		}
	}
}
