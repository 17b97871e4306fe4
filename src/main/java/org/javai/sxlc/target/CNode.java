package org.javai.sxlc.target;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A node of the target AST, shaped like C-style call syntax.
 *
 * Top-level calls are wrapped in an {@link ExpressionStatement}; calls used as
 * arguments appear as bare {@link CallExpression} nodes.
 *
 * {@link Program#body()} and {@link CallExpression#arguments()} expose read-only
 * views. The lists passed in stay owned by whoever built the node, which lets a
 * transformation keep appending to them while the tree is under construction.
 */
public interface CNode {

	record Program(List<CNode> body) implements CNode {
		public Program {
			Objects.requireNonNull(body, "body");
		}

		@Override
		public List<CNode> body() {
			return Collections.unmodifiableList(body);
		}
	}

	record ExpressionStatement(CNode expression) implements CNode {
		public ExpressionStatement {
			Objects.requireNonNull(expression, "expression");
		}
	}

	record CallExpression(Identifier callee, List<CNode> arguments) implements CNode {
		public CallExpression {
			Objects.requireNonNull(callee, "callee");
			Objects.requireNonNull(arguments, "arguments");
		}

		public static CallExpression of(String callee, CNode... arguments) {
			return new CallExpression(new Identifier(callee), List.of(arguments));
		}

		@Override
		public List<CNode> arguments() {
			return Collections.unmodifiableList(arguments);
		}
	}

	record Identifier(String name) implements CNode {
		public Identifier {
			Objects.requireNonNull(name, "name");
		}
	}

	record NumberLiteral(String value) implements CNode {
		public NumberLiteral {
			Objects.requireNonNull(value, "value");
		}
	}

	record StringLiteral(String value) implements CNode {
		public StringLiteral {
			Objects.requireNonNull(value, "value");
		}
	}
}
