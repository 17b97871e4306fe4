package org.javai.sxlc.sxl;

import java.util.List;
import java.util.Objects;

/**
 * A node of the source AST produced by {@link SxlParser}.
 *
 * The source tree mirrors the input syntax:
 * - {@link Program} - the root, holding top-level expressions in input order
 * - {@link CallExpression} - {@code (name param...)}
 * - {@link NumberLiteral} / {@link StringLiteral} - leaf values, kept as text
 *
 * Nodes are immutable. Tree walks dispatch on these four kinds only; any other
 * implementation is rejected with {@link UnknownNodeKindException}.
 */
public interface SxlNode {

	/**
	 * Root of a parsed source.
	 */
	record Program(List<SxlNode> body) implements SxlNode {
		public Program {
			body = List.copyOf(body);
		}
	}

	/**
	 * A call such as {@code (add 2 2)}: the callee name plus its parameters.
	 */
	record CallExpression(String name, List<SxlNode> params) implements SxlNode {
		public CallExpression {
			Objects.requireNonNull(name, "name");
			params = List.copyOf(params);
		}

		public static CallExpression of(String name, SxlNode... params) {
			return new CallExpression(name, List.of(params));
		}
	}

	/**
	 * Digits exactly as written; no numeric conversion takes place.
	 */
	record NumberLiteral(String value) implements SxlNode {
		public NumberLiteral {
			Objects.requireNonNull(value, "value");
		}
	}

	/**
	 * The content between the quotes, unescaped.
	 */
	record StringLiteral(String value) implements SxlNode {
		public StringLiteral {
			Objects.requireNonNull(value, "value");
		}
	}
}
