package org.javai.sxlc.sxl;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser turning a token list into a source {@link SxlNode.Program}.
 *
 * Grammar:
 * <pre>
 * program    := expression*
 * expression := NUMBER | STRING | '(' NAME expression* ')'
 * </pre>
 *
 * Example usage:
 *
 * <pre>
 * List&lt;SxlToken&gt; tokens = new SxlTokenizer("(add 2 (subtract 4 2))").tokenize();
 * SxlNode.Program program = new SxlParser(tokens).parse();
 * </pre>
 */
public class SxlParser {

	/** Nesting limit used when none is given. */
	public static final int DEFAULT_MAX_DEPTH = 1000;

	private final List<SxlToken> tokens;
	private final int maxDepth;

	/**
	 * Creates a parser with the default nesting limit.
	 *
	 * @param tokens the tokens to parse
	 */
	public SxlParser(List<SxlToken> tokens) {
		this(tokens, DEFAULT_MAX_DEPTH);
	}

	/**
	 * Creates a parser that rejects call expressions nested deeper than {@code maxDepth}.
	 *
	 * @param tokens the tokens to parse
	 * @param maxDepth the deepest call nesting accepted, at least 1
	 */
	public SxlParser(List<SxlToken> tokens, int maxDepth) {
		if (maxDepth < 1) {
			throw new IllegalArgumentException("maxDepth must be at least 1, was " + maxDepth);
		}
		this.tokens = tokens != null ? tokens : List.of();
		this.maxDepth = maxDepth;
	}

	/**
	 * Parses all tokens into a program.
	 *
	 * @return the program holding every top-level expression in encounter order
	 * @throws UnexpectedTokenException if a token does not fit the grammar
	 * @throws UnexpectedEndOfInputException if the tokens end inside a call expression
	 * @throws MaxDepthExceededException if calls nest deeper than the limit
	 */
	public SxlNode.Program parse() {
		ParserState state = new ParserState(tokens);
		List<SxlNode> body = new ArrayList<>();

		while (!state.isAtEnd()) {
			body.add(parseExpression(state, 0));
		}

		return new SxlNode.Program(body);
	}

	private SxlNode parseExpression(ParserState state, int depth) {
		SxlToken token = state.peek();

		return switch (token.type()) {
			case NUMBER -> {
				state.advance();
				yield new SxlNode.NumberLiteral(token.value());
			}
			case STRING -> {
				state.advance();
				yield new SxlNode.StringLiteral(token.value());
			}
			case LPAREN -> parseCallExpression(state, depth + 1);
			case RPAREN, NAME -> throw new UnexpectedTokenException(token, "a number, a string or '('");
		};
	}

	private SxlNode parseCallExpression(ParserState state, int depth) {
		SxlToken open = state.advance(); // consume '('
		if (depth > maxDepth) {
			throw new MaxDepthExceededException(maxDepth, open.position());
		}

		if (state.isAtEnd()) {
			throw new UnexpectedEndOfInputException("a call name after '('", state.endPosition());
		}
		SxlToken nameToken = state.advance();
		if (!nameToken.isType(SxlToken.TokenType.NAME)) {
			throw new UnexpectedTokenException(nameToken, "a call name after '('");
		}

		List<SxlNode> params = new ArrayList<>();
		while (!state.check(SxlToken.TokenType.RPAREN)) {
			if (state.isAtEnd()) {
				throw new UnexpectedEndOfInputException(
						"')' to close '(' at position " + open.position(), state.endPosition());
			}
			params.add(parseExpression(state, depth));
		}

		state.advance(); // consume ')'
		return new SxlNode.CallExpression(nameToken.value(), params);
	}

	/**
	 * Cursor over the token list.
	 */
	static class ParserState {
		private final List<SxlToken> tokens;
		private int current = 0;

		ParserState(List<SxlToken> tokens) {
			this.tokens = tokens;
		}

		SxlToken peek() {
			return tokens.get(current);
		}

		SxlToken advance() {
			return tokens.get(current++);
		}

		boolean check(SxlToken.TokenType type) {
			return !isAtEnd() && peek().type() == type;
		}

		boolean isAtEnd() {
			return current >= tokens.size();
		}

		/**
		 * Offset just past the last token, used to report running out of tokens.
		 */
		int endPosition() {
			if (tokens.isEmpty()) {
				return 0;
			}
			SxlToken last = tokens.get(tokens.size() - 1);
			int width = last.isType(SxlToken.TokenType.STRING) ? last.value().length() + 2 : last.value().length();
			return last.position() + width;
		}
	}
}
