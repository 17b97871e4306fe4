package org.javai.sxlc;

import java.util.List;
import org.javai.sxlc.codegen.CodeGenerator;
import org.javai.sxlc.config.CompilerOptions;
import org.javai.sxlc.sxl.SxlCompileException;
import org.javai.sxlc.sxl.SxlNode;
import org.javai.sxlc.sxl.SxlParser;
import org.javai.sxlc.sxl.SxlToken;
import org.javai.sxlc.sxl.SxlTokenizer;
import org.javai.sxlc.target.CNode;
import org.javai.sxlc.transform.CallExpressionTransformer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles s-expression call syntax into C-style call syntax.
 *
 * <pre>
 * input  -> tokenize  -> tokens
 * tokens -> parse     -> source AST
 * AST    -> transform -> target AST
 * target -> generate  -> output
 * </pre>
 *
 * Example:
 * <pre>{@code
 * String c = new SxlCompiler().compile("(add 2 (subtract 4 2))");
 * // add(2, subtract(4, 2));
 * }</pre>
 *
 * Instances hold only immutable options and can be shared between threads.
 */
public class SxlCompiler {

	private static final Logger logger = LoggerFactory.getLogger(SxlCompiler.class);

	private final CompilerOptions options;
	private final CallExpressionTransformer transformer;
	private final CodeGenerator generator;

	public SxlCompiler() {
		this(CompilerOptions.defaults());
	}

	public SxlCompiler(CompilerOptions options) {
		this.options = options;
		this.transformer = new CallExpressionTransformer();
		this.generator = new CodeGenerator(options.statementSeparator());
	}

	public CompilerOptions options() {
		return options;
	}

	/**
	 * Runs all four stages. The first failure propagates; there is no partial output.
	 *
	 * @throws SxlCompileException if any stage fails
	 */
	public String compile(String input) {
		long start = System.nanoTime();
		String output = generate(transform(parse(tokenize(input))));
		logger.debug("Compiled {} chars into {} chars in {} us", input == null ? 0 : input.length(),
				output.length(), (System.nanoTime() - start) / 1000);
		return output;
	}

	public List<SxlToken> tokenize(String input) {
		List<SxlToken> tokens = new SxlTokenizer(input).tokenize();
		logger.debug("Tokenized input into {} tokens", tokens.size());
		return tokens;
	}

	public SxlNode.Program parse(List<SxlToken> tokens) {
		SxlNode.Program program = new SxlParser(tokens, options.maxDepth()).parse();
		logger.debug("Parsed {} top-level expressions", program.body().size());
		return program;
	}

	public CNode.Program transform(SxlNode.Program program) {
		return transformer.transform(program);
	}

	public String generate(CNode node) {
		return generator.generate(node);
	}
}
