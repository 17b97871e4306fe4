package org.javai.sxlc.cli;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import org.javai.sxlc.SxlCompiler;
import org.javai.sxlc.config.CompilerOptions;
import org.javai.sxlc.config.CompilerOptionsLoader;
import org.javai.sxlc.json.AstJsonWriter;
import org.javai.sxlc.sxl.SxlCompileException;
import org.javai.sxlc.sxl.SxlNode;
import org.javai.sxlc.sxl.SxlToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line entry point.
 *
 * <pre>
 * sxlc [-f file] [--emit code|tokens|ast|target-ast] [--max-depth n] [source]
 * </pre>
 *
 * Reads the program from the {@code source} argument, from {@code --file}, or
 * from standard input, and writes the result to standard output.
 */
public final class SxlCompilerCli {

	public static final int EXIT_OK = 0;
	public static final int EXIT_COMPILE_ERROR = 1;
	public static final int EXIT_USAGE = 2;

	static final String USAGE = String.join(System.lineSeparator(),
			"Usage: sxlc [options] [source]",
			"  -f, --file <path>     read the program from a file",
			"  --emit <stage>        code (default), tokens, ast or target-ast",
			"  --max-depth <n>       deepest call nesting accepted",
			"  -h, --help            show this message",
			"Without source or --file the program is read from standard input.");

	private static final Logger logger = LoggerFactory.getLogger(SxlCompilerCli.class);

	enum Emit {
		CODE, TOKENS, AST, TARGET_AST;

		static Emit parse(String value) {
			try {
				return valueOf(value.toUpperCase(Locale.ROOT).replace('-', '_'));
			} catch (IllegalArgumentException e) {
				throw new UsageException("Unknown --emit stage: " + value);
			}
		}
	}

	private final InputStream in;
	private final PrintStream out;
	private final PrintStream err;
	private final CompilerOptionsLoader optionsLoader;

	public SxlCompilerCli(InputStream in, PrintStream out, PrintStream err) {
		this(in, out, err, new CompilerOptionsLoader());
	}

	SxlCompilerCli(InputStream in, PrintStream out, PrintStream err, CompilerOptionsLoader optionsLoader) {
		this.in = in;
		this.out = out;
		this.err = err;
		this.optionsLoader = optionsLoader;
	}

	public static void main(String[] args) {
		System.exit(new SxlCompilerCli(System.in, System.out, System.err).run(args));
	}

	/**
	 * Runs one invocation and returns its exit code.
	 */
	public int run(String... args) {
		Arguments arguments;
		try {
			arguments = Arguments.parse(List.of(args));
		} catch (UsageException e) {
			err.println("error: " + e.getMessage());
			err.println(USAGE);
			return EXIT_USAGE;
		}
		if (arguments.help()) {
			out.println(USAGE);
			return EXIT_OK;
		}

		try {
			CompilerOptions options = optionsLoader.loadDefaults();
			if (arguments.maxDepth() != null) {
				options = options.toBuilder().maxDepth(arguments.maxDepth()).build();
			}
			String source = readSource(arguments);
			out.println(emit(new SxlCompiler(options), arguments.emit(), source));
			return EXIT_OK;
		} catch (SxlCompileException e) {
			logger.debug("Compilation failed", e);
			err.println("error: " + e.getClass().getSimpleName() + ": " + e.getMessage());
			return EXIT_COMPILE_ERROR;
		} catch (IOException e) {
			logger.debug("Could not read input", e);
			err.println("error: could not read input: " + e.getMessage());
			return EXIT_COMPILE_ERROR;
		}
	}

	private String emit(SxlCompiler compiler, Emit emit, String source) {
		AstJsonWriter json = new AstJsonWriter(compiler.options().maxDepth());
		return switch (emit) {
			case CODE -> compiler.compile(source);
			case TOKENS -> json.writeTokens(compiler.tokenize(source));
			case AST -> json.writeSource(compiler.parse(compiler.tokenize(source)));
			case TARGET_AST -> {
				List<SxlToken> tokens = compiler.tokenize(source);
				SxlNode.Program program = compiler.parse(tokens);
				yield json.writeTarget(compiler.transform(program));
			}
		};
	}

	private String readSource(Arguments arguments) throws IOException {
		if (arguments.file() != null) {
			return Files.readString(arguments.file(), StandardCharsets.UTF_8);
		}
		if (arguments.source() != null) {
			return arguments.source();
		}
		return new String(in.readAllBytes(), StandardCharsets.UTF_8);
	}

	record Arguments(String source, Path file, Emit emit, Integer maxDepth, boolean help) {

		static Arguments parse(List<String> args) {
			String source = null;
			Path file = null;
			Emit emit = Emit.CODE;
			Integer maxDepth = null;
			boolean help = false;

			for (int i = 0; i < args.size(); i++) {
				String arg = args.get(i);
				switch (arg) {
					case "-h", "--help" -> help = true;
					case "-f", "--file" -> file = Path.of(valueAfter(args, ++i, arg));
					case "--emit" -> emit = Emit.parse(valueAfter(args, ++i, arg));
					case "--max-depth" -> maxDepth = parseDepth(valueAfter(args, ++i, arg));
					default -> {
						if (arg.startsWith("--") || (arg.startsWith("-") && arg.length() > 1)) {
							throw new UsageException("Unknown option: " + arg);
						}
						if (source != null) {
							throw new UsageException("Only one source argument is allowed");
						}
						source = arg;
					}
				}
			}

			if (source != null && file != null) {
				throw new UsageException("Give either a source argument or --file, not both");
			}
			return new Arguments(source, file, emit, maxDepth, help);
		}

		private static String valueAfter(List<String> args, int index, String option) {
			if (index >= args.size()) {
				throw new UsageException("Missing value for " + option);
			}
			return args.get(index);
		}

		private static int parseDepth(String value) {
			try {
				int depth = Integer.parseInt(value);
				if (depth < 1) {
					throw new UsageException("--max-depth must be at least 1, was " + value);
				}
				return depth;
			} catch (NumberFormatException e) {
				throw new UsageException("--max-depth must be an integer, was " + value);
			}
		}
	}

	static final class UsageException extends RuntimeException {

		UsageException(String message) {
			super(message);
		}
	}
}
