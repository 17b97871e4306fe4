package org.javai.sxlc.config;

import java.util.Objects;
import org.javai.sxlc.sxl.SxlParser;

/**
 * Settings of one {@link org.javai.sxlc.SxlCompiler}.
 *
 * @param maxDepth deepest call nesting the parser accepts
 * @param statementSeparator text placed between top-level statements of the output
 */
public record CompilerOptions(int maxDepth, String statementSeparator) {

	public static final String DEFAULT_STATEMENT_SEPARATOR = "\n";

	public CompilerOptions {
		if (maxDepth < 1) {
			throw new CompilerConfigurationException("max_depth must be at least 1, was " + maxDepth);
		}
		Objects.requireNonNull(statementSeparator, "statementSeparator");
	}

	public static CompilerOptions defaults() {
		return new CompilerOptions(SxlParser.DEFAULT_MAX_DEPTH, DEFAULT_STATEMENT_SEPARATOR);
	}

	public static Builder builder() {
		return new Builder();
	}

	public Builder toBuilder() {
		return new Builder().maxDepth(maxDepth).statementSeparator(statementSeparator);
	}

	public static final class Builder {

		private int maxDepth = SxlParser.DEFAULT_MAX_DEPTH;
		private String statementSeparator = DEFAULT_STATEMENT_SEPARATOR;

		private Builder() {
		}

		public Builder maxDepth(int maxDepth) {
			this.maxDepth = maxDepth;
			return this;
		}

		public Builder statementSeparator(String statementSeparator) {
			this.statementSeparator = statementSeparator;
			return this;
		}

		public CompilerOptions build() {
			return new CompilerOptions(maxDepth, statementSeparator);
		}
	}
}
