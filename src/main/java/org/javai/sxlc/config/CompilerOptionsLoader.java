package org.javai.sxlc.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads {@link CompilerOptions} from YAML.
 *
 * <pre>
 * parser:
 *   max_depth: 1000
 * generator:
 *   statement_separator: "\n"
 * </pre>
 *
 * Missing sections and keys keep their defaults; unknown keys are ignored.
 */
public class CompilerOptionsLoader {

	/** Classpath resource holding the bundled defaults. */
	public static final String DEFAULTS_RESOURCE = "META-INF/sxlc-defaults.yml";

	private static final Logger logger = LoggerFactory.getLogger(CompilerOptionsLoader.class);

	private final Yaml yaml = new Yaml();

	/**
	 * Loads the bundled defaults, falling back to {@link CompilerOptions#defaults()}
	 * when the resource is not on the classpath.
	 */
	public CompilerOptions loadDefaults() {
		try (InputStream stream = CompilerOptionsLoader.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
			if (stream == null) {
				logger.debug("No {} on the classpath, using built-in defaults", DEFAULTS_RESOURCE);
				return CompilerOptions.defaults();
			}
			return load(stream);
		} catch (IOException e) {
			throw new CompilerConfigurationException("Failed to read " + DEFAULTS_RESOURCE, e);
		}
	}

	public CompilerOptions load(Path path) {
		try (var reader = Files.newBufferedReader(path)) {
			return build(yaml.load(reader));
		} catch (IOException e) {
			throw new CompilerConfigurationException("Failed to read compiler options from path: " + path, e);
		} catch (YAMLException e) {
			throw new CompilerConfigurationException("Failed to parse compiler options from path: " + path, e);
		}
	}

	public CompilerOptions load(InputStream inputStream) {
		try {
			return build(yaml.load(inputStream));
		} catch (YAMLException e) {
			throw new CompilerConfigurationException("Failed to parse compiler options from stream", e);
		}
	}

	public CompilerOptions loadString(String yamlContent) {
		try {
			return build(yaml.load(yamlContent));
		} catch (YAMLException e) {
			throw new CompilerConfigurationException("Failed to parse compiler options from string", e);
		}
	}

	private CompilerOptions build(Object data) {
		CompilerOptions.Builder builder = CompilerOptions.builder();
		if (data == null) {
			return builder.build();
		}
		if (!(data instanceof Map<?, ?> root)) {
			throw new CompilerConfigurationException("Compiler options must be a YAML mapping, found: "
					+ data.getClass().getSimpleName());
		}

		Map<?, ?> parser = section(root, "parser");
		Object maxDepth = parser.get("max_depth");
		if (maxDepth != null) {
			if (!(maxDepth instanceof Integer depth)) {
				throw new CompilerConfigurationException("parser.max_depth must be an integer, found: " + maxDepth);
			}
			builder.maxDepth(depth);
		}

		Map<?, ?> generator = section(root, "generator");
		Object separator = generator.get("statement_separator");
		if (separator != null) {
			builder.statementSeparator(String.valueOf(separator));
		}

		CompilerOptions options = builder.build();
		logger.debug("Loaded compiler options {}", options);
		return options;
	}

	private Map<?, ?> section(Map<?, ?> root, String name) {
		Object section = root.get(name);
		if (section == null) {
			return Map.of();
		}
		if (!(section instanceof Map<?, ?> map)) {
			throw new CompilerConfigurationException("'" + name + "' must be a YAML mapping, found: " + section);
		}
		return map;
	}
}
