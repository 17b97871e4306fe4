package org.javai.sxlc.testsupport;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Small recognizer for the generated C-style call syntax, used to check that
 * output still has the call structure of its input.
 *
 * It reads {@code name(arg, ...);} statements separated by newlines and renders
 * them back as s-expressions, so {@code add(2, sub(4, 2));} becomes
 * {@code (add 2 (sub 4 2))}.
 */
public final class CCallRecognizer {

	private final String text;
	private int pos;

	private CCallRecognizer(String text) {
		this.text = text;
	}

	public static List<String> toSExpressions(String output) {
		List<String> statements = new ArrayList<>();
		if (output.isEmpty()) {
			return statements;
		}
		for (String line : output.split("\n", -1)) {
			CCallRecognizer recognizer = new CCallRecognizer(line);
			String expression = recognizer.call();
			recognizer.expect(';');
			if (recognizer.pos != line.length()) {
				throw new IllegalArgumentException("Trailing text in statement: " + line);
			}
			statements.add(expression);
		}
		return statements;
	}

	private String call() {
		int start = pos;
		while (pos < text.length() && Character.isLetter(text.charAt(pos))) {
			pos++;
		}
		if (start == pos) {
			throw new IllegalArgumentException("Expected a callee at " + pos + " in: " + text);
		}
		String name = text.substring(start, pos);
		expect('(');

		List<String> arguments = new ArrayList<>();
		if (peek() != ')') {
			arguments.add(argument());
			while (peek() == ',') {
				pos++;
				expect(' ');
				arguments.add(argument());
			}
		}
		expect(')');

		return arguments.isEmpty()
				? "(" + name + ")"
				: "(" + name + " " + arguments.stream().collect(Collectors.joining(" ")) + ")";
	}

	private String argument() {
		char c = peek();
		if (Character.isDigit(c)) {
			int start = pos;
			while (pos < text.length() && Character.isDigit(text.charAt(pos))) {
				pos++;
			}
			return text.substring(start, pos);
		}
		if (c == '"') {
			int close = text.indexOf('"', pos + 1);
			String literal = text.substring(pos, close + 1);
			pos = close + 1;
			return literal;
		}
		return call();
	}

	private char peek() {
		return pos < text.length() ? text.charAt(pos) : '\0';
	}

	private void expect(char expected) {
		if (peek() != expected) {
			throw new IllegalArgumentException("Expected '" + expected + "' at " + pos + " in: " + text);
		}
		pos++;
	}
}
