package org.javai.sxlc.sxl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.javai.sxlc.sxl.SxlToken.TokenType;
import org.junit.jupiter.api.Test;

class SxlTokenizerTest {

	@Test
	void tokenizeEmptyString() {
		assertThat(new SxlTokenizer("").tokenize()).isEmpty();
	}

	@Test
	void tokenizeNullInput() {
		assertThat(new SxlTokenizer(null).tokenize()).isEmpty();
	}

	@Test
	void tokenizeWhitespaceOnly() {
		assertThat(new SxlTokenizer("   \n\t \r ").tokenize()).isEmpty();
	}

	@Test
	void tokenizeSimpleCall() {
		List<SxlToken> tokens = new SxlTokenizer("(add 2 2)").tokenize();

		assertThat(tokens).containsExactly(
				new SxlToken(TokenType.LPAREN, "(", 0),
				new SxlToken(TokenType.NAME, "add", 1),
				new SxlToken(TokenType.NUMBER, "2", 5),
				new SxlToken(TokenType.NUMBER, "2", 7),
				new SxlToken(TokenType.RPAREN, ")", 8));
	}

	@Test
	void numbersAreMaximalDigitRuns() {
		List<SxlToken> tokens = new SxlTokenizer("12345 007").tokenize();

		assertThat(tokens).extracting(SxlToken::value).containsExactly("12345", "007");
		assertThat(tokens).allMatch(t -> t.isType(TokenType.NUMBER));
	}

	@Test
	void digitsEndAName() {
		List<SxlToken> tokens = new SxlTokenizer("abc123").tokenize();

		assertThat(tokens).extracting(SxlToken::type).containsExactly(TokenType.NAME, TokenType.NUMBER);
		assertThat(tokens).extracting(SxlToken::value).containsExactly("abc", "123");
	}

	@Test
	void namesAreCaseInsensitiveLetters() {
		List<SxlToken> tokens = new SxlTokenizer("Concat").tokenize();

		assertThat(tokens).containsExactly(new SxlToken(TokenType.NAME, "Concat", 0));
	}

	@Test
	void stringHoldsContentBetweenQuotes() {
		List<SxlToken> tokens = new SxlTokenizer("\"hello world\"").tokenize();

		assertThat(tokens).containsExactly(new SxlToken(TokenType.STRING, "hello world", 0));
	}

	@Test
	void emptyStringIsAllowed() {
		List<SxlToken> tokens = new SxlTokenizer("\"\"").tokenize();

		assertThat(tokens).containsExactly(new SxlToken(TokenType.STRING, "", 0));
	}

	@Test
	void stringKeepsCharactersThatAreIllegalOutsideIt() {
		List<SxlToken> tokens = new SxlTokenizer("\"a?b (c) 1\"").tokenize();

		assertThat(tokens).hasSize(1);
		assertThat(tokens.get(0).value()).isEqualTo("a?b (c) 1");
	}

	@Test
	void backslashDoesNotEscapeQuote() {
		List<SxlToken> tokens = new SxlTokenizer("\"a\\\" \"b\"").tokenize();

		assertThat(tokens).extracting(SxlToken::value).containsExactly("a\\", "b");
	}

	@Test
	void adjacentTokensNeedNoWhitespace() {
		List<SxlToken> tokens = new SxlTokenizer("(foo)(bar\"x\"1)").tokenize();

		assertThat(tokens).extracting(SxlToken::type).containsExactly(
				TokenType.LPAREN, TokenType.NAME, TokenType.RPAREN,
				TokenType.LPAREN, TokenType.NAME, TokenType.STRING, TokenType.NUMBER, TokenType.RPAREN);
	}

	@Test
	void unknownCharacterFails() {
		assertThatThrownBy(() -> new SxlTokenizer("(foo ?)").tokenize())
				.isInstanceOfSatisfying(UnknownCharacterException.class, e -> {
					assertThat(e.character()).isEqualTo("?");
					assertThat(e.position()).isEqualTo(5);
				})
				.hasMessageContaining("'?'");
	}

	@Test
	void unknownSupplementaryCharacterIsReportedWhole() {
		String emoji = new String(Character.toChars(0x1F600));

		assertThatThrownBy(() -> new SxlTokenizer("(f " + emoji + ")").tokenize())
				.isInstanceOfSatisfying(UnknownCharacterException.class, e -> {
					assertThat(e.codePoint()).isEqualTo(0x1F600);
					assertThat(e.character()).isEqualTo(emoji);
					assertThat(e.position()).isEqualTo(3);
				})
				.hasMessage("Unknown character: '" + emoji + "' at position 3");
	}

	@Test
	void underscoreIsNotPartOfNames() {
		assertThatThrownBy(() -> new SxlTokenizer("hello_world").tokenize())
				.isInstanceOf(UnknownCharacterException.class)
				.extracting(e -> ((SxlCompileException) e).position())
				.isEqualTo(5);
	}

	@Test
	void signsAndDecimalPointsAreUnknown() {
		assertThatThrownBy(() -> new SxlTokenizer("-1").tokenize())
				.isInstanceOf(UnknownCharacterException.class);
		assertThatThrownBy(() -> new SxlTokenizer("1.5").tokenize())
				.isInstanceOf(UnknownCharacterException.class);
	}

	@Test
	void unterminatedStringFails() {
		assertThatThrownBy(() -> new SxlTokenizer("(concat \"foo").tokenize())
				.isInstanceOfSatisfying(UnterminatedStringException.class,
						e -> assertThat(e.position()).isEqualTo(8));
	}

	@Test
	void loneQuoteIsUnterminated() {
		assertThatThrownBy(() -> new SxlTokenizer("\"").tokenize())
				.isInstanceOf(UnterminatedStringException.class);
	}

	@Test
	void tokenToStringShowsTypeAndValue() {
		assertThat(new SxlToken(TokenType.NAME, "add", 0)).hasToString("NAME(add)");
		assertThat(new SxlToken(TokenType.STRING, "x", 0)).hasToString("STRING(\"x\")");
		assertThat(SxlToken.lparen(0)).hasToString("LPAREN");
	}
}
