package org.javai.sxlc.codegen;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

import java.util.List;
import org.javai.sxlc.sxl.UnknownNodeKindException;
import org.javai.sxlc.target.CNode;
import org.junit.jupiter.api.Test;

class CodeGeneratorTest {

	private final CodeGenerator generator = new CodeGenerator();

	@Test
	void identifierPrintsItsName() {
		assertThat(generator.generate(new CNode.Identifier("add"))).isEqualTo("add");
	}

	@Test
	void numberPrintsVerbatim() {
		assertThat(generator.generate(new CNode.NumberLiteral("007"))).isEqualTo("007");
	}

	@Test
	void stringIsQuotedWithoutEscaping() {
		assertThat(generator.generate(new CNode.StringLiteral("a\\b"))).isEqualTo("\"a\\b\"");
		assertThat(generator.generate(new CNode.StringLiteral(""))).isEqualTo("\"\"");
	}

	@Test
	void callJoinsArgumentsWithCommaSpace() {
		CNode call = CNode.CallExpression.of("add",
				new CNode.NumberLiteral("2"),
				CNode.CallExpression.of("subtract", new CNode.NumberLiteral("4"), new CNode.NumberLiteral("2")));

		assertThat(generator.generate(call)).isEqualTo("add(2, subtract(4, 2))");
	}

	@Test
	void callWithoutArguments() {
		assertThat(generator.generate(CNode.CallExpression.of("foo"))).isEqualTo("foo()");
	}

	@Test
	void statementEndsWithSemicolon() {
		CNode statement = new CNode.ExpressionStatement(CNode.CallExpression.of("foo", new CNode.StringLiteral("x")));

		assertThat(generator.generate(statement)).isEqualTo("foo(\"x\");");
	}

	@Test
	void programJoinsStatementsWithNewline() {
		CNode.Program program = new CNode.Program(List.of(
				new CNode.ExpressionStatement(CNode.CallExpression.of("foo")),
				new CNode.ExpressionStatement(CNode.CallExpression.of("bar"))));

		assertThat(generator.generate(program)).isEqualTo("foo();\nbar();");
	}

	@Test
	void emptyProgramPrintsNothing() {
		assertThat(generator.generate(new CNode.Program(List.of()))).isEmpty();
	}

	@Test
	void customStatementSeparator() {
		CNode.Program program = new CNode.Program(List.of(
				new CNode.ExpressionStatement(CNode.CallExpression.of("foo")),
				new CNode.ExpressionStatement(CNode.CallExpression.of("bar"))));

		assertThat(new CodeGenerator(" ").generate(program)).isEqualTo("foo(); bar();");
	}

	@Test
	void deeplyNestedCallsPrint() {
		CNode node = new CNode.NumberLiteral("1");
		for (int i = 0; i < 1000; i++) {
			node = CNode.CallExpression.of("f", node);
		}

		assertThat(generator.generate(new CNode.ExpressionStatement(node)))
				.isEqualTo("f(".repeat(1000) + "1" + ")".repeat(1000) + ";");
	}

	@Test
	void unknownNodeKindFails() {
		CNode foreign = mock(CNode.class);

		assertThatThrownBy(() -> generator.generate(CNode.CallExpression.of("f", foreign)))
				.isInstanceOf(UnknownNodeKindException.class);
	}
}
