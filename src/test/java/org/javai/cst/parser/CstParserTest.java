package org.javai.cst.parser;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.Level;
import org.javai.cst.codegen.CstRenderer;
import org.javai.cst.grammar.GrammarVersion;
import org.javai.cst.nodes.Assign;
import org.javai.cst.nodes.BaseExpression;
import org.javai.cst.nodes.BaseStatement;
import org.javai.cst.nodes.BinaryOp;
import org.javai.cst.nodes.BinaryOperation;
import org.javai.cst.nodes.CstNode;
import org.javai.cst.nodes.CstNodes;
import org.javai.cst.nodes.If;
import org.javai.cst.nodes.IndentedBlock;
import org.javai.cst.nodes.IntegerLiteral;
import org.javai.cst.nodes.Module;
import org.javai.cst.nodes.Name;
import org.javai.cst.nodes.SimpleStatementLine;
import org.javai.cst.nodes.TupleExpr;
import org.javai.cst.testsupport.LogCaptorAppender;
import org.javai.cst.tokenize.LexicalException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("CstParser")
class CstParserTest {

	@Nested
	@DisplayName("round trip")
	class RoundTrip {

		@ParameterizedTest(name = "{0}")
		@MethodSource("org.javai.cst.testsupport.PythonSamples#modulesWithNames")
		void compiledBackendReproducesTheSource(String name, String source) {
			Module module = CstParser.parseModule(source, ParserConfig.defaults().withBackend(ParserBackend.COMPILED));

			assertThat(module.code()).isEqualTo(source);
		}

		@ParameterizedTest(name = "{0}")
		@MethodSource("org.javai.cst.testsupport.PythonSamples#modulesWithNames")
		void interpretedBackendReproducesTheSource(String name, String source) {
			Module module = CstParser.parseModule(source, ParserConfig.defaults().withBackend(ParserBackend.INTERPRETED));

			assertThat(module.code()).isEqualTo(source);
		}

		@ParameterizedTest(name = "{0}")
		@MethodSource("org.javai.cst.testsupport.PythonSamples#modulesWithNames")
		void backendsBuildEqualTrees(String name, String source) {
			Module interpreted = CstParser.parseModule(source, ParserConfig.defaults().withBackend(ParserBackend.INTERPRETED));
			Module compiled = CstParser.parseModule(source, ParserConfig.defaults().withBackend(ParserBackend.COMPILED));

			assertThat(compiled).isEqualTo(interpreted);
		}

		@ParameterizedTest(name = "{0}")
		@MethodSource("org.javai.cst.testsupport.PythonSamples#modulesWithNames")
		void reparsingGeneratedCodeGivesAnEqualTree(String name, String source) {
			Module first = CstParser.parseModule(source);
			Module second = CstParser.parseModule(first.code());

			assertThat(second).isEqualTo(first);
		}

		@Test
		void unevenSpacingSurvives() {
			assertThat(CstParser.parseModule("x =  1+1\n").code()).isEqualTo("x =  1+1\n");
		}
	}

	@Nested
	@DisplayName("editing")
	class Editing {

		@Test
		void replacingAnOperandKeepsTheSurroundingWhitespace() {
			Module module = CstParser.parseModule("x =  1+1\n");
			SimpleStatementLine line = (SimpleStatementLine) module.body().get(0);
			Assign assign = (Assign) line.body().get(0);
			BinaryOperation sum = (BinaryOperation) assign.value();

			BinaryOperation changedSum = CstNodes.withChanges(sum, Map.of("right", IntegerLiteral.of("2")));
			Assign changedAssign = CstNodes.withChanges(assign, Map.of("value", changedSum));
			SimpleStatementLine changedLine = CstNodes.withChanges(line, Map.of("body", List.of(changedAssign)));
			Module changed = CstNodes.withChanges(module, Map.of("body", List.of(changedLine)));

			assertThat(changed.code()).isEqualTo("x =  1+2\n");
			assertThat(module.code()).isEqualTo("x =  1+1\n");
			assertThat(changedSum.left()).isSameAs(sum.left());
			assertThat(changedSum.operator()).isSameAs(sum.operator());
		}

		@Test
		void constructedNodesRenderWithConventionalSpacing() {
			Module module = Module.of(List.of(SimpleStatementLine.of(
					Assign.of(Name.of("total"), BinaryOperation.of(Name.of("a"), BinaryOp.Kind.ADD, IntegerLiteral.of("1"))))));

			assertThat(module.code()).isEqualTo("total = a + 1\n");
			assertThat(CstParser.parseModule(module.code()).code()).isEqualTo(module.code());
		}
	}

	@Nested
	@DisplayName("modes")
	class Modes {

		@Test
		void statementModeReturnsOneStatement() {
			BaseStatement statement = CstParser.parseStatement("if x:\n    pass\n");

			assertThat(statement).isInstanceOf(If.class);
			assertThat(((If) statement).body()).isInstanceOf(IndentedBlock.class);
			assertThat(CstRenderer.render(statement)).isEqualTo("if x:\n    pass\n");
		}

		@Test
		void statementWithoutNewlineRendersWithOne() {
			BaseStatement statement = CstParser.parseStatement("x = 1");

			assertThat(statement).isInstanceOf(SimpleStatementLine.class);
			assertThat(CstRenderer.render(statement)).isEqualTo("x = 1\n");
		}

		@Test
		void statementKeepsItsLeadingComments() {
			BaseStatement statement = CstParser.parseStatement("# why\nx = 1\n");

			assertThat(((SimpleStatementLine) statement).leadingLines()).hasSize(1);
			assertThat(CstRenderer.render(statement)).isEqualTo("# why\nx = 1\n");
		}

		@Test
		void statementModeRejectsASecondStatement() {
			assertThatThrownBy(() -> CstParser.parseStatement("x = 1\ny = 2\n"))
					.isInstanceOf(ParserSyntaxException.class);
		}

		@Test
		void statementModeRejectsTrailingLines() {
			assertThatThrownBy(() -> CstParser.parseStatement("x = 1\n\n# after\n"))
					.isInstanceOf(ParserSyntaxException.class)
					.hasMessageContaining("after the statement");
		}

		@Test
		void expressionModeReturnsAnExpression() {
			BaseExpression expression = CstParser.parseExpression("a + b * c");

			assertThat(expression).isInstanceOf(BinaryOperation.class);
			assertThat(CstRenderer.render(expression)).isEqualTo("a + b * c");
		}

		@Test
		void expressionModeAcceptsABareTuple() {
			BaseExpression expression = CstParser.parseExpression("a, b");

			assertThat(expression).isInstanceOf(TupleExpr.class);
			assertThat(((TupleExpr) expression).elements()).hasSize(2);
		}

		@Test
		void expressionModeAcceptsLineBreaksInsideParentheses() {
			BaseExpression expression = CstParser.parseExpression("(a +\n    b)");

			assertThat(CstRenderer.render(expression)).isEqualTo("(a +\n    b)");
		}

		@ParameterizedTest
		@ValueSource(strings = { " a", "a ", "a\n", "a  # note" })
		void expressionModeRejectsSurroundingWhitespace(String source) {
			assertThatThrownBy(() -> CstParser.parseExpression(source))
					.isInstanceOf(ParserSyntaxException.class);
		}

		@ParameterizedTest
		@EnumSource(ParseMode.class)
		void tryParseReportsSuccess(ParseMode mode) {
			ParseResult<CstNode> result = CstParser.tryParse("x", mode, ParserConfig.defaults());

			assertThat(result.isSuccess()).isTrue();
			assertThat(result.toOptional()).isPresent();
			assertThat(result.error()).isNull();
		}
	}

	@Nested
	@DisplayName("errors")
	class Errors {

		@Test
		void unclosedParenthesis() {
			assertThatThrownBy(() -> CstParser.parseModule("x = (1\n"))
					.isInstanceOf(ParserSyntaxException.class)
					.hasMessageContaining("found end of input");
		}

		@ParameterizedTest
		@EnumSource(ParserBackend.class)
		void errorAtEndOfInputStaysWithinTheSource(ParserBackend backend) {
			ParserConfig config = ParserConfig.defaults().withBackend(backend);

			assertThatThrownBy(() -> CstParser.parseModule("x = (1", config))
					.isInstanceOfSatisfying(ParserSyntaxException.class, e -> {
						assertThat(e.offset()).isEqualTo(6);
						assertThat(e.line()).isEqualTo(1);
						assertThat(e.column()).isEqualTo(6);
						assertThat(e.found()).isEqualTo("end of input");
					});
		}

		@Test
		void lexicalErrorsPassThrough() {
			assertThatThrownBy(() -> CstParser.parseModule("x = 'open\n"))
					.isInstanceOf(LexicalException.class);
		}

		@Test
		void tryParseReturnsTheError() {
			ParseResult<Module> result = CstParser.tryParseModule("def (:\n");

			assertThat(result.isSuccess()).isFalse();
			assertThat(result.toOptional()).isEmpty();
			assertThat(result.error()).isInstanceOf(ParserSyntaxException.class);
			assertThatThrownBy(result::orElseThrow).isSameAs(result.error());
		}

		@ParameterizedTest
		@ValueSource(strings = {
				"f(a=1, b)\n",
				"f(x for x in y, z)\n",
				"def f(a=1, b):\n    pass\n",
				"def f(*):\n    pass\n",
				"try:\n    pass\nexcept:\n    pass\nexcept E:\n    pass\n",
				"from a import b,\n",
				"x: int, y: int = 1, 2\n",
				"{**a for a in b}\n",
				"x = import\n",
		})
		void rejectsCodeTheGrammarAloneWouldAllow(String source) {
			assertThat(CstParser.tryParseModule(source).isSuccess()).isFalse();
		}

		@Test
		void walrusIsRejectedFor37() {
			ParserConfig config = ParserConfig.defaults().withVersion(GrammarVersion.PYTHON_3_7);

			assertThat(CstParser.tryParse("(y := 1)", ParseMode.EXPRESSION, config).isSuccess()).isFalse();
			assertThat(CstParser.tryParse("(y := 1)", ParseMode.EXPRESSION, ParserConfig.defaults()).isSuccess()).isTrue();
		}

		@ParameterizedTest
		@EnumSource(ParserBackend.class)
		void positionalOnlyMarkerIsRejectedFor37(ParserBackend backend) {
			String source = "def f(a, /, b):\n    pass\n";
			ParserConfig older = ParserConfig.defaults().withVersion(GrammarVersion.PYTHON_3_7).withBackend(backend);

			assertThatThrownBy(() -> CstParser.parseModule(source, older))
					.isInstanceOfSatisfying(ParserSyntaxException.class,
							e -> assertThat(e.found()).isEqualTo("'/'"));
			assertThat(CstParser.parseModule(source, ParserConfig.defaults().withBackend(backend)).code())
					.isEqualTo(source);
		}
	}

	@Nested
	@DisplayName("module formatting")
	class Formatting {

		@Test
		void detectsTheIndentOfTheFirstBlock() {
			Module module = CstParser.parseModule("if x:\n  pass\n");

			assertThat(module.defaultIndent()).isEqualTo("  ");
			assertThat(((IndentedBlock) ((If) module.body().get(0)).body()).indent()).isNull();
		}

		@Test
		void configuredIndentWins() {
			Module module = CstParser.parseModule("if x:\n  pass\n", ParserConfig.defaults().withDefaultIndent("\t"));

			assertThat(module.defaultIndent()).isEqualTo("\t");
			assertThat(((IndentedBlock) ((If) module.body().get(0)).body()).indent()).isEqualTo("  ");
			assertThat(module.code()).isEqualTo("if x:\n  pass\n");
		}

		@Test
		void moduleWithoutBlocksUsesFourSpaces() {
			assertThat(CstParser.parseModule("x = 1\n").defaultIndent()).isEqualTo("    ");
		}

		@Test
		void detectsCarriageReturnNewlines() {
			Module module = CstParser.parseModule("x = 1\r\ny = 2\r\n");

			assertThat(module.defaultNewline()).isEqualTo("\r\n");
		}

		@Test
		void remembersAMissingTrailingNewline() {
			Module module = CstParser.parseModule("x = 1");

			assertThat(module.hasTrailingNewline()).isFalse();
			assertThat(module.body()).hasSize(1);
		}

		@Test
		void readsTheCodingDeclaration() {
			assertThat(CstParser.parseModule("#!/usr/bin/env python\n# vim: set fileencoding=latin-1 :\nx = 1\n").encoding())
					.isEqualTo("latin-1");
			assertThat(CstParser.parseModule("x = 1\n").encoding()).isEqualTo("utf-8");
		}

		@Test
		void codingDeclarationAfterTheSecondLineIsIgnored() {
			assertThat(CstParser.parseModule("\n\n# coding: latin-1\n").encoding()).isEqualTo("utf-8");
		}

		@Test
		void configuredNewlineIsUsedForNewNodes() {
			Module module = CstParser.parseModule("x = 1\n", ParserConfig.defaults().withDefaultNewline("\r\n"));
			Module extended = CstNodes.withChanges(module, Map.of("body", List.of(
					module.body().get(0), SimpleStatementLine.of(Assign.of(Name.of("y"), IntegerLiteral.of("2"))))));

			assertThat(extended.code()).isEqualTo("x = 1\ny = 2\r\n");
		}
	}

	@Nested
	@DisplayName("configuration")
	class Configuration {

		@Test
		void defaults() {
			ParserConfig config = ParserConfig.defaults();

			assertThat(config.version()).isEqualTo(GrammarVersion.latest());
			assertThat(config.backend()).isEqualTo(ParserBackend.COMPILED);
			assertThat(config.defaultIndent()).isNull();
			assertThat(config.defaultNewline()).isNull();
		}

		@Test
		void rejectsIndentThatIsNotWhitespace() {
			assertThatThrownBy(() -> ParserConfig.defaults().withDefaultIndent("--"))
					.isInstanceOf(IllegalArgumentException.class);
			assertThatThrownBy(() -> ParserConfig.defaults().withDefaultIndent(""))
					.isInstanceOf(IllegalArgumentException.class);
		}

		@Test
		void rejectsUnknownNewline() {
			assertThatThrownBy(() -> ParserConfig.defaults().withDefaultNewline("\n\n"))
					.isInstanceOf(IllegalArgumentException.class);
		}

		@Test
		void logsTheBackendUsed() {
			try (LogCaptorAppender captor = LogCaptorAppender.capture(CstParser.class, Level.DEBUG)) {
				CstParser.parseModule("x = 1\n", ParserConfig.defaults().withBackend(ParserBackend.INTERPRETED));

				assertThat(captor.messagesAt(Level.DEBUG))
						.anyMatch(m -> m.startsWith("Parsed 6 chars as MODULE with the INTERPRETED backend"));
			}
		}
	}
}
