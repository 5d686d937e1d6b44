package org.javai.cst.parser;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.javai.cst.grammar.GrammarRegistry;
import org.javai.cst.grammar.GrammarVersion;
import org.javai.cst.tokenize.PythonTokenizer;
import org.javai.cst.tokenize.Token;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

@DisplayName("Parsing strategies")
class ParsingStrategyTest {

	private static ParseTree parse(ParserBackend backend, String source, ParseMode mode) {
		return parse(backend, source, mode, GrammarVersion.PYTHON_3_8);
	}

	private static ParseTree parse(ParserBackend backend, String source, ParseMode mode, GrammarVersion version) {
		List<Token> tokens = PythonTokenizer.tokenize(source, version);
		return backend.newStrategy().parse(tokens, version, mode);
	}

	@Nested
	@DisplayName("tree shape")
	class Shape {

		@ParameterizedTest
		@EnumSource(ParserBackend.class)
		void moduleWithOneAssignment(ParserBackend backend) {
			ParseTree tree = parse(backend, "x = 1\n", ParseMode.MODULE);

			assertThat(tree.symbol()).isEqualTo("file_input");
			assertThat(tree.children()).extracting(ParseTree::symbol).containsExactly("simple_stmt", "ENDMARKER");
			ParseTree simple = tree.child(0);
			assertThat(simple.children()).extracting(ParseTree::symbol).containsExactly("expr_stmt", "NEWLINE");
			assertThat(simple.child(0).children()).extracting(ParseTree::symbol).containsExactly("NAME", "OP", "NUMBER");
		}

		@ParameterizedTest
		@EnumSource(ParserBackend.class)
		void singleChildRulesCollapse(ParserBackend backend) {
			ParseTree tree = parse(backend, "a + b * c", ParseMode.EXPRESSION);

			assertThat(tree.symbol()).isEqualTo("expression_input");
			ParseTree sum = tree.child(0);
			assertThat(sum.symbol()).isEqualTo("arith_expr");
			assertThat(sum.child(0).isLeaf()).isTrue();
			assertThat(sum.child(1).isToken("+")).isTrue();
			assertThat(sum.child(2).symbol()).isEqualTo("term");
		}

		@ParameterizedTest
		@EnumSource(ParserBackend.class)
		void compoundStatement(ParserBackend backend) {
			ParseTree tree = parse(backend, "if x:\n    pass\nelse:\n    y\n", ParseMode.STATEMENT);

			assertThat(tree.symbol()).isEqualTo("statement_input");
			ParseTree ifStmt = tree.child(0);
			assertThat(ifStmt.symbol()).isEqualTo("if_stmt");
			assertThat(ifStmt.children()).filteredOn(c -> c.is("suite")).hasSize(2);
		}

		@Test
		void backendsBuildEqualTrees() {
			String source = """
					@decorator(arg=1)
					async def f(a, *args, b: int = 2, **kw) -> None:
					    return [x for x in range(10) if x % 2]

					class C(Base, metaclass=M):
					    def g(self):
					        yield from {k: v for k, v in d.items()}
					""";
			assertThat(parse(ParserBackend.COMPILED, source, ParseMode.MODULE))
					.isEqualTo(parse(ParserBackend.INTERPRETED, source, ParseMode.MODULE));
		}

		@Test
		void dumpOutlinesTheTree() {
			ParseTree tree = parse(ParserBackend.INTERPRETED, "a", ParseMode.EXPRESSION);

			assertThat(tree.dump()).isEqualTo("""
					expression_input
					  NAME(a)
					  NEWLINE
					  ENDMARKER
					""");
		}
	}

	@Nested
	@DisplayName("errors")
	class Errors {

		@ParameterizedTest
		@EnumSource(ParserBackend.class)
		void unclosedParenthesisReportsEndOfInput(ParserBackend backend) {
			assertThatThrownBy(() -> parse(backend, "x = (1\n", ParseMode.MODULE))
					.isInstanceOf(ParserSyntaxException.class)
					.satisfies(e -> {
						ParserSyntaxException ex = (ParserSyntaxException) e;
						assertThat(ex.found()).isEqualTo("end of input");
						assertThat(ex.expected()).contains("')'");
					});
		}

		@ParameterizedTest
		@EnumSource(ParserBackend.class)
		void reportsFarthestToken(ParserBackend backend) {
			assertThatThrownBy(() -> parse(backend, "x = 1\ny = 2 3\n", ParseMode.MODULE))
					.isInstanceOf(ParserSyntaxException.class)
					.satisfies(e -> {
						ParserSyntaxException ex = (ParserSyntaxException) e;
						assertThat(ex.found()).isEqualTo("NUMBER(3)");
						assertThat(ex.line()).isEqualTo(2);
						assertThat(ex.column()).isEqualTo(6);
					});
		}

		@ParameterizedTest
		@EnumSource(ParserBackend.class)
		void statementModeAcceptsExactlyOneStatement(ParserBackend backend) {
			assertThatThrownBy(() -> parse(backend, "x = 1\ny = 2\n", ParseMode.STATEMENT))
					.isInstanceOf(ParserSyntaxException.class);
		}

		@ParameterizedTest
		@EnumSource(ParserBackend.class)
		void walrusNeeds38(ParserBackend backend) {
			assertThat(parse(backend, "(y := 1)", ParseMode.EXPRESSION, GrammarVersion.PYTHON_3_8)).isNotNull();
			assertThatThrownBy(() -> parse(backend, "(y := 1)", ParseMode.EXPRESSION, GrammarVersion.PYTHON_3_7))
					.isInstanceOf(ParserSyntaxException.class);
		}

		@ParameterizedTest
		@EnumSource(ParserBackend.class)
		void rejectsEmptyTokenList(ParserBackend backend) {
			assertThatThrownBy(() -> backend.newStrategy().parse(List.of(), GrammarVersion.PYTHON_3_8, ParseMode.MODULE))
					.isInstanceOf(IllegalArgumentException.class);
		}
	}

	@Nested
	@DisplayName("interpreted strategy with a custom grammar")
	class CustomGrammar {

		private final GrammarRegistry registry = GrammarRegistry.create();

		@Test
		void executesTheRegisteredGrammar() {
			registry.registerResource("grammars/sum-grammar.yml");
			InterpretedParsingStrategy strategy = new InterpretedParsingStrategy(registry);

			ParseTree tree = strategy.parse(PythonTokenizer.tokenize("1 + 2 + 3", GrammarVersion.PYTHON_3_8),
					GrammarVersion.PYTHON_3_8, ParseMode.EXPRESSION);

			assertThat(tree.symbol()).isEqualTo("sum_input");
			assertThat(tree.child(0).symbol()).isEqualTo("sum");
			assertThat(tree.child(0).size()).isEqualTo(5);
		}

		@Test
		void singleNumberCollapses() {
			registry.registerResource("grammars/sum-grammar.yml");
			InterpretedParsingStrategy strategy = new InterpretedParsingStrategy(registry);

			ParseTree tree = strategy.parse(PythonTokenizer.tokenize("7", GrammarVersion.PYTHON_3_8),
					GrammarVersion.PYTHON_3_8, ParseMode.EXPRESSION);

			assertThat(tree.child(0).isLeaf()).isTrue();
			assertThat(tree.child(0).token().text()).isEqualTo("7");
		}

		@Test
		void errorListsTheExpectedTerminals() {
			registry.registerResource("grammars/sum-grammar.yml");
			InterpretedParsingStrategy strategy = new InterpretedParsingStrategy(registry);
			List<Token> tokens = PythonTokenizer.tokenize("1 +", GrammarVersion.PYTHON_3_8);

			assertThatThrownBy(() -> strategy.parse(tokens, GrammarVersion.PYTHON_3_8, ParseMode.EXPRESSION))
					.isInstanceOf(ParserSyntaxException.class)
					.hasMessageStartingWith("Syntax error: expected NUMBER but found end of line");
		}

		@Test
		void versionGatedAlternativeIsSkipped() {
			registry.registerResource("grammars/sum-grammar.yml");
			InterpretedParsingStrategy strategy = new InterpretedParsingStrategy(registry);
			List<Token> tokens = PythonTokenizer.tokenize("x := 1", GrammarVersion.PYTHON_3_8);

			assertThat(strategy.parse(tokens, GrammarVersion.PYTHON_3_8, ParseMode.EXPRESSION).child(0).symbol())
					.isEqualTo("sum");
			assertThatThrownBy(() -> strategy.parse(tokens, GrammarVersion.PYTHON_3_7, ParseMode.EXPRESSION))
					.isInstanceOf(ParserSyntaxException.class);
		}

		@Test
		void missingEntryPointIsAGrammarError() {
			registry.registerResource("grammars/sum-grammar.yml");
			InterpretedParsingStrategy strategy = new InterpretedParsingStrategy(registry);

			assertThatThrownBy(() -> strategy.parse(PythonTokenizer.tokenize("1\n", GrammarVersion.PYTHON_3_8),
					GrammarVersion.PYTHON_3_8, ParseMode.MODULE))
					.hasMessageContaining("no entry point for MODULE");
		}
	}
}
