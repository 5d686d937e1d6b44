package org.javai.cst.parser;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.stream.Stream;
import org.javai.cst.grammar.GrammarVersion;
import org.javai.cst.testsupport.PythonSamples;
import org.javai.cst.testsupport.PythonSamples.Sample;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

class BackendConformanceTest {

	static Stream<Sample> samples() {
		return PythonSamples.modules();
	}

	@ParameterizedTest(name = "{0}")
	@MethodSource("samples")
	void backendsAgreeOnEveryModule(Sample sample) {
		ParseTree tree = BackendConformance.check(sample.source(), ParseMode.MODULE);

		assertThat(tree.symbol()).isEqualTo("file_input");
	}

	@ParameterizedTest
	@ValueSource(strings = { "x", "a + b", "f(*args)[0].y", "lambda: (yield)", "[i async for i in x]" })
	void backendsAgreeOnExpressions(String source) {
		assertThat(BackendConformance.check(source, ParseMode.EXPRESSION).symbol()).isEqualTo("expression_input");
	}

	@Test
	void backendsAgreeOnAStatement() {
		assertThat(BackendConformance.check("with a:\n    pass", ParseMode.STATEMENT).child(0).symbol())
				.isEqualTo("with_stmt");
	}

	@ParameterizedTest
	@ValueSource(strings = { "x = (1\n", "def f(:\n    pass\n", "x = 1 2\n", "if x\n    pass\n", "return return\n" })
	void sharedRejectionIsRethrown(String source) {
		assertThatThrownBy(() -> BackendConformance.check(source, ParseMode.MODULE))
				.isInstanceOf(ParserSyntaxException.class)
				.hasMessageStartingWith("Syntax error:");
	}

	@Test
	void versionIsPassedToBothBackends() {
		assertThat(BackendConformance.check("(a := 1)", ParseMode.EXPRESSION, GrammarVersion.PYTHON_3_8)).isNotNull();
		assertThatThrownBy(() -> BackendConformance.check("(a := 1)", ParseMode.EXPRESSION, GrammarVersion.PYTHON_3_7))
				.isInstanceOf(ParserSyntaxException.class);
	}

	@Test
	void divergenceMessageShowsBothOutcomes() {
		BackendDivergenceException e = new BackendDivergenceException("Only one backend accepted the input",
				ParseMode.MODULE, "{}", "ParserSyntaxException: boom");

		assertThat(e.getMessage()).isEqualTo("""
				Only one backend accepted the input (MODULE)
				interpreted: {}
				compiled: ParserSyntaxException: boom""");
		assertThat(e.mode()).isEqualTo(ParseMode.MODULE);
		assertThat(e.compiledOutcome()).endsWith("boom");
	}
}
