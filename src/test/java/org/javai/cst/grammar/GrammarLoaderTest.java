package org.javai.cst.grammar;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.javai.cst.tokenize.TokenKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("GrammarLoader")
class GrammarLoaderTest {

	private final GrammarLoader loader = new GrammarLoader();

	private static final String MINIMAL = """
			grammar:
			  id: mini
			  versions: ["3.8"]
			entry_points:
			  EXPRESSION: start
			rules:
			  start:
			    alternatives:
			      - "NAME NEWLINE ENDMARKER"
			""";

	@Nested
	@DisplayName("loading")
	class Loading {

		@Test
		void loadsTheBundledPythonGrammar() throws Exception {
			try (InputStream is = getClass().getClassLoader().getResourceAsStream(GrammarRegistry.PYTHON_GRAMMAR_RESOURCE)) {
				Grammar grammar = loader.parse(is);

				assertThat(grammar.id()).isEqualTo("python");
				assertThat(grammar.versions()).containsExactly(GrammarVersion.PYTHON_3_7, GrammarVersion.PYTHON_3_8);
				assertThat(grammar.entryRule("MODULE").name()).isEqualTo("file_input");
				assertThat(grammar.entryRule("STATEMENT").name()).isEqualTo("statement_input");
				assertThat(grammar.entryRule("EXPRESSION").name()).isEqualTo("expression_input");
				assertThat(grammar.requireRule("stmt").collapse()).isTrue();
				assertThat(grammar.requireRule("if_stmt").collapse()).isFalse();
			}
		}

		@Test
		void keepsRuleDeclarationOrder() {
			Grammar grammar = loader.parseString("""
					grammar:
					  id: ordered
					entry_points:
					  MODULE: b
					rules:
					  b:
					    alternatives: ["a"]
					  a:
					    alternatives: ["NAME"]
					""");

			assertThat(grammar.rules().keySet()).containsExactly("b", "a");
			assertThat(grammar.versions()).isEmpty();
		}

		@Test
		void readsSinceOnAlternatives() {
			Grammar grammar = loader.parseString("""
					grammar:
					  id: gated
					  versions: ["3.7", "3.8"]
					entry_points:
					  EXPRESSION: start
					rules:
					  start:
					    alternatives:
					      - expr: "NAME ':=' NUMBER"
					        since: "3.8"
					      - "NUMBER"
					""");

			List<GrammarRule.Alternative> alternatives = grammar.requireRule("start").alternatives();
			assertThat(alternatives.get(0).since()).isEqualTo(GrammarVersion.PYTHON_3_8);
			assertThat(alternatives.get(0).isAvailableIn(GrammarVersion.PYTHON_3_7)).isFalse();
			assertThat(alternatives.get(0).notation()).isEqualTo("NAME ':=' NUMBER");
			assertThat(alternatives.get(1).since()).isNull();
			assertThat(alternatives.get(1).isAvailableIn(GrammarVersion.PYTHON_3_7)).isTrue();
		}

		@Test
		void parsesFromPath(@TempDir Path dir) throws Exception {
			Path file = dir.resolve("mini-grammar.yml");
			Files.writeString(file, MINIMAL);

			Grammar grammar = loader.parse(file);

			assertThat(grammar.id()).isEqualTo("mini");
			assertThat(grammar.supports(GrammarVersion.PYTHON_3_8)).isTrue();
			assertThat(grammar.supports(GrammarVersion.PYTHON_3_7)).isFalse();
		}

		@Test
		void parsesNotationIntoExpressions() {
			Grammar grammar = loader.parseString(MINIMAL);
			RuleExpression expression = grammar.requireRule("start").alternatives().get(0).expression();

			assertThat(expression).isEqualTo(new RuleExpression.Sequence(List.of(
					new RuleExpression.Terminal(TokenKind.NAME),
					new RuleExpression.Terminal(TokenKind.NEWLINE),
					new RuleExpression.Terminal(TokenKind.ENDMARKER))));
		}
	}

	@Nested
	@DisplayName("validation")
	class Validation {

		@Test
		void rejectsEmptyDocument() {
			assertThatThrownBy(() -> loader.parseString(""))
					.isInstanceOf(InvalidGrammarException.class)
					.hasMessageContaining("empty");
		}

		@Test
		void rejectsMissingHeader() {
			assertThatThrownBy(() -> loader.parseString("rules: {}\n"))
					.isInstanceOf(InvalidGrammarException.class)
					.hasMessageContaining("'grammar'");
		}

		@Test
		void rejectsMissingEntryPoints() {
			assertThatThrownBy(() -> loader.parseString("""
					grammar:
					  id: x
					rules:
					  a:
					    alternatives: ["NAME"]
					"""))
					.isInstanceOf(InvalidGrammarException.class)
					.hasMessageContaining("no entry points");
		}

		@Test
		void rejectsUndefinedRuleReference() {
			assertThatThrownBy(() -> loader.parseString("""
					grammar:
					  id: x
					entry_points:
					  MODULE: a
					rules:
					  a:
					    alternatives: ["b NAME"]
					"""))
					.isInstanceOf(InvalidGrammarException.class)
					.hasMessageContaining("undefined rule 'b'");
		}

		@Test
		void rejectsEntryPointToUndefinedRule() {
			assertThatThrownBy(() -> loader.parseString("""
					grammar:
					  id: x
					entry_points:
					  MODULE: missing
					rules:
					  a:
					    alternatives: ["NAME"]
					"""))
					.isInstanceOf(InvalidGrammarException.class)
					.hasMessageContaining("Entry point MODULE");
		}

		@Test
		void rejectsUnknownTokenKind() {
			assertThatThrownBy(() -> loader.parseString("""
					grammar:
					  id: x
					entry_points:
					  MODULE: a
					rules:
					  a:
					    alternatives: ["IDENT"]
					"""))
					.isInstanceOf(InvalidGrammarException.class)
					.hasMessageContaining("Unknown token kind IDENT");
		}

		@Test
		void rejectsUnsupportedVersion() {
			assertThatThrownBy(() -> loader.parseString("""
					grammar:
					  id: x
					  versions: ["2.7"]
					entry_points:
					  MODULE: a
					rules:
					  a:
					    alternatives: ["NAME"]
					"""))
					.isInstanceOf(InvalidGrammarException.class)
					.hasRootCauseInstanceOf(IllegalArgumentException.class);
		}
	}
}
