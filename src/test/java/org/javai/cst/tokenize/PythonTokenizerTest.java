package org.javai.cst.tokenize;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.javai.cst.grammar.GrammarVersion;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("PythonTokenizer")
class PythonTokenizerTest {

	private static List<Token> tokens(String source) {
		return PythonTokenizer.tokenize(source, GrammarVersion.PYTHON_3_8);
	}

	private static List<TokenKind> kinds(String source) {
		return tokens(source).stream().map(Token::kind).toList();
	}

	private static String reassemble(List<Token> tokens) {
		StringBuilder sb = new StringBuilder();
		for (Token token : tokens) {
			sb.append(token.leadingTrivia()).append(token.text()).append(token.trailingTrivia());
		}
		return sb.toString();
	}

	@Nested
	@DisplayName("token kinds")
	class Kinds {

		@Test
		void simpleAssignment() {
			List<Token> tokens = tokens("x = 1\n");
			assertThat(tokens).extracting(Token::kind).containsExactly(
					TokenKind.NAME, TokenKind.OP, TokenKind.NUMBER, TokenKind.NEWLINE, TokenKind.ENDMARKER);
			assertThat(tokens.get(0).trailingTrivia()).isEqualTo(" ");
			assertThat(tokens.get(3).text()).isEqualTo("\n");
		}

		@Test
		void keywordsAreDistinguishedFromNames() {
			List<Token> tokens = tokens("if True: pass\n");
			assertThat(tokens.get(0).kind()).isEqualTo(TokenKind.KEYWORD);
			assertThat(tokens.get(1).kind()).isEqualTo(TokenKind.KEYWORD);
			assertThat(tokens.get(3).kind()).isEqualTo(TokenKind.KEYWORD);
			assertThat(tokens("iffy\n").get(0).kind()).isEqualTo(TokenKind.NAME);
		}

		@Test
		void blocksProduceIndentAndDedent() {
			assertThat(kinds("if x:\n    pass\ny\n")).containsExactly(
					TokenKind.KEYWORD, TokenKind.NAME, TokenKind.OP, TokenKind.NEWLINE,
					TokenKind.INDENT, TokenKind.KEYWORD, TokenKind.NEWLINE,
					TokenKind.DEDENT, TokenKind.NAME, TokenKind.NEWLINE, TokenKind.ENDMARKER);
		}

		@Test
		void openBlocksAreClosedAtEndOfInput() {
			assertThat(kinds("if x:\n    if y:\n        pass\n")).endsWith(
					TokenKind.NEWLINE, TokenKind.DEDENT, TokenKind.DEDENT, TokenKind.ENDMARKER);
		}

		@Test
		void missingFinalNewlineIsSynthesized() {
			List<Token> tokens = tokens("x");
			assertThat(tokens).extracting(Token::kind)
					.containsExactly(TokenKind.NAME, TokenKind.NEWLINE, TokenKind.ENDMARKER);
			assertThat(tokens.get(1).text()).isEmpty();
		}

		@ParameterizedTest
		@ValueSource(strings = { "0", "1_000", "0x1F", "0o17", "0b101", "1.5", ".5", "1e10", "2.5E-3", "3j", "1.0J" })
		void numbers(String literal) {
			List<Token> tokens = tokens(literal + "\n");
			assertThat(tokens.get(0).kind()).isEqualTo(TokenKind.NUMBER);
			assertThat(tokens.get(0).text()).isEqualTo(literal);
		}

		@Test
		void numberMayRunIntoAKeyword() {
			List<Token> tokens = tokens("x = 1if y else 2\n");

			assertThat(tokens).extracting(Token::text).startsWith("x", "=", "1", "if", "y", "else", "2");
			assertThat(tokens.get(2).kind()).isEqualTo(TokenKind.NUMBER);
			assertThat(tokens.get(3).kind()).isEqualTo(TokenKind.KEYWORD);
			assertThat(tokens("0x1for\n")).extracting(Token::text).startsWith("0x1f", "or");
		}

		@Test
		void numberRunningIntoANameIsRejected() {
			assertThatThrownBy(() -> tokens("x = 1abc\n"))
					.isInstanceOf(LexicalException.class)
					.hasMessageContaining("invalid number literal");
		}

		@ParameterizedTest
		@ValueSource(strings = { "'a'", "\"b\"", "r'\\d'", "b'x'", "f'{y}'", "'''multi\nline'''", "'esc\\'aped'" })
		void strings(String literal) {
			List<Token> tokens = tokens(literal + "\n");
			assertThat(tokens.get(0).kind()).isEqualTo(TokenKind.STRING);
			assertThat(tokens.get(0).text()).isEqualTo(literal);
		}

		@Test
		void longestOperatorWins() {
			assertThat(tokens("a **= b\n").get(1).text()).isEqualTo("**=");
			assertThat(tokens("a // b\n").get(1).text()).isEqualTo("//");
			assertThat(tokens("x[...]\n").get(2).text()).isEqualTo("...");
		}

		@Test
		void walrusOnlyExistsFrom38() {
			assertThat(tokens("(y := 1)\n").get(2).text()).isEqualTo(":=");
			List<Token> old = PythonTokenizer.tokenize("(y := 1)\n", GrammarVersion.PYTHON_3_7);
			assertThat(old.get(2).text()).isEqualTo(":");
			assertThat(old.get(3).text()).isEqualTo("=");
		}
	}

	@Nested
	@DisplayName("trivia")
	class Trivia {

		@Test
		void commentLinesLeadTheNextToken() {
			List<Token> tokens = tokens("# header\n\nx = 1  # note\n");
			assertThat(tokens.get(0).leadingTrivia()).isEqualTo("# header\n\n");
			assertThat(tokens.get(2).trailingTrivia()).isEqualTo("  # note");
		}

		@Test
		void indentationBelongsToTheFirstTokenOfTheLine() {
			List<Token> tokens = tokens("if x:\n\n    # c\n    pass\n");
			Token pass = tokens.stream().filter(t -> t.is("pass")).findFirst().orElseThrow();
			assertThat(pass.leadingTrivia()).isEqualTo("\n    # c\n    ");
		}

		@Test
		void syntheticTokensCarryNoTrivia() {
			for (Token token : tokens("if x:\n    pass\n# end\n")) {
				if (token.kind() == TokenKind.INDENT || token.kind() == TokenKind.DEDENT) {
					assertThat(token.text()).isEmpty();
					assertThat(token.leadingTrivia()).isEmpty();
					assertThat(token.trailingTrivia()).isEmpty();
				}
			}
		}

		@Test
		void trailingLinesGoToTheEndMarker() {
			List<Token> tokens = tokens("x\n\n# bye\n");
			assertThat(tokens.get(tokens.size() - 1).leadingTrivia()).isEqualTo("\n# bye\n");
		}

		@Test
		void lineBreaksInsideBracketsAreTrivia() {
			List<Token> tokens = tokens("f(a,  # first\n\n  b)\n");
			assertThat(tokens).extracting(Token::kind).doesNotContain(TokenKind.INDENT);
			assertThat(tokens).filteredOn(t -> t.kind() == TokenKind.NEWLINE).hasSize(1);
			assertThat(tokens.get(3).trailingTrivia()).isEqualTo("  # first");
			assertThat(tokens.get(4).leadingTrivia()).isEqualTo("\n\n  ");
		}

		@Test
		void backslashContinuationIsTrailingTrivia() {
			List<Token> tokens = tokens("x = 1 + \\\n    2\n");
			assertThat(tokens.get(3).trailingTrivia()).isEqualTo(" \\\n    ");
			assertThat(tokens).filteredOn(t -> t.kind() == TokenKind.NEWLINE).hasSize(1);
		}

		@Test
		void carriageReturnNewlinesAreKept() {
			List<Token> tokens = tokens("x = 1\r\ny = 2\r\n");
			assertThat(tokens.get(3).text()).isEqualTo("\r\n");
		}

		@ParameterizedTest
		@ValueSource(strings = {
				"",
				"\n\n",
				"x = 1\n",
				"x = 1",
				"def f(a, b=2):\n    return a  # done\n\n\n# tail\n",
				"class C:\n\tdef m(self):\n\t\tpass\n",
				"d = {\n    'a': 1,\n    # skip\n    'b': 2,\n}\n",
				"if x:\n    pass\n   \n",
				"s = '''one\ntwo'''\r\n",
		})
		void tokensReassembleTheInput(String source) {
			assertThat(reassemble(tokens(source))).isEqualTo(source);
		}
	}

	@Nested
	@DisplayName("errors")
	class Errors {

		@Test
		void unterminatedString() {
			assertThatThrownBy(() -> tokens("x = 'abc\n"))
					.isInstanceOf(LexicalException.class)
					.hasMessageContaining("unterminated string literal")
					.extracting(e -> ((LexicalException) e).column())
					.isEqualTo(4);
		}

		@Test
		void unterminatedTripleQuotedString() {
			assertThatThrownBy(() -> tokens("x = '''abc\n"))
					.isInstanceOf(LexicalException.class)
					.hasMessageContaining("triple-quoted");
		}

		@Test
		void invalidCharacter() {
			assertThatThrownBy(() -> tokens("x = 1\ny = $\n"))
					.isInstanceOf(LexicalException.class)
					.satisfies(e -> {
						LexicalException ex = (LexicalException) e;
						assertThat(ex.rawMessage()).isEqualTo("invalid character '$'");
						assertThat(ex.line()).isEqualTo(2);
						assertThat(ex.column()).isEqualTo(4);
						assertThat(ex.offset()).isEqualTo(10);
					});
		}

		@Test
		void strayBackslash() {
			assertThatThrownBy(() -> tokens("x = \\ 1\n"))
					.isInstanceOf(LexicalException.class)
					.hasMessageContaining("line continuation");
		}

		@Test
		void dedentToUnknownLevel() {
			assertThatThrownBy(() -> tokens("if x:\n    a\n  b\n"))
					.isInstanceOf(LexicalException.class)
					.hasMessageContaining("unindent does not match");
		}

		@Test
		void inconsistentTabsAndSpaces() {
			assertThatThrownBy(() -> tokens("if x:\n    a\n\tb\n"))
					.isInstanceOf(LexicalException.class)
					.hasMessageContaining("inconsistent indentation");
		}
	}
}
