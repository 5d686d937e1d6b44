package org.javai.cst.parser;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.javai.cst.grammar.GrammarVersion;
import org.javai.cst.nodes.Assign;
import org.javai.cst.nodes.BinaryOperation;
import org.javai.cst.nodes.ClassDef;
import org.javai.cst.nodes.Comment;
import org.javai.cst.nodes.EmptyLine;
import org.javai.cst.nodes.FunctionDef;
import org.javai.cst.nodes.If;
import org.javai.cst.nodes.ImportFrom;
import org.javai.cst.nodes.IndentedBlock;
import org.javai.cst.nodes.Module;
import org.javai.cst.nodes.Name;
import org.javai.cst.nodes.Newline;
import org.javai.cst.nodes.ParenthesizedWhitespace;
import org.javai.cst.nodes.SimpleStatementLine;
import org.javai.cst.nodes.SimpleWhitespace;
import org.javai.cst.tokenize.PythonTokenizer;
import org.javai.cst.tokenize.Token;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("CstBuilder")
class CstBuilderTest {

	private static Module module(String source) {
		return CstParser.parseModule(source);
	}

	private static <T> T first(Module module, Class<T> type) {
		return type.cast(module.body().get(0));
	}

	private static Assign firstAssign(Module module) {
		return (Assign) first(module, SimpleStatementLine.class).body().get(0);
	}

	@Nested
	@DisplayName("comments and blank lines")
	class Lines {

		@Test
		void headerHoldsLinesBeforeTheFirstStatement() {
			Module module = module("# one\n\nx = 1\n");

			assertThat(module.header()).hasSize(2);
			assertThat(module.header().get(0).comment()).isEqualTo(new Comment("# one"));
			assertThat(module.header().get(1).comment()).isNull();
			assertThat(first(module, SimpleStatementLine.class).leadingLines()).isEmpty();
		}

		@Test
		void linesBetweenStatementsLeadTheNextOne() {
			Module module = module("x = 1\n\n# two\ny = 2\n");

			assertThat(((SimpleStatementLine) module.body().get(1)).leadingLines()).extracting(EmptyLine::comment)
					.containsExactly(null, new Comment("# two"));
		}

		@Test
		void moduleWithoutStatementsKeepsItsLinesInTheHeader() {
			Module module = module("# only\n\n");

			assertThat(module.body()).isEmpty();
			assertThat(module.header()).hasSize(2);
			assertThat(module.footer()).isEmpty();
		}

		@Test
		void linesAfterTheLastStatementAreTheFooter() {
			Module module = module("x = 1\n\n# end\n");

			assertThat(module.footer()).extracting(EmptyLine::comment)
					.containsExactly(null, new Comment("# end"));
		}

		@Test
		void trailingCommentStaysOnItsLine() {
			SimpleStatementLine line = first(module("x = 1  # set x\n"), SimpleStatementLine.class);

			assertThat(line.trailingWhitespace().whitespace()).isEqualTo(SimpleWhitespace.of("  "));
			assertThat(line.trailingWhitespace().comment()).isEqualTo(new Comment("# set x"));
		}

		@Test
		void blankLineInsideABlockIsNotIndented() {
			FunctionDef function = first(module("def f():\n\n    # leading\n    return 1\n"), FunctionDef.class);
			SimpleStatementLine ret = (SimpleStatementLine) ((IndentedBlock) function.body()).body().get(0);

			assertThat(ret.leadingLines()).hasSize(2);
			assertThat(ret.leadingLines().get(0).indent()).isFalse();
			assertThat(ret.leadingLines().get(1).indent()).isTrue();
			assertThat(ret.leadingLines().get(1).comment()).isEqualTo(new Comment("# leading"));
		}
	}

	@Nested
	@DisplayName("block footers")
	class Footers {

		@Test
		void indentedCommentAfterABlockBelongsToTheBlock() {
			Module module = module("if x:\n    pass\n    # footer comment\n# module comment\ny = 2\n");
			IndentedBlock block = (IndentedBlock) first(module, If.class).body();

			assertThat(block.footer()).singleElement().satisfies(line -> {
				assertThat(line.indent()).isTrue();
				assertThat(line.comment()).isEqualTo(new Comment("# footer comment"));
			});
			SimpleStatementLine next = (SimpleStatementLine) module.body().get(1);
			assertThat(next.leadingLines()).extracting(EmptyLine::comment).containsExactly(new Comment("# module comment"));
		}

		@Test
		void blankLinesAfterTheLastIndentedCommentGoToTheNextStatement() {
			Module module = module("if x:\n    pass\n    # one\n\n# two\ny = 2\n");
			IndentedBlock block = (IndentedBlock) first(module, If.class).body();

			assertThat(block.footer()).hasSize(1);
			assertThat(((SimpleStatementLine) module.body().get(1)).leadingLines()).hasSize(2);
		}

		@Test
		void blankLinesInsideTheFooterAreKept() {
			Module module = module("if x:\n    pass\n    # one\n\n    # two\ny = 2\n");
			IndentedBlock block = (IndentedBlock) first(module, If.class).body();

			assertThat(block.footer()).hasSize(3);
			assertThat(block.footer().get(1).comment()).isNull();
		}

		@Test
		void shallowCommentEndsTheNestedBlock() {
			String source = "def f():\n    if x:\n        pass\n    # in f\n";
			FunctionDef function = first(module(source), FunctionDef.class);
			IndentedBlock outer = (IndentedBlock) function.body();
			IndentedBlock inner = (IndentedBlock) ((If) outer.body().get(0)).body();

			assertThat(inner.footer()).isEmpty();
			assertThat(outer.footer()).extracting(EmptyLine::comment).containsExactly(new Comment("# in f"));
		}
	}

	@Nested
	@DisplayName("whitespace")
	class Whitespace {

		@Test
		void operatorSpacingIsKept() {
			BinaryOperation sum = (BinaryOperation) firstAssign(module("x =  1+1\n")).value();

			assertThat(sum.operator().whitespaceBefore()).isEqualTo(SimpleWhitespace.EMPTY);
			assertThat(sum.operator().whitespaceAfter()).isEqualTo(SimpleWhitespace.EMPTY);
			assertThat(firstAssign(module("x =  1+1\n")).targets().get(0).whitespaceAfterEqual())
					.isEqualTo(SimpleWhitespace.of("  "));
		}

		@Test
		void lineBreakAfterAnOpeningParenthesis() {
			Assign assign = firstAssign(module("x = (  # comment\n    1 +\n    2\n)\n"));
			BinaryOperation sum = (BinaryOperation) assign.value();

			assertThat(sum.lpar()).hasSize(1);
			assertThat(sum.lpar().get(0).whitespaceAfter()).isInstanceOfSatisfying(ParenthesizedWhitespace.class, ws -> {
				assertThat(ws.firstLine().whitespace()).isEqualTo(SimpleWhitespace.of("  "));
				assertThat(ws.firstLine().comment()).isEqualTo(new Comment("# comment"));
				assertThat(ws.emptyLines()).isEmpty();
				assertThat(ws.lastLine()).isEqualTo(SimpleWhitespace.of("    "));
			});
			assertThat(sum.operator().whitespaceAfter()).isInstanceOf(ParenthesizedWhitespace.class);
		}

		@Test
		void callSpanningLinesRoundTrips() {
			String source = "call(\n    a,\n    # note\n    b,\n)\n";

			assertThat(module(source).code()).isEqualTo(source);
			assertThat(module(source).body()).hasSize(1);
		}
	}

	@Nested
	@DisplayName("newlines and indentation")
	class Layout {

		@Test
		void newlineMatchingTheModuleDefaultIsShared() {
			Module module = module("if x:\r\n    y = 1\r\n");

			assertThat(module.defaultNewline()).isEqualTo("\r\n");
			assertThat(((IndentedBlock) first(module, If.class).body()).header().newline()).isSameAs(Newline.DEFAULT);
		}

		@Test
		void differingNewlineIsExplicit() {
			Module module = module("x = 1\r\ny = 2\n");
			SimpleStatementLine second = (SimpleStatementLine) module.body().get(1);

			assertThat(second.trailingWhitespace().newline()).isEqualTo(new Newline("\n"));
			assertThat(module.code()).isEqualTo("x = 1\r\ny = 2\n");
		}

		@Test
		void blocksAtTheDefaultIndentLeaveItImplicit() {
			Module module = module("class C:\n  def f(self):\n      pass\n");
			IndentedBlock classBody = (IndentedBlock) first(module, ClassDef.class).body();
			IndentedBlock methodBody = (IndentedBlock) ((FunctionDef) classBody.body().get(0)).body();

			assertThat(module.defaultIndent()).isEqualTo("  ");
			assertThat(classBody.indent()).isNull();
			assertThat(methodBody.indent()).isEqualTo("    ");
		}
	}

	@Nested
	@DisplayName("imports")
	class Imports {

		private ImportFrom importFrom(String source) {
			return (ImportFrom) first(module(source), SimpleStatementLine.class).body().get(0);
		}

		@Test
		void relativeDots() {
			ImportFrom node = importFrom("from ..pkg import x\n");

			assertThat(node.relative()).hasSize(2);
			assertThat(node.module()).isEqualTo(Name.of("pkg"));
		}

		@Test
		void ellipsisTokenCountsAsThreeDots() {
			ImportFrom node = importFrom("from ... import x\n");

			assertThat(node.relative()).hasSize(3);
			assertThat(node.module()).isNull();
		}

		@Test
		void parenthesizedNames() {
			ImportFrom node = importFrom("from m import (a,\n    b)\n");

			assertThat(node.lpar()).isNotNull();
			assertThat(node.names()).hasSize(2);
		}
	}

	@Test
	void buildsFromTokensAndATree() {
		List<Token> tokens = PythonTokenizer.tokenize("x = 1\r\n", GrammarVersion.PYTHON_3_8);
		ParseTree tree = ParserBackend.COMPILED.newStrategy().parse(tokens, GrammarVersion.PYTHON_3_8, ParseMode.MODULE);

		Module module = (Module) CstBuilder.build(tree, tokens, ParseMode.MODULE);

		assertThat(module.defaultNewline()).isEqualTo("\r\n");
		assertThat(module.code()).isEqualTo("x = 1\r\n");
	}

	@Test
	void splitsLinesKeepingTheirEndings() {
		assertThat(CstBuilder.splitLines("a\nb\r\nc\rd")).containsExactly("a\n", "b\r\n", "c\r", "d");
		assertThat(CstBuilder.splitLines("")).containsExactly("");
	}
}
