package org.javai.cst.codegen;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;
import org.javai.cst.nodes.Arg;
import org.javai.cst.nodes.Comma;
import org.javai.cst.nodes.CstNodes;
import org.javai.cst.nodes.Expr;
import org.javai.cst.nodes.Name;
import org.javai.cst.nodes.Pass;
import org.javai.cst.nodes.Semicolon;
import org.junit.jupiter.api.Test;

class CodegenStateTest {

	private final CodegenState state = new CodegenState("    ", "\n");

	@Test
	void tracksLineAndColumn() {
		state.add("ab\ncd");

		assertThat(state.position()).isEqualTo(new CodePosition(2, 2, 5));
	}

	@Test
	void carriageReturnPairCountsAsOneBreak() {
		state.add("a\r\nb\rc");

		assertThat(state.position()).isEqualTo(new CodePosition(3, 1, 6));
	}

	@Test
	void indentationStacks() {
		state.pushIndent("  ");
		state.pushIndent("\t");
		state.addIndent();
		state.popIndent();
		state.addIndent();

		assertThat(state.code()).isEqualTo("  \t  ");
	}

	@Test
	void separatedItemsGetDefaultCommas() {
		state.emitSeparated(List.of(Arg.of(Name.of("a")), Arg.of(Name.of("b")), Arg.of(Name.of("c"))));

		assertThat(state.code()).isEqualTo("a, b, c");
	}

	@Test
	void explicitCommaIsNotDoubled() {
		Arg first = CstNodes.withChanges(Arg.of(Name.of("a")), Map.of("comma", Comma.plain()));

		state.emitSeparated(List.of(first, Arg.of(Name.of("b"))));

		assertThat(state.code()).isEqualTo("a,b");
	}

	@Test
	void statementsGetDefaultSemicolons() {
		state.emitStatements(List.of(Expr.of(Name.of("a")), new Pass(Semicolon.withSpace()), Pass.of()));

		assertThat(state.code()).isEqualTo("a; pass; pass");
	}

	@Test
	void dropsOnlyTheDefaultNewline() {
		state.add("x\n");
		state.dropTrailingNewline();

		assertThat(state.code()).isEqualTo("x");
		assertThat(state.position()).isEqualTo(new CodePosition(1, 1, 1));

		CodegenState crlf = new CodegenState("    ", "\r\n");
		crlf.add("x\n");
		crlf.dropTrailingNewline();
		assertThat(crlf.code()).isEqualTo("x\n");
	}
}
