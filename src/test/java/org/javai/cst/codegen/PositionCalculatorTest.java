package org.javai.cst.codegen;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import org.javai.cst.nodes.Assign;
import org.javai.cst.nodes.CstNode;
import org.javai.cst.nodes.FunctionDef;
import org.javai.cst.nodes.IndentedBlock;
import org.javai.cst.nodes.Module;
import org.javai.cst.nodes.Newline;
import org.javai.cst.nodes.SimpleStatementLine;
import org.javai.cst.parser.CstParser;
import org.junit.jupiter.api.Test;

class PositionCalculatorTest {

	private static Assign assign(Module module, int index) {
		return (Assign) ((SimpleStatementLine) module.body().get(index)).body().get(0);
	}

	@Test
	void nodesMapToTheTextTheyRender() {
		Module module = CstParser.parseModule("x = 1\ny = 22\n");
		Map<CstNode, CodeRange> positions = PositionCalculator.compute(module);
		Assign second = assign(module, 1);

		CodeRange target = positions.get(second.targets().get(0).target());
		assertThat(target.start()).isEqualTo(new CodePosition(2, 0, 6));
		assertThat(target.length()).isEqualTo(1);

		CodeRange value = positions.get(second.value());
		assertThat(value.start()).isEqualTo(new CodePosition(2, 4, 10));
		assertThat(value.end()).isEqualTo(new CodePosition(2, 6, 12));
	}

	@Test
	void statementRangeIncludesItsLineBreak() {
		Module module = CstParser.parseModule("x = 1\ny = 22\n");
		CodeRange line = PositionCalculator.compute(module).get(module.body().get(1));

		assertThat(line.start()).isEqualTo(new CodePosition(2, 0, 6));
		assertThat(line.end()).isEqualTo(new CodePosition(3, 0, 13));
		assertThat(line.contains(new CodePosition(2, 3, 9))).isTrue();
		assertThat(line.contains(line.end())).isFalse();
	}

	@Test
	void moduleCoversTheWholeSource() {
		String source = "# head\n\ndef f():\n    return 1\n";
		Module module = CstParser.parseModule(source);

		assertThat(PositionCalculator.compute(module).get(module).length()).isEqualTo(source.length());
	}

	@Test
	void nestedBlocksCountTheirIndentation() {
		Module module = CstParser.parseModule("def f():\n    return 1\n");
		FunctionDef function = (FunctionDef) module.body().get(0);
		SimpleStatementLine ret = (SimpleStatementLine) ((IndentedBlock) function.body()).body().get(0);

		CodeRange range = PositionCalculator.compute(module).get(ret.body().get(0));

		assertThat(range.start()).isEqualTo(new CodePosition(2, 4, 13));
		assertThat(range.length()).isEqualTo("return 1".length());
	}

	@Test
	void sharedConstantsMapToTheirLastUse() {
		Module module = CstParser.parseModule("x = 1\ny = 2\n");

		CodeRange newline = PositionCalculator.compute(module).get(Newline.DEFAULT);

		assertThat(newline.start()).isEqualTo(new CodePosition(2, 5, 11));
		assertThat(newline.end()).isEqualTo(new CodePosition(3, 0, 12));
	}
}
