package org.javai.cst.helpers;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import org.javai.cst.nodes.Comment;
import org.javai.cst.nodes.Module;
import org.javai.cst.parser.CstParser;
import org.junit.jupiter.api.Test;

class CommentCollectorTest {

	private static final String SOURCE = """
			# noqa: header
			import os

			x = 1  # noqa: E1
			def f():
			    # type: ignore
			    return x  # unrelated
			""";

	@Test
	void ownLineCommentsApplyToTheNextLine() {
		Map<Integer, Comment> comments = CommentCollector.collect(CstParser.parseModule(SOURCE), "# noqa");

		assertThat(comments).containsOnlyKeys(2, 4);
		assertThat(comments.get(2).value()).isEqualTo("# noqa: header");
		assertThat(comments.get(4).value()).isEqualTo("# noqa: E1");
	}

	@Test
	void commentsInsideBlocksAreFound() {
		Map<Integer, Comment> comments = CommentCollector.collect(CstParser.parseModule(SOURCE), "# type:");

		assertThat(comments).containsOnlyKeys(7);
	}

	@Test
	void patternMustMatchTheStart() {
		Module module = CstParser.parseModule("x = 1  # see noqa\n");

		assertThat(CommentCollector.collect(module, "# noqa")).isEmpty();
		assertThat(CommentCollector.collect(module, "# see")).containsOnlyKeys(1);
	}

	@Test
	void commentsInsideBracketsAreIncluded() {
		Module module = CstParser.parseModule("call(\n    a,  # noqa: arg\n)\n");

		assertThat(CommentCollector.collect(module, "# noqa")).containsOnlyKeys(2);
	}
}
