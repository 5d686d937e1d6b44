package org.javai.cst.nodes;

import java.util.List;

/**
 * The body of a compound statement: an indented block or statements on the
 * header line.
 */
public sealed interface BaseSuite extends CstNode
		permits IndentedBlock, SimpleStatementSuite {

	List<? extends CstNode> body();
}
