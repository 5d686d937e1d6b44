package org.javai.cst.nodes;

import java.util.List;

/**
 * A statement that occupies whole lines: a simple statement line or a compound
 * statement.
 */
public sealed interface BaseStatement extends CstNode
		permits BaseCompoundStatement, SimpleStatementLine {

	/**
	 * Blank and comment lines that precede the statement.
	 */
	List<EmptyLine> leadingLines();
}
