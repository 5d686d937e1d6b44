package org.javai.cst.nodes;

/**
 * A statement that may share a line with others, separated by semicolons.
 */
public sealed interface BaseSmallStatement extends CstNode
		permits AnnAssign, Assert, Assign, AugAssign, Break, Continue, Del, Expr, Global, Import,
		ImportFrom, Nonlocal, Pass, Raise, Return {

	Semicolon semicolon();
}
