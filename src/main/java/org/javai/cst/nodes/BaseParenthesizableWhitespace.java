package org.javai.cst.nodes;

/**
 * Whitespace that may span lines when it sits inside brackets.
 */
public sealed interface BaseParenthesizableWhitespace extends CstNode
		permits ParenthesizedWhitespace, SimpleWhitespace {

	boolean isEmpty();
}
