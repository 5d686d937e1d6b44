package org.javai.cst.nodes;

/**
 * What may follow {@code yield}: an expression or a {@link From} clause.
 */
public sealed interface BaseYieldValue extends CstNode
		permits BaseExpression, From {
}
