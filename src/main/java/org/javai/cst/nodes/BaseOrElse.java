package org.javai.cst.nodes;

/**
 * What may follow the body of an {@code if}: an {@link Elif} or an {@link Else}.
 */
public sealed interface BaseOrElse extends CstNode
		permits Elif, Else {
}
