package org.javai.cst.nodes;

/**
 * The content of one subscript element: an {@link Index} or a {@link Slice}.
 */
public sealed interface BaseSlice extends CstNode
		permits Index, Slice {
}
