package org.javai.cst.nodes;

/**
 * An element of a tuple, list or set display.
 */
public sealed interface BaseElement extends CommaSeparated
		permits Element, StarredElement {

	BaseExpression value();
}
