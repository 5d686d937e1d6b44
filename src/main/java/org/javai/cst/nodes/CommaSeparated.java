package org.javai.cst.nodes;

/**
 * An item of a comma separated list. When an item that is not last has no
 * comma, the enclosing list renders a default {@code ", "} after it.
 */
public sealed interface CommaSeparated extends CstNode
		permits Arg, BaseDictElement, BaseElement, BaseStarArg, ImportAlias, NameItem, ParamSlash,
		SubscriptElement, WithItem {

	Comma comma();
}
