package org.javai.cst.nodes;

public sealed interface BaseDictElement extends CommaSeparated
		permits DictElement, StarredDictElement {
}
