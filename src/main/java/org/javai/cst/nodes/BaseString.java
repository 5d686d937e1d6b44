package org.javai.cst.nodes;

public sealed interface BaseString extends BaseExpression
		permits ConcatenatedString, SimpleString {
}
