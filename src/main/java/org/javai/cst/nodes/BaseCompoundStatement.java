package org.javai.cst.nodes;

/**
 * A statement with a header ending in a colon and a suite.
 */
public sealed interface BaseCompoundStatement extends BaseStatement
		permits ClassDef, For, FunctionDef, If, Try, While, With {

	BaseSuite body();
}
