package org.javai.cst.parser;

/**
 * What kind of snippet a parse accepts.
 */
public enum ParseMode {
	/** A complete source file. */
	MODULE,
	/** Exactly one simple statement line or one compound statement. */
	STATEMENT,
	/** A single expression (or expression list) without surrounding whitespace. */
	EXPRESSION
}
