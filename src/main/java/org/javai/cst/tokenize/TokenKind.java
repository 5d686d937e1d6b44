package org.javai.cst.tokenize;

/**
 * Lexical categories produced by {@link PythonTokenizer}.
 */
public enum TokenKind {
	NAME,
	KEYWORD,
	NUMBER,
	STRING,
	OP,
	NEWLINE,
	INDENT,
	DEDENT,
	ENDMARKER;

	/**
	 * Synthetic tokens mark structure and never carry source text.
	 */
	public boolean isSynthetic() {
		return this == INDENT || this == DEDENT || this == ENDMARKER;
	}
}
