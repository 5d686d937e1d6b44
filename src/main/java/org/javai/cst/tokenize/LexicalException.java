package org.javai.cst.tokenize;

import org.javai.cst.CstSyntaxException;

/**
 * Thrown when the tokenizer meets text it cannot split into tokens: an invalid
 * character, an unterminated string literal or inconsistent indentation.
 */
public class LexicalException extends CstSyntaxException {

	public LexicalException(String message, int offset, int line, int column) {
		super(message, offset, line, column);
	}

	@Override
	public LexicalException relocate(int offset, int line, int column) {
		return new LexicalException(rawMessage(), offset, line, column);
	}

	static LexicalException at(String message, LineIndex index, int offset) {
		return new LexicalException(message, offset, index.line(offset), index.column(offset));
	}
}
