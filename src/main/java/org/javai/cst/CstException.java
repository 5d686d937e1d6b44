package org.javai.cst;

/**
 * Base class for every failure raised while tokenizing, parsing, building or
 * reshaping a concrete syntax tree.
 */
public class CstException extends RuntimeException {

	public CstException(String message) {
		super(message);
	}

	public CstException(String message, Throwable cause) {
		super(message, cause);
	}
}
