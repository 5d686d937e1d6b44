package org.javai.cst.grammar;

import org.javai.cst.CstException;

/**
 * Thrown when a grammar resource is malformed: bad rule notation, a reference
 * to an undefined rule, or a missing entry point.
 */
public class InvalidGrammarException extends CstException {

	public InvalidGrammarException(String message) {
		super(message);
	}

	public InvalidGrammarException(String message, Throwable cause) {
		super(message, cause);
	}
}
