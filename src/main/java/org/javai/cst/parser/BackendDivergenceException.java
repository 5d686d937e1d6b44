package org.javai.cst.parser;

import org.javai.cst.CstException;

/**
 * Raised when the parsing backends disagree about an input: one accepts what
 * the other rejects, they reject it with different exception classes, or they
 * build different parse trees.
 */
public class BackendDivergenceException extends CstException {

	private final ParseMode mode;
	private final String interpretedOutcome;
	private final String compiledOutcome;

	public BackendDivergenceException(String message, ParseMode mode, String interpretedOutcome,
			String compiledOutcome) {
		super(message + " (" + mode + ")\ninterpreted: " + interpretedOutcome + "\ncompiled: " + compiledOutcome);
		this.mode = mode;
		this.interpretedOutcome = interpretedOutcome;
		this.compiledOutcome = compiledOutcome;
	}

	public ParseMode mode() {
		return mode;
	}

	/**
	 * The interpreted backend's tree as JSON, or its error message.
	 */
	public String interpretedOutcome() {
		return interpretedOutcome;
	}

	public String compiledOutcome() {
		return compiledOutcome;
	}
}
