package org.javai.cst.nodes;

import org.javai.cst.CstException;

/**
 * Thrown when a node would be built with a value that does not fit a slot: an
 * unknown slot name, a value of the wrong type, a sequence where a single child
 * is expected (or the reverse), or the removal of a required child.
 */
public class ShapeException extends CstException {

	public ShapeException(String message) {
		super(message);
	}

	public ShapeException(String message, Throwable cause) {
		super(message, cause);
	}
}
