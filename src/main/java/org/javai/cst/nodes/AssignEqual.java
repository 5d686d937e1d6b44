package org.javai.cst.nodes;

import java.util.Objects;
import org.javai.cst.codegen.CodegenState;

/**
 * The {@code =} of a keyword argument, a parameter default or an annotated
 * assignment.
 */
public record AssignEqual(BaseParenthesizableWhitespace whitespaceBefore, BaseParenthesizableWhitespace whitespaceAfter)
		implements CstNode {

	public AssignEqual {
		Objects.requireNonNull(whitespaceBefore, "whitespaceBefore must not be null");
		Objects.requireNonNull(whitespaceAfter, "whitespaceAfter must not be null");
	}

	/**
	 * {@code =} without spaces, as in keyword arguments.
	 */
	public static AssignEqual plain() {
		return new AssignEqual(SimpleWhitespace.EMPTY, SimpleWhitespace.EMPTY);
	}

	/**
	 * {@code " = "}, as in annotated assignments.
	 */
	public static AssignEqual spaced() {
		return new AssignEqual(SimpleWhitespace.SPACE, SimpleWhitespace.SPACE);
	}

	@Override
	public void codegen(CodegenState state) {
		state.emit(whitespaceBefore);
		state.add("=");
		state.emit(whitespaceAfter);
	}
}
