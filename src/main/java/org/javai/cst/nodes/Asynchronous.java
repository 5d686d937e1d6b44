package org.javai.cst.nodes;

import java.util.Objects;
import org.javai.cst.codegen.CodegenState;

/**
 * The {@code async} keyword of a function, loop, context manager or
 * comprehension.
 */
public record Asynchronous(BaseParenthesizableWhitespace whitespaceAfter) implements CstNode {

	public Asynchronous {
		Objects.requireNonNull(whitespaceAfter, "whitespaceAfter must not be null");
	}

	public static Asynchronous of() {
		return new Asynchronous(SimpleWhitespace.SPACE);
	}

	@Override
	public void codegen(CodegenState state) {
		state.add("async");
		state.emit(whitespaceAfter);
	}
}
