package org.javai.cst.nodes;

import java.util.Objects;
import org.javai.cst.codegen.CodegenState;

/**
 * The dot of an attribute access, or one dot of a relative import.
 */
public record Dot(BaseParenthesizableWhitespace whitespaceBefore, BaseParenthesizableWhitespace whitespaceAfter)
		implements CstNode {

	public Dot {
		Objects.requireNonNull(whitespaceBefore, "whitespaceBefore must not be null");
		Objects.requireNonNull(whitespaceAfter, "whitespaceAfter must not be null");
	}

	public static Dot plain() {
		return new Dot(SimpleWhitespace.EMPTY, SimpleWhitespace.EMPTY);
	}

	@Override
	public void codegen(CodegenState state) {
		state.emit(whitespaceBefore);
		state.add(".");
		state.emit(whitespaceAfter);
	}
}
