package org.javai.cst.nodes;

import java.util.Objects;
import org.javai.cst.codegen.CodegenState;

public record Comma(BaseParenthesizableWhitespace whitespaceBefore, BaseParenthesizableWhitespace whitespaceAfter)
		implements CstNode {

	public Comma {
		Objects.requireNonNull(whitespaceBefore, "whitespaceBefore must not be null");
		Objects.requireNonNull(whitespaceAfter, "whitespaceAfter must not be null");
	}

	/**
	 * A comma followed by one space.
	 */
	public static Comma withSpace() {
		return new Comma(SimpleWhitespace.EMPTY, SimpleWhitespace.SPACE);
	}

	public static Comma plain() {
		return new Comma(SimpleWhitespace.EMPTY, SimpleWhitespace.EMPTY);
	}

	@Override
	public void codegen(CodegenState state) {
		state.emit(whitespaceBefore);
		state.add(",");
		state.emit(whitespaceAfter);
	}
}
