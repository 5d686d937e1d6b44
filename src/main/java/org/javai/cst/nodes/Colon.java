package org.javai.cst.nodes;

import java.util.Objects;
import org.javai.cst.codegen.CodegenState;

public record Colon(BaseParenthesizableWhitespace whitespaceBefore, BaseParenthesizableWhitespace whitespaceAfter)
		implements CstNode {

	public Colon {
		Objects.requireNonNull(whitespaceBefore, "whitespaceBefore must not be null");
		Objects.requireNonNull(whitespaceAfter, "whitespaceAfter must not be null");
	}

	public static Colon plain() {
		return new Colon(SimpleWhitespace.EMPTY, SimpleWhitespace.EMPTY);
	}

	@Override
	public void codegen(CodegenState state) {
		state.emit(whitespaceBefore);
		state.add(":");
		state.emit(whitespaceAfter);
	}
}
