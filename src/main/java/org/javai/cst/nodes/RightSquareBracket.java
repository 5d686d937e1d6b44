package org.javai.cst.nodes;

import java.util.Objects;
import org.javai.cst.codegen.CodegenState;

public record RightSquareBracket(BaseParenthesizableWhitespace whitespaceBefore) implements CstNode {

	public RightSquareBracket {
		Objects.requireNonNull(whitespaceBefore, "whitespaceBefore must not be null");
	}

	public static RightSquareBracket plain() {
		return new RightSquareBracket(SimpleWhitespace.EMPTY);
	}

	@Override
	public void codegen(CodegenState state) {
		state.emit(whitespaceBefore);
		state.add("]");
	}
}
