package org.javai.cst.nodes;

import java.util.Objects;
import org.javai.cst.codegen.CodegenState;

public record RightParen(BaseParenthesizableWhitespace whitespaceBefore) implements CstNode {

	public RightParen {
		Objects.requireNonNull(whitespaceBefore, "whitespaceBefore must not be null");
	}

	public static RightParen plain() {
		return new RightParen(SimpleWhitespace.EMPTY);
	}

	@Override
	public void codegen(CodegenState state) {
		state.emit(whitespaceBefore);
		state.add(")");
	}
}
