package org.javai.cst.nodes;

import java.util.Objects;
import org.javai.cst.codegen.CodegenState;

public record RightCurlyBrace(BaseParenthesizableWhitespace whitespaceBefore) implements CstNode {

	public RightCurlyBrace {
		Objects.requireNonNull(whitespaceBefore, "whitespaceBefore must not be null");
	}

	public static RightCurlyBrace plain() {
		return new RightCurlyBrace(SimpleWhitespace.EMPTY);
	}

	@Override
	public void codegen(CodegenState state) {
		state.emit(whitespaceBefore);
		state.add("}");
	}
}
