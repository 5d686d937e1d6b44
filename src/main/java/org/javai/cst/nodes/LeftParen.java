package org.javai.cst.nodes;

import java.util.Objects;
import org.javai.cst.codegen.CodegenState;

public record LeftParen(BaseParenthesizableWhitespace whitespaceAfter) implements CstNode {

	public LeftParen {
		Objects.requireNonNull(whitespaceAfter, "whitespaceAfter must not be null");
	}

	public static LeftParen plain() {
		return new LeftParen(SimpleWhitespace.EMPTY);
	}

	@Override
	public void codegen(CodegenState state) {
		state.add("(");
		state.emit(whitespaceAfter);
	}
}
