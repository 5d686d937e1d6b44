package org.javai.cst.nodes;

import java.util.Objects;
import org.javai.cst.codegen.CodegenState;

public record LeftCurlyBrace(BaseParenthesizableWhitespace whitespaceAfter) implements CstNode {

	public LeftCurlyBrace {
		Objects.requireNonNull(whitespaceAfter, "whitespaceAfter must not be null");
	}

	public static LeftCurlyBrace plain() {
		return new LeftCurlyBrace(SimpleWhitespace.EMPTY);
	}

	@Override
	public void codegen(CodegenState state) {
		state.add("{");
		state.emit(whitespaceAfter);
	}
}
