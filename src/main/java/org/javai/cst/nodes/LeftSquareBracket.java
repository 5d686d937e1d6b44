package org.javai.cst.nodes;

import java.util.Objects;
import org.javai.cst.codegen.CodegenState;

public record LeftSquareBracket(BaseParenthesizableWhitespace whitespaceAfter) implements CstNode {

	public LeftSquareBracket {
		Objects.requireNonNull(whitespaceAfter, "whitespaceAfter must not be null");
	}

	public static LeftSquareBracket plain() {
		return new LeftSquareBracket(SimpleWhitespace.EMPTY);
	}

	@Override
	public void codegen(CodegenState state) {
		state.add("[");
		state.emit(whitespaceAfter);
	}
}
