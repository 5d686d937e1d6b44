package org.javai.cst.nodes;

import java.util.Objects;
import org.javai.cst.codegen.CodegenState;

public record Semicolon(SimpleWhitespace whitespaceBefore, SimpleWhitespace whitespaceAfter) implements CstNode {

	public Semicolon {
		Objects.requireNonNull(whitespaceBefore, "whitespaceBefore must not be null");
		Objects.requireNonNull(whitespaceAfter, "whitespaceAfter must not be null");
	}

	public static Semicolon withSpace() {
		return new Semicolon(SimpleWhitespace.EMPTY, SimpleWhitespace.SPACE);
	}

	@Override
	public void codegen(CodegenState state) {
		state.emit(whitespaceBefore);
		state.add(";");
		state.emit(whitespaceAfter);
	}
}
