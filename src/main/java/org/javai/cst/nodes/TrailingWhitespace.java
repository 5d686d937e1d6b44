package org.javai.cst.nodes;

import java.util.Objects;
import org.javai.cst.codegen.CodegenState;

/**
 * The end of a line: whitespace, an optional comment and the line break.
 */
public record TrailingWhitespace(SimpleWhitespace whitespace, @OptionalChild Comment comment, Newline newline)
		implements CstNode {

	public TrailingWhitespace {
		Objects.requireNonNull(whitespace, "whitespace must not be null");
		Objects.requireNonNull(newline, "newline must not be null");
	}

	public static TrailingWhitespace plain() {
		return new TrailingWhitespace(SimpleWhitespace.EMPTY, null, Newline.DEFAULT);
	}

	@Override
	public void codegen(CodegenState state) {
		state.emit(whitespace);
		state.emitOptional(comment);
		state.emit(newline);
	}
}
