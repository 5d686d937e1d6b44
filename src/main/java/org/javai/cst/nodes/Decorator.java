package org.javai.cst.nodes;

import java.util.List;
import java.util.Objects;
import org.javai.cst.codegen.CodegenState;

/**
 * A decorator line, {@code @expression}.
 */
public record Decorator(List<EmptyLine> leadingLines, SimpleWhitespace whitespaceAfterAt, BaseExpression decorator,
		TrailingWhitespace trailingWhitespace) implements CstNode {

	public Decorator {
		leadingLines = List.copyOf(leadingLines);
		Objects.requireNonNull(whitespaceAfterAt, "whitespaceAfterAt must not be null");
		Objects.requireNonNull(decorator, "decorator must not be null");
		Objects.requireNonNull(trailingWhitespace, "trailingWhitespace must not be null");
	}

	public static Decorator of(BaseExpression decorator) {
		return new Decorator(List.of(), SimpleWhitespace.EMPTY, decorator, TrailingWhitespace.plain());
	}

	@Override
	public void codegen(CodegenState state) {
		state.emitAll(leadingLines);
		state.addIndent();
		state.add("@");
		state.emit(whitespaceAfterAt);
		state.emit(decorator);
		state.emit(trailingWhitespace);
	}
}
