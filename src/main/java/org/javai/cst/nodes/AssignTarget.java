package org.javai.cst.nodes;

import java.util.Objects;
import org.javai.cst.codegen.CodegenState;

public record AssignTarget(BaseExpression target, SimpleWhitespace whitespaceBeforeEqual,
		SimpleWhitespace whitespaceAfterEqual) implements CstNode {

	public AssignTarget {
		Objects.requireNonNull(target, "target must not be null");
		Objects.requireNonNull(whitespaceBeforeEqual, "whitespaceBeforeEqual must not be null");
		Objects.requireNonNull(whitespaceAfterEqual, "whitespaceAfterEqual must not be null");
	}

	public static AssignTarget of(BaseExpression target) {
		return new AssignTarget(target, SimpleWhitespace.SPACE, SimpleWhitespace.SPACE);
	}

	@Override
	public void codegen(CodegenState state) {
		state.emit(target);
		state.emit(whitespaceBeforeEqual);
		state.add("=");
		state.emit(whitespaceAfterEqual);
	}
}
