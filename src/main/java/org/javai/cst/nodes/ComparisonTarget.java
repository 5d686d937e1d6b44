package org.javai.cst.nodes;

import java.util.Objects;
import org.javai.cst.codegen.CodegenState;

public record ComparisonTarget(CompOp operator, BaseExpression comparator) implements CstNode {

	public ComparisonTarget {
		Objects.requireNonNull(operator, "operator must not be null");
		Objects.requireNonNull(comparator, "comparator must not be null");
	}

	@Override
	public void codegen(CodegenState state) {
		state.emit(operator);
		state.emit(comparator);
	}
}
