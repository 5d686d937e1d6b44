package org.javai.cst.nodes;

import java.util.List;
import java.util.Objects;
import org.javai.cst.codegen.CodegenState;

public record BinaryOperation(List<LeftParen> lpar, BaseExpression left, BinaryOp operator, BaseExpression right,
		List<RightParen> rpar) implements BaseExpression {

	public BinaryOperation {
		lpar = List.copyOf(lpar);
		Objects.requireNonNull(left, "left must not be null");
		Objects.requireNonNull(operator, "operator must not be null");
		Objects.requireNonNull(right, "right must not be null");
		rpar = List.copyOf(rpar);
		Parens.checkBalanced(lpar, rpar);
	}

	public static BinaryOperation of(BaseExpression left, BinaryOp.Kind kind, BaseExpression right) {
		return new BinaryOperation(List.of(), left, BinaryOp.of(kind), right, List.of());
	}

	@Override
	public void codegen(CodegenState state) {
		state.emitAll(lpar);
		state.emit(left);
		state.emit(operator);
		state.emit(right);
		state.emitAll(rpar);
	}
}
