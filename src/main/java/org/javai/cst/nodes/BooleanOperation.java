package org.javai.cst.nodes;

import java.util.List;
import java.util.Objects;
import org.javai.cst.codegen.CodegenState;

public record BooleanOperation(List<LeftParen> lpar, BaseExpression left, BooleanOp operator, BaseExpression right,
		List<RightParen> rpar) implements BaseExpression {

	public BooleanOperation {
		lpar = List.copyOf(lpar);
		Objects.requireNonNull(left, "left must not be null");
		Objects.requireNonNull(operator, "operator must not be null");
		Objects.requireNonNull(right, "right must not be null");
		rpar = List.copyOf(rpar);
		Parens.checkBalanced(lpar, rpar);
	}

	public static BooleanOperation of(BaseExpression left, BooleanOp.Kind kind, BaseExpression right) {
		return new BooleanOperation(List.of(), left, BooleanOp.of(kind), right, List.of());
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
