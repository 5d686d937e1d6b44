package org.javai.cst.nodes;

import java.util.List;
import java.util.Objects;
import org.javai.cst.codegen.CodegenState;

public record UnaryOperation(List<LeftParen> lpar, UnaryOp operator, BaseExpression expression,
		List<RightParen> rpar) implements BaseExpression {

	public UnaryOperation {
		lpar = List.copyOf(lpar);
		Objects.requireNonNull(operator, "operator must not be null");
		Objects.requireNonNull(expression, "expression must not be null");
		rpar = List.copyOf(rpar);
		Parens.checkBalanced(lpar, rpar);
	}

	public static UnaryOperation of(UnaryOp.Kind kind, BaseExpression expression) {
		return new UnaryOperation(List.of(), UnaryOp.of(kind), expression, List.of());
	}

	@Override
	public void codegen(CodegenState state) {
		state.emitAll(lpar);
		state.emit(operator);
		state.emit(expression);
		state.emitAll(rpar);
	}
}
