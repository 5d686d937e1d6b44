package org.javai.cst.nodes;

import java.util.List;
import java.util.Objects;
import org.javai.cst.codegen.CodegenState;

public record Await(List<LeftParen> lpar, BaseParenthesizableWhitespace whitespaceAfterAwait, BaseExpression expression,
		List<RightParen> rpar) implements BaseExpression {

	public Await {
		lpar = List.copyOf(lpar);
		Objects.requireNonNull(whitespaceAfterAwait, "whitespaceAfterAwait must not be null");
		Objects.requireNonNull(expression, "expression must not be null");
		rpar = List.copyOf(rpar);
		Parens.checkBalanced(lpar, rpar);
	}

	@Override
	public void codegen(CodegenState state) {
		state.emitAll(lpar);
		state.add("await");
		state.emit(whitespaceAfterAwait);
		state.emit(expression);
		state.emitAll(rpar);
	}
}
