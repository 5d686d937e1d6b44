package org.javai.cst.nodes;

import java.util.List;
import java.util.Objects;
import org.javai.cst.codegen.CodegenState;

public record Lambda(
	List<LeftParen> lpar,
	BaseParenthesizableWhitespace whitespaceAfterLambda,
	Parameters params,
	Colon colon,
	BaseExpression body,
	List<RightParen> rpar
) implements BaseExpression {

	public Lambda {
		lpar = List.copyOf(lpar);
		Objects.requireNonNull(whitespaceAfterLambda, "whitespaceAfterLambda must not be null");
		Objects.requireNonNull(params, "params must not be null");
		Objects.requireNonNull(colon, "colon must not be null");
		Objects.requireNonNull(body, "body must not be null");
		rpar = List.copyOf(rpar);
		Parens.checkBalanced(lpar, rpar);
		if (params.hasAnnotations()) {
			throw new IllegalArgumentException("Lambda parameters cannot be annotated");
		}
	}

	@Override
	public void codegen(CodegenState state) {
		state.emitAll(lpar);
		state.add("lambda");
		state.emit(whitespaceAfterLambda);
		state.emit(params);
		state.emit(colon);
		state.emit(body);
		state.emitAll(rpar);
	}
}
