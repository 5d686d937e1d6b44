package org.javai.cst.nodes;

import java.util.List;
import java.util.Objects;
import org.javai.cst.codegen.CodegenState;

/**
 * A yield expression: {@code yield}, {@code yield value} or {@code yield from value}.
 */
public record Yield(List<LeftParen> lpar, BaseParenthesizableWhitespace whitespaceAfterYield,
		@OptionalChild BaseYieldValue value, List<RightParen> rpar) implements BaseExpression {

	public Yield {
		lpar = List.copyOf(lpar);
		Objects.requireNonNull(whitespaceAfterYield, "whitespaceAfterYield must not be null");
		rpar = List.copyOf(rpar);
		Parens.checkBalanced(lpar, rpar);
	}

	@Override
	public void codegen(CodegenState state) {
		state.emitAll(lpar);
		state.add("yield");
		state.emit(whitespaceAfterYield);
		state.emitOptional(value);
		state.emitAll(rpar);
	}
}
