package org.javai.cst.nodes;

import java.util.List;
import java.util.Objects;
import org.javai.cst.codegen.CodegenState;

public record Subscript(
	List<LeftParen> lpar,
	BaseExpression value,
	BaseParenthesizableWhitespace whitespaceAfterValue,
	LeftSquareBracket lbracket,
	List<SubscriptElement> slice,
	RightSquareBracket rbracket,
	List<RightParen> rpar
) implements BaseExpression {

	public Subscript {
		lpar = List.copyOf(lpar);
		Objects.requireNonNull(value, "value must not be null");
		Objects.requireNonNull(whitespaceAfterValue, "whitespaceAfterValue must not be null");
		Objects.requireNonNull(lbracket, "lbracket must not be null");
		slice = List.copyOf(slice);
		if (slice.isEmpty()) {
			throw new IllegalArgumentException("A subscript needs at least one slice element");
		}
		Objects.requireNonNull(rbracket, "rbracket must not be null");
		rpar = List.copyOf(rpar);
		Parens.checkBalanced(lpar, rpar);
	}

	@Override
	public void codegen(CodegenState state) {
		state.emitAll(lpar);
		state.emit(value);
		state.emit(whitespaceAfterValue);
		state.emit(lbracket);
		state.emitSeparated(slice);
		state.emit(rbracket);
		state.emitAll(rpar);
	}
}
