package org.javai.cst.nodes;

import java.util.List;
import java.util.Objects;
import org.javai.cst.codegen.CodegenState;

/**
 * An integer literal such as {@code 0x1F} or {@code 1_000}.
 */
public record IntegerLiteral(List<LeftParen> lpar, String value, List<RightParen> rpar) implements BaseExpression {

	public IntegerLiteral {
		lpar = List.copyOf(lpar);
		Objects.requireNonNull(value, "value must not be null");
		if (value.isEmpty()) {
			throw new IllegalArgumentException("value must not be empty");
		}
		rpar = List.copyOf(rpar);
		Parens.checkBalanced(lpar, rpar);
	}

	public static IntegerLiteral of(String value) {
		return new IntegerLiteral(List.of(), value, List.of());
	}

	@Override
	public void codegen(CodegenState state) {
		state.emitAll(lpar);
		state.add(value);
		state.emitAll(rpar);
	}
}
