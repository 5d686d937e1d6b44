package org.javai.cst.nodes;

import java.util.List;
import java.util.Objects;
import org.javai.cst.codegen.CodegenState;

/**
 * An imaginary literal such as {@code 3j}.
 */
public record ImaginaryLiteral(List<LeftParen> lpar, String value, List<RightParen> rpar) implements BaseExpression {

	public ImaginaryLiteral {
		lpar = List.copyOf(lpar);
		Objects.requireNonNull(value, "value must not be null");
		if (value.isEmpty()) {
			throw new IllegalArgumentException("value must not be empty");
		}
		rpar = List.copyOf(rpar);
		Parens.checkBalanced(lpar, rpar);
	}

	public static ImaginaryLiteral of(String value) {
		return new ImaginaryLiteral(List.of(), value, List.of());
	}

	@Override
	public void codegen(CodegenState state) {
		state.emitAll(lpar);
		state.add(value);
		state.emitAll(rpar);
	}
}
