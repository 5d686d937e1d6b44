package org.javai.cst.nodes;

import java.util.List;
import java.util.Objects;
import org.javai.cst.codegen.CodegenState;

/**
 * Attribute access, {@code value.attr}.
 */
public record Attribute(List<LeftParen> lpar, BaseExpression value, Dot dot, Name attr, List<RightParen> rpar)
		implements BaseExpression {

	public Attribute {
		lpar = List.copyOf(lpar);
		Objects.requireNonNull(value, "value must not be null");
		Objects.requireNonNull(dot, "dot must not be null");
		Objects.requireNonNull(attr, "attr must not be null");
		rpar = List.copyOf(rpar);
		Parens.checkBalanced(lpar, rpar);
	}

	public static Attribute of(BaseExpression value, String attr) {
		return new Attribute(List.of(), value, Dot.plain(), Name.of(attr), List.of());
	}

	@Override
	public void codegen(CodegenState state) {
		state.emitAll(lpar);
		state.emit(value);
		state.emit(dot);
		state.emit(attr);
		state.emitAll(rpar);
	}
}
