package org.javai.cst.nodes;

import java.util.Objects;
import org.javai.cst.codegen.CodegenState;

/**
 * An expression used as a statement.
 */
public record Expr(BaseExpression value, @OptionalChild Semicolon semicolon) implements BaseSmallStatement {

	public Expr {
		Objects.requireNonNull(value, "value must not be null");
	}

	public static Expr of(BaseExpression value) {
		return new Expr(value, null);
	}

	@Override
	public void codegen(CodegenState state) {
		state.emit(value);
		state.emitOptional(semicolon);
	}
}
