package org.javai.cst.nodes;

import java.util.Objects;
import org.javai.cst.codegen.CodegenState;

public record AugAssign(BaseExpression target, AugOp operator, BaseExpression value,
		@OptionalChild Semicolon semicolon) implements BaseSmallStatement {

	public AugAssign {
		Objects.requireNonNull(target, "target must not be null");
		Objects.requireNonNull(operator, "operator must not be null");
		Objects.requireNonNull(value, "value must not be null");
	}

	@Override
	public void codegen(CodegenState state) {
		state.emit(target);
		state.emit(operator);
		state.emit(value);
		state.emitOptional(semicolon);
	}
}
