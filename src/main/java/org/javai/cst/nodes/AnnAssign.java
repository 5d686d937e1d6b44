package org.javai.cst.nodes;

import java.util.Objects;
import org.javai.cst.codegen.CodegenState;

/**
 * An annotated assignment, {@code target: annotation = value}, where the value
 * is optional.
 */
public record AnnAssign(BaseExpression target, Annotation annotation, @OptionalChild AssignEqual equal,
		@OptionalChild BaseExpression value, @OptionalChild Semicolon semicolon) implements BaseSmallStatement {

	public AnnAssign {
		Objects.requireNonNull(target, "target must not be null");
		Objects.requireNonNull(annotation, "annotation must not be null");
		if (!":".equals(annotation.indicator())) {
			throw new IllegalArgumentException("An annotated assignment must use ':'");
		}
		if (equal != null && value == null) {
			throw new IllegalArgumentException("An '=' needs a value");
		}
	}

	@Override
	public void codegen(CodegenState state) {
		state.emit(target);
		state.emit(annotation);
		if (value != null) {
			if (equal != null) {
				state.emit(equal);
			}
			else {
				state.add(" = ");
			}
			state.emit(value);
		}
		state.emitOptional(semicolon);
	}
}
