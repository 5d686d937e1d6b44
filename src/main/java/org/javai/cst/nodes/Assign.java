package org.javai.cst.nodes;

import java.util.List;
import java.util.Objects;
import org.javai.cst.codegen.CodegenState;

/**
 * An assignment to one or more targets, {@code a = b = value}.
 */
public record Assign(List<AssignTarget> targets, BaseExpression value, @OptionalChild Semicolon semicolon)
		implements BaseSmallStatement {

	public Assign {
		targets = List.copyOf(targets);
		if (targets.isEmpty()) {
			throw new IllegalArgumentException("An assignment needs at least one target");
		}
		Objects.requireNonNull(value, "value must not be null");
	}

	public static Assign of(BaseExpression target, BaseExpression value) {
		return new Assign(List.of(AssignTarget.of(target)), value, null);
	}

	@Override
	public void codegen(CodegenState state) {
		state.emitAll(targets);
		state.emit(value);
		state.emitOptional(semicolon);
	}
}
