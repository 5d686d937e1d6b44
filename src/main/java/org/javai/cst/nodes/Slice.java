package org.javai.cst.nodes;

import java.util.Objects;
import org.javai.cst.codegen.CodegenState;

/**
 * A slice, {@code lower:upper:step}, where every bound and the second colon may
 * be absent.
 */
public record Slice(
	@OptionalChild BaseExpression lower,
	Colon first,
	@OptionalChild BaseExpression upper,
	@OptionalChild Colon second,
	@OptionalChild BaseExpression step
) implements BaseSlice {

	public Slice {
		Objects.requireNonNull(first, "first must not be null");
		if (step != null && second == null) {
			throw new IllegalArgumentException("A slice step needs a second colon");
		}
	}

	@Override
	public void codegen(CodegenState state) {
		state.emitOptional(lower);
		state.emit(first);
		state.emitOptional(upper);
		state.emitOptional(second);
		state.emitOptional(step);
	}
}
