package org.javai.cst.nodes;

import java.util.Objects;
import org.javai.cst.codegen.CodegenState;

/**
 * A single-value subscript, {@code x[value]}.
 */
public record Index(BaseExpression value) implements BaseSlice {

	public Index {
		Objects.requireNonNull(value, "value must not be null");
	}

	@Override
	public void codegen(CodegenState state) {
		state.emit(value);
	}
}
