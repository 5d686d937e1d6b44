package org.javai.cst.nodes;

import java.util.Objects;
import org.javai.cst.codegen.CodegenState;

/**
 * A bare {@code *} that starts the keyword-only parameters.
 */
public record ParamStar(Comma comma) implements BaseStarArg {

	public ParamStar {
		Objects.requireNonNull(comma, "comma must not be null");
	}

	@Override
	public void codegen(CodegenState state) {
		state.add("*");
		state.emit(comma);
	}
}
