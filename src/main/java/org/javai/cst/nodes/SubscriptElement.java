package org.javai.cst.nodes;

import java.util.Objects;
import org.javai.cst.codegen.CodegenState;

public record SubscriptElement(BaseSlice slice, @OptionalChild Comma comma) implements CommaSeparated {

	public SubscriptElement {
		Objects.requireNonNull(slice, "slice must not be null");
	}

	@Override
	public void codegen(CodegenState state) {
		state.emit(slice);
		state.emitOptional(comma);
	}
}
