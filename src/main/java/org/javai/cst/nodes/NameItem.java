package org.javai.cst.nodes;

import java.util.Objects;
import org.javai.cst.codegen.CodegenState;

public record NameItem(Name name, @OptionalChild Comma comma) implements CommaSeparated {

	public NameItem {
		Objects.requireNonNull(name, "name must not be null");
	}

	@Override
	public void codegen(CodegenState state) {
		state.emit(name);
		state.emitOptional(comma);
	}
}
