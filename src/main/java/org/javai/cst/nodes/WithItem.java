package org.javai.cst.nodes;

import java.util.Objects;
import org.javai.cst.codegen.CodegenState;

public record WithItem(BaseExpression item, @OptionalChild AsName asname, @OptionalChild Comma comma)
		implements CommaSeparated {

	public WithItem {
		Objects.requireNonNull(item, "item must not be null");
	}

	@Override
	public void codegen(CodegenState state) {
		state.emit(item);
		state.emitOptional(asname);
		state.emitOptional(comma);
	}
}
