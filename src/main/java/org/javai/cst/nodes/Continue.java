package org.javai.cst.nodes;

import org.javai.cst.codegen.CodegenState;

public record Continue(@OptionalChild Semicolon semicolon) implements BaseSmallStatement {

	public static Continue of() {
		return new Continue(null);
	}

	@Override
	public void codegen(CodegenState state) {
		state.add("continue");
		state.emitOptional(semicolon);
	}
}
