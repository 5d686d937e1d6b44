package org.javai.cst.nodes;

import org.javai.cst.codegen.CodegenState;

public record Pass(@OptionalChild Semicolon semicolon) implements BaseSmallStatement {

	public static Pass of() {
		return new Pass(null);
	}

	@Override
	public void codegen(CodegenState state) {
		state.add("pass");
		state.emitOptional(semicolon);
	}
}
