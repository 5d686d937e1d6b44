package org.javai.cst.nodes;

import org.javai.cst.codegen.CodegenState;

public record Break(@OptionalChild Semicolon semicolon) implements BaseSmallStatement {

	public static Break of() {
		return new Break(null);
	}

	@Override
	public void codegen(CodegenState state) {
		state.add("break");
		state.emitOptional(semicolon);
	}
}
