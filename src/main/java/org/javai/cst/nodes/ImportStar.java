package org.javai.cst.nodes;

import org.javai.cst.codegen.CodegenState;

/**
 * The {@code *} of {@code from module import *}.
 */
public record ImportStar() implements CstNode {

	@Override
	public void codegen(CodegenState state) {
		state.add("*");
	}
}
