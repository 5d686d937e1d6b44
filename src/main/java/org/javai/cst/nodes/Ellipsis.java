package org.javai.cst.nodes;

import java.util.List;
import org.javai.cst.codegen.CodegenState;

public record Ellipsis(List<LeftParen> lpar, List<RightParen> rpar) implements BaseExpression {

	public Ellipsis {
		lpar = List.copyOf(lpar);
		rpar = List.copyOf(rpar);
		Parens.checkBalanced(lpar, rpar);
	}

	public static Ellipsis of() {
		return new Ellipsis(List.of(), List.of());
	}

	@Override
	public void codegen(CodegenState state) {
		state.emitAll(lpar);
		state.add("...");
		state.emitAll(rpar);
	}
}
