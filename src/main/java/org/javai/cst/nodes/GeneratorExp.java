package org.javai.cst.nodes;

import java.util.List;
import java.util.Objects;
import org.javai.cst.codegen.CodegenState;

/**
 * A generator expression. When it is the only argument of a call it borrows the
 * call's parentheses and has none of its own.
 */
public record GeneratorExp(List<LeftParen> lpar, BaseExpression elt, CompFor forIn, List<RightParen> rpar)
		implements BaseExpression {

	public GeneratorExp {
		lpar = List.copyOf(lpar);
		Objects.requireNonNull(elt, "elt must not be null");
		Objects.requireNonNull(forIn, "forIn must not be null");
		rpar = List.copyOf(rpar);
		Parens.checkBalanced(lpar, rpar);
	}

	@Override
	public void codegen(CodegenState state) {
		state.emitAll(lpar);
		state.emit(elt);
		state.emit(forIn);
		state.emitAll(rpar);
	}
}
