package org.javai.cst.nodes;

import java.util.List;
import java.util.Objects;
import org.javai.cst.codegen.CodegenState;

public record ListComp(
	List<LeftParen> lpar,
	LeftSquareBracket lbracket,
	BaseExpression elt,
	CompFor forIn,
	RightSquareBracket rbracket,
	List<RightParen> rpar
) implements BaseExpression {

	public ListComp {
		lpar = List.copyOf(lpar);
		Objects.requireNonNull(lbracket, "lbracket must not be null");
		Objects.requireNonNull(elt, "elt must not be null");
		Objects.requireNonNull(forIn, "forIn must not be null");
		Objects.requireNonNull(rbracket, "rbracket must not be null");
		rpar = List.copyOf(rpar);
		Parens.checkBalanced(lpar, rpar);
	}

	@Override
	public void codegen(CodegenState state) {
		state.emitAll(lpar);
		state.emit(lbracket);
		state.emit(elt);
		state.emit(forIn);
		state.emit(rbracket);
		state.emitAll(rpar);
	}
}
