package org.javai.cst.nodes;

import java.util.List;
import java.util.Objects;
import org.javai.cst.codegen.CodegenState;

public record SetComp(
	List<LeftParen> lpar,
	LeftCurlyBrace lbrace,
	BaseExpression elt,
	CompFor forIn,
	RightCurlyBrace rbrace,
	List<RightParen> rpar
) implements BaseExpression {

	public SetComp {
		lpar = List.copyOf(lpar);
		Objects.requireNonNull(lbrace, "lbrace must not be null");
		Objects.requireNonNull(elt, "elt must not be null");
		Objects.requireNonNull(forIn, "forIn must not be null");
		Objects.requireNonNull(rbrace, "rbrace must not be null");
		rpar = List.copyOf(rpar);
		Parens.checkBalanced(lpar, rpar);
	}

	@Override
	public void codegen(CodegenState state) {
		state.emitAll(lpar);
		state.emit(lbrace);
		state.emit(elt);
		state.emit(forIn);
		state.emit(rbrace);
		state.emitAll(rpar);
	}
}
