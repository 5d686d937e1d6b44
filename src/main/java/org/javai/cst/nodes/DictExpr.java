package org.javai.cst.nodes;

import java.util.List;
import java.util.Objects;
import org.javai.cst.codegen.CodegenState;

public record DictExpr(
	List<LeftParen> lpar,
	LeftCurlyBrace lbrace,
	List<BaseDictElement> elements,
	RightCurlyBrace rbrace,
	List<RightParen> rpar
) implements BaseExpression {

	public DictExpr {
		lpar = List.copyOf(lpar);
		Objects.requireNonNull(lbrace, "lbrace must not be null");
		elements = List.copyOf(elements);
		Objects.requireNonNull(rbrace, "rbrace must not be null");
		rpar = List.copyOf(rpar);
		Parens.checkBalanced(lpar, rpar);
	}

	@Override
	public void codegen(CodegenState state) {
		state.emitAll(lpar);
		state.emit(lbrace);
		state.emitSeparated(elements);
		state.emit(rbrace);
		state.emitAll(rpar);
	}
}
