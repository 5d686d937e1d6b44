package org.javai.cst.nodes;

import java.util.List;
import java.util.Objects;
import org.javai.cst.codegen.CodegenState;

/**
 * A set display. It always has at least one element, since {@code {}} is an
 * empty dict.
 */
public record SetExpr(
	List<LeftParen> lpar,
	LeftCurlyBrace lbrace,
	List<BaseElement> elements,
	RightCurlyBrace rbrace,
	List<RightParen> rpar
) implements BaseExpression {

	public SetExpr {
		lpar = List.copyOf(lpar);
		Objects.requireNonNull(lbrace, "lbrace must not be null");
		elements = List.copyOf(elements);
		if (elements.isEmpty()) {
			throw new IllegalArgumentException("A set display needs at least one element");
		}
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
