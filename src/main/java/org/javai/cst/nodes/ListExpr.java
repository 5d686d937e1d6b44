package org.javai.cst.nodes;

import java.util.List;
import java.util.Objects;
import org.javai.cst.codegen.CodegenState;

public record ListExpr(
	List<LeftParen> lpar,
	LeftSquareBracket lbracket,
	List<BaseElement> elements,
	RightSquareBracket rbracket,
	List<RightParen> rpar
) implements BaseExpression {

	public ListExpr {
		lpar = List.copyOf(lpar);
		Objects.requireNonNull(lbracket, "lbracket must not be null");
		elements = List.copyOf(elements);
		Objects.requireNonNull(rbracket, "rbracket must not be null");
		rpar = List.copyOf(rpar);
		Parens.checkBalanced(lpar, rpar);
	}

	public static ListExpr of(List<? extends BaseExpression> values) {
		List<BaseElement> elements = values.stream().<BaseElement>map(Element::of).toList();
		return new ListExpr(List.of(), LeftSquareBracket.plain(), elements, RightSquareBracket.plain(), List.of());
	}

	@Override
	public void codegen(CodegenState state) {
		state.emitAll(lpar);
		state.emit(lbracket);
		state.emitSeparated(elements);
		state.emit(rbracket);
		state.emitAll(rpar);
	}
}
