package org.javai.cst.nodes;

import java.util.List;
import org.javai.cst.codegen.CodegenState;

/**
 * A tuple display. The parentheses, when present, are the tuple's own
 * {@code lpar} and {@code rpar}; {@code x = 1, 2} has none.
 */
public record TupleExpr(List<LeftParen> lpar, List<BaseElement> elements, List<RightParen> rpar)
		implements BaseExpression {

	public TupleExpr {
		lpar = List.copyOf(lpar);
		elements = List.copyOf(elements);
		rpar = List.copyOf(rpar);
		Parens.checkBalanced(lpar, rpar);
		if (elements.isEmpty() && lpar.isEmpty()) {
			throw new IllegalArgumentException("An empty tuple must be parenthesized");
		}
	}

	/**
	 * A parenthesized tuple with the default comma spacing.
	 */
	public static TupleExpr of(List<? extends BaseExpression> values) {
		List<BaseElement> elements = values.stream().<BaseElement>map(Element::of).toList();
		return new TupleExpr(List.of(LeftParen.plain()), elements, List.of(RightParen.plain()));
	}

	@Override
	public void codegen(CodegenState state) {
		state.emitAll(lpar);
		state.emitSeparated(elements);
		if (elements.size() == 1 && elements.get(0).comma() == null) {
			state.add(",");
		}
		state.emitAll(rpar);
	}
}
