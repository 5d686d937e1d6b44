package org.javai.cst.nodes;

import java.util.List;
import java.util.Objects;
import org.javai.cst.codegen.CodegenState;

/**
 * A chain of comparisons, {@code a < b <= c}.
 */
public record Comparison(List<LeftParen> lpar, BaseExpression left, List<ComparisonTarget> comparisons,
		List<RightParen> rpar) implements BaseExpression {

	public Comparison {
		lpar = List.copyOf(lpar);
		Objects.requireNonNull(left, "left must not be null");
		comparisons = List.copyOf(comparisons);
		if (comparisons.isEmpty()) {
			throw new IllegalArgumentException("A comparison needs at least one comparator");
		}
		rpar = List.copyOf(rpar);
		Parens.checkBalanced(lpar, rpar);
	}

	@Override
	public void codegen(CodegenState state) {
		state.emitAll(lpar);
		state.emit(left);
		state.emitAll(comparisons);
		state.emitAll(rpar);
	}
}
