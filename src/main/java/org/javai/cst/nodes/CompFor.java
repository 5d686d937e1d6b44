package org.javai.cst.nodes;

import java.util.List;
import java.util.Objects;
import org.javai.cst.codegen.CodegenState;

/**
 * One {@code for ... in ...} clause of a comprehension, with the {@code if}
 * clauses that follow it and the next {@code for} clause, if any.
 */
public record CompFor(
	BaseParenthesizableWhitespace whitespaceBefore,
	@OptionalChild Asynchronous asynchronous,
	BaseParenthesizableWhitespace whitespaceAfterFor,
	BaseExpression target,
	BaseParenthesizableWhitespace whitespaceBeforeIn,
	BaseParenthesizableWhitespace whitespaceAfterIn,
	BaseExpression iter,
	List<CompIf> ifs,
	@OptionalChild CompFor innerForIn
) implements CstNode {

	public CompFor {
		Objects.requireNonNull(whitespaceBefore, "whitespaceBefore must not be null");
		Objects.requireNonNull(whitespaceAfterFor, "whitespaceAfterFor must not be null");
		Objects.requireNonNull(target, "target must not be null");
		Objects.requireNonNull(whitespaceBeforeIn, "whitespaceBeforeIn must not be null");
		Objects.requireNonNull(whitespaceAfterIn, "whitespaceAfterIn must not be null");
		Objects.requireNonNull(iter, "iter must not be null");
		ifs = List.copyOf(ifs);
	}

	public static CompFor of(BaseExpression target, BaseExpression iter) {
		return new CompFor(SimpleWhitespace.SPACE, null, SimpleWhitespace.SPACE, target, SimpleWhitespace.SPACE,
				SimpleWhitespace.SPACE, iter, List.of(), null);
	}

	@Override
	public void codegen(CodegenState state) {
		state.emit(whitespaceBefore);
		state.emitOptional(asynchronous);
		state.add("for");
		state.emit(whitespaceAfterFor);
		state.emit(target);
		state.emit(whitespaceBeforeIn);
		state.add("in");
		state.emit(whitespaceAfterIn);
		state.emit(iter);
		state.emitAll(ifs);
		state.emitOptional(innerForIn);
	}
}
