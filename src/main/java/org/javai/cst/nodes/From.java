package org.javai.cst.nodes;

import java.util.Objects;
import org.javai.cst.codegen.CodegenState;

/**
 * The {@code from item} part of {@code yield from} and of {@code raise ... from}.
 */
public record From(BaseParenthesizableWhitespace whitespaceBeforeFrom, BaseParenthesizableWhitespace whitespaceAfterFrom,
		BaseExpression item) implements BaseYieldValue {

	public From {
		Objects.requireNonNull(whitespaceBeforeFrom, "whitespaceBeforeFrom must not be null");
		Objects.requireNonNull(whitespaceAfterFrom, "whitespaceAfterFrom must not be null");
		Objects.requireNonNull(item, "item must not be null");
	}

	@Override
	public void codegen(CodegenState state) {
		state.emit(whitespaceBeforeFrom);
		state.add("from");
		state.emit(whitespaceAfterFrom);
		state.emit(item);
	}
}
