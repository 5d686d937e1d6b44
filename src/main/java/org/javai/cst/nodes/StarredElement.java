package org.javai.cst.nodes;

import java.util.Objects;
import org.javai.cst.codegen.CodegenState;

/**
 * An unpacked element such as {@code *rest}.
 */
public record StarredElement(BaseParenthesizableWhitespace whitespaceBeforeValue, BaseExpression value,
		@OptionalChild Comma comma) implements BaseElement {

	public StarredElement {
		Objects.requireNonNull(whitespaceBeforeValue, "whitespaceBeforeValue must not be null");
		Objects.requireNonNull(value, "value must not be null");
	}

	public static StarredElement of(BaseExpression value) {
		return new StarredElement(SimpleWhitespace.EMPTY, value, null);
	}

	@Override
	public void codegen(CodegenState state) {
		state.add("*");
		state.emit(whitespaceBeforeValue);
		state.emit(value);
		state.emitOptional(comma);
	}
}
