package org.javai.cst.nodes;

import java.util.Objects;
import org.javai.cst.codegen.CodegenState;

/**
 * An unpacked mapping such as {@code **defaults}.
 */
public record StarredDictElement(BaseParenthesizableWhitespace whitespaceBeforeValue, BaseExpression value,
		@OptionalChild Comma comma) implements BaseDictElement {

	public StarredDictElement {
		Objects.requireNonNull(whitespaceBeforeValue, "whitespaceBeforeValue must not be null");
		Objects.requireNonNull(value, "value must not be null");
	}

	@Override
	public void codegen(CodegenState state) {
		state.add("**");
		state.emit(whitespaceBeforeValue);
		state.emit(value);
		state.emitOptional(comma);
	}
}
