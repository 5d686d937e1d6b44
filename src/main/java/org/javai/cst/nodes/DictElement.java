package org.javai.cst.nodes;

import java.util.Objects;
import org.javai.cst.codegen.CodegenState;

public record DictElement(
	BaseExpression key,
	BaseParenthesizableWhitespace whitespaceBeforeColon,
	BaseParenthesizableWhitespace whitespaceAfterColon,
	BaseExpression value,
	@OptionalChild Comma comma
) implements BaseDictElement {

	public DictElement {
		Objects.requireNonNull(key, "key must not be null");
		Objects.requireNonNull(whitespaceBeforeColon, "whitespaceBeforeColon must not be null");
		Objects.requireNonNull(whitespaceAfterColon, "whitespaceAfterColon must not be null");
		Objects.requireNonNull(value, "value must not be null");
	}

	public static DictElement of(BaseExpression key, BaseExpression value) {
		return new DictElement(key, SimpleWhitespace.EMPTY, SimpleWhitespace.SPACE, value, null);
	}

	@Override
	public void codegen(CodegenState state) {
		state.emit(key);
		state.emit(whitespaceBeforeColon);
		state.add(":");
		state.emit(whitespaceAfterColon);
		state.emit(value);
		state.emitOptional(comma);
	}
}
