package org.javai.cst.nodes;

import java.util.Objects;
import org.javai.cst.codegen.CodegenState;

public record Return(SimpleWhitespace whitespaceAfterReturn, @OptionalChild BaseExpression value,
		@OptionalChild Semicolon semicolon) implements BaseSmallStatement {

	public Return {
		Objects.requireNonNull(whitespaceAfterReturn, "whitespaceAfterReturn must not be null");
	}

	public static Return of(BaseExpression value) {
		return new Return(value != null ? SimpleWhitespace.SPACE : SimpleWhitespace.EMPTY, value, null);
	}

	@Override
	public void codegen(CodegenState state) {
		state.add("return");
		state.emit(whitespaceAfterReturn);
		state.emitOptional(value);
		state.emitOptional(semicolon);
	}
}
