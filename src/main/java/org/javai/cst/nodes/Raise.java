package org.javai.cst.nodes;

import java.util.Objects;
import org.javai.cst.codegen.CodegenState;

public record Raise(SimpleWhitespace whitespaceAfterRaise, @OptionalChild BaseExpression exc,
		@OptionalChild From cause, @OptionalChild Semicolon semicolon) implements BaseSmallStatement {

	public Raise {
		Objects.requireNonNull(whitespaceAfterRaise, "whitespaceAfterRaise must not be null");
		if (cause != null && exc == null) {
			throw new IllegalArgumentException("A raise with a cause needs an exception");
		}
	}

	@Override
	public void codegen(CodegenState state) {
		state.add("raise");
		state.emit(whitespaceAfterRaise);
		state.emitOptional(exc);
		state.emitOptional(cause);
		state.emitOptional(semicolon);
	}
}
