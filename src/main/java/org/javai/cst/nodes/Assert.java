package org.javai.cst.nodes;

import java.util.Objects;
import org.javai.cst.codegen.CodegenState;

public record Assert(SimpleWhitespace whitespaceAfterAssert, BaseExpression test, @OptionalChild Comma comma,
		@OptionalChild BaseExpression msg, @OptionalChild Semicolon semicolon) implements BaseSmallStatement {

	public Assert {
		Objects.requireNonNull(whitespaceAfterAssert, "whitespaceAfterAssert must not be null");
		Objects.requireNonNull(test, "test must not be null");
		if (comma != null && msg == null) {
			throw new IllegalArgumentException("An assert with a comma needs a message");
		}
	}

	@Override
	public void codegen(CodegenState state) {
		state.add("assert");
		state.emit(whitespaceAfterAssert);
		state.emit(test);
		if (msg != null) {
			if (comma != null) {
				state.emit(comma);
			}
			else {
				state.add(", ");
			}
			state.emit(msg);
		}
		state.emitOptional(semicolon);
	}
}
