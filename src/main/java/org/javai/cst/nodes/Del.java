package org.javai.cst.nodes;

import java.util.Objects;
import org.javai.cst.codegen.CodegenState;

public record Del(SimpleWhitespace whitespaceAfterDel, BaseExpression target, @OptionalChild Semicolon semicolon)
		implements BaseSmallStatement {

	public Del {
		Objects.requireNonNull(whitespaceAfterDel, "whitespaceAfterDel must not be null");
		Objects.requireNonNull(target, "target must not be null");
	}

	@Override
	public void codegen(CodegenState state) {
		state.add("del");
		state.emit(whitespaceAfterDel);
		state.emit(target);
		state.emitOptional(semicolon);
	}
}
