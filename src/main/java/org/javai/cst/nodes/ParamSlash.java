package org.javai.cst.nodes;

import java.util.Objects;
import org.javai.cst.codegen.CodegenState;

/**
 * The {@code /} that ends the positional-only parameters.
 */
public record ParamSlash(@OptionalChild Comma comma, BaseParenthesizableWhitespace whitespaceAfter)
		implements CommaSeparated {

	public ParamSlash {
		Objects.requireNonNull(whitespaceAfter, "whitespaceAfter must not be null");
	}

	@Override
	public void codegen(CodegenState state) {
		state.add("/");
		state.emitOptional(comma);
		state.emit(whitespaceAfter);
	}
}
