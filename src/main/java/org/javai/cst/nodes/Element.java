package org.javai.cst.nodes;

import java.util.Objects;
import org.javai.cst.codegen.CodegenState;

public record Element(BaseExpression value, @OptionalChild Comma comma) implements BaseElement {

	public Element {
		Objects.requireNonNull(value, "value must not be null");
	}

	public static Element of(BaseExpression value) {
		return new Element(value, null);
	}

	@Override
	public void codegen(CodegenState state) {
		state.emit(value);
		state.emitOptional(comma);
	}
}
