package org.javai.cst.nodes;

import java.util.Objects;
import org.javai.cst.codegen.CodegenState;

/**
 * A type annotation: {@code : T} on a parameter or assignment target,
 * {@code -> T} on a function.
 */
public record Annotation(
	BaseParenthesizableWhitespace whitespaceBeforeIndicator,
	String indicator,
	BaseParenthesizableWhitespace whitespaceAfterIndicator,
	BaseExpression annotation
) implements CstNode {

	public Annotation {
		Objects.requireNonNull(whitespaceBeforeIndicator, "whitespaceBeforeIndicator must not be null");
		if (!":".equals(indicator) && !"->".equals(indicator)) {
			throw new IllegalArgumentException("indicator must be ':' or '->' but was '" + indicator + "'");
		}
		Objects.requireNonNull(whitespaceAfterIndicator, "whitespaceAfterIndicator must not be null");
		Objects.requireNonNull(annotation, "annotation must not be null");
	}

	public static Annotation colon(BaseExpression annotation) {
		return new Annotation(SimpleWhitespace.EMPTY, ":", SimpleWhitespace.SPACE, annotation);
	}

	public static Annotation arrow(BaseExpression annotation) {
		return new Annotation(SimpleWhitespace.SPACE, "->", SimpleWhitespace.SPACE, annotation);
	}

	@Override
	public void codegen(CodegenState state) {
		state.emit(whitespaceBeforeIndicator);
		state.add(indicator);
		state.emit(whitespaceAfterIndicator);
		state.emit(annotation);
	}
}
