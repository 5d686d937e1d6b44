package org.javai.cst.nodes;

import java.util.Objects;
import org.javai.cst.codegen.CodegenState;

/**
 * A single parameter, possibly starred, annotated or defaulted.
 * <p>
 * When a default is present without an explicit {@code equal}, {@code "="} is
 * rendered.
 */
public record Param(
	String star,
	BaseParenthesizableWhitespace whitespaceAfterStar,
	Name name,
	@OptionalChild Annotation annotation,
	@OptionalChild AssignEqual equal,
	@OptionalChild BaseExpression defaultValue,
	@OptionalChild Comma comma,
	BaseParenthesizableWhitespace whitespaceAfterParam
) implements BaseStarArg {

	public Param {
		Objects.requireNonNull(star, "star must not be null");
		if (!star.isEmpty() && !star.equals("*") && !star.equals("**")) {
			throw new IllegalArgumentException("star must be empty, '*' or '**' but was '" + star + "'");
		}
		Objects.requireNonNull(whitespaceAfterStar, "whitespaceAfterStar must not be null");
		Objects.requireNonNull(name, "name must not be null");
		Objects.requireNonNull(whitespaceAfterParam, "whitespaceAfterParam must not be null");
		if (equal != null && defaultValue == null) {
			throw new IllegalArgumentException("An '=' needs a default value");
		}
		if (annotation != null && !":".equals(annotation.indicator())) {
			throw new IllegalArgumentException("A parameter annotation must use ':'");
		}
	}

	public static Param of(String name) {
		return new Param("", SimpleWhitespace.EMPTY, Name.of(name), null, null, null, null, SimpleWhitespace.EMPTY);
	}

	@Override
	public void codegen(CodegenState state) {
		state.add(star);
		state.emit(whitespaceAfterStar);
		state.emit(name);
		state.emitOptional(annotation);
		if (defaultValue != null) {
			if (equal != null) {
				state.emit(equal);
			}
			else {
				state.add("=");
			}
			state.emit(defaultValue);
		}
		state.emitOptional(comma);
		state.emit(whitespaceAfterParam);
	}
}
