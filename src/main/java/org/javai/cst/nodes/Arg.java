package org.javai.cst.nodes;

import java.util.Objects;
import org.javai.cst.codegen.CodegenState;

/**
 * An argument of a call or a base of a class definition.
 *
 * @param star {@code ""}, {@code "*"} or {@code "**"}
 * @param whitespaceAfterStar whitespace between the star and the value
 * @param keyword the keyword of a keyword argument
 * @param equal the {@code =} of a keyword argument; {@code "="} is rendered when absent
 * @param value the argument value
 * @param comma the trailing comma
 * @param whitespaceAfterArg whitespace after the argument and its comma
 */
public record Arg(
	String star,
	BaseParenthesizableWhitespace whitespaceAfterStar,
	@OptionalChild Name keyword,
	@OptionalChild AssignEqual equal,
	BaseExpression value,
	@OptionalChild Comma comma,
	BaseParenthesizableWhitespace whitespaceAfterArg
) implements CommaSeparated {

	public Arg {
		Objects.requireNonNull(star, "star must not be null");
		if (!star.isEmpty() && !star.equals("*") && !star.equals("**")) {
			throw new IllegalArgumentException("star must be empty, '*' or '**' but was '" + star + "'");
		}
		Objects.requireNonNull(whitespaceAfterStar, "whitespaceAfterStar must not be null");
		Objects.requireNonNull(value, "value must not be null");
		Objects.requireNonNull(whitespaceAfterArg, "whitespaceAfterArg must not be null");
		if (keyword != null && !star.isEmpty()) {
			throw new IllegalArgumentException("A keyword argument cannot be starred");
		}
		if (equal != null && keyword == null) {
			throw new IllegalArgumentException("An '=' needs a keyword");
		}
	}

	public static Arg of(BaseExpression value) {
		return new Arg("", SimpleWhitespace.EMPTY, null, null, value, null, SimpleWhitespace.EMPTY);
	}

	public static Arg keyword(String keyword, BaseExpression value) {
		return new Arg("", SimpleWhitespace.EMPTY, Name.of(keyword), AssignEqual.plain(), value, null,
				SimpleWhitespace.EMPTY);
	}

	@Override
	public void codegen(CodegenState state) {
		state.add(star);
		state.emit(whitespaceAfterStar);
		if (keyword != null) {
			state.emit(keyword);
			if (equal != null) {
				state.emit(equal);
			}
			else {
				state.add("=");
			}
		}
		state.emit(value);
		state.emitOptional(comma);
		state.emit(whitespaceAfterArg);
	}
}
