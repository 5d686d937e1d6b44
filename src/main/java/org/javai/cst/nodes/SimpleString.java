package org.javai.cst.nodes;

import java.util.List;
import java.util.Objects;
import org.javai.cst.codegen.CodegenState;

/**
 * A string literal with its prefix and quotes, exactly as written. Formatted
 * strings are kept as plain string literals.
 */
public record SimpleString(List<LeftParen> lpar, String value, List<RightParen> rpar) implements BaseString {

	public SimpleString {
		lpar = List.copyOf(lpar);
		Objects.requireNonNull(value, "value must not be null");
		if (value.isEmpty()) {
			throw new IllegalArgumentException("value must not be empty");
		}
		char last = value.charAt(value.length() - 1);
		if (last != '"' && last != '\'') {
			throw new IllegalArgumentException("A string literal must end with a quote: " + value);
		}
		rpar = List.copyOf(rpar);
		Parens.checkBalanced(lpar, rpar);
	}

	public static SimpleString of(String value) {
		return new SimpleString(List.of(), value, List.of());
	}

	/**
	 * The prefix letters before the opening quote, for example {@code rb}.
	 */
	public String prefix() {
		int i = 0;
		while (i < value.length() && value.charAt(i) != '"' && value.charAt(i) != '\'') {
			i++;
		}
		return value.substring(0, i);
	}

	/**
	 * The opening quote: one of {@code '}, {@code "}, {@code '''} or {@code """}.
	 */
	public String quote() {
		String rest = value.substring(prefix().length());
		if (rest.startsWith("\"\"\"") || rest.startsWith("'''")) {
			return rest.substring(0, 3);
		}
		return rest.substring(0, 1);
	}

	@Override
	public void codegen(CodegenState state) {
		state.emitAll(lpar);
		state.add(value);
		state.emitAll(rpar);
	}
}
