package org.javai.cst.nodes;

import java.util.Objects;
import org.javai.cst.codegen.CodegenState;

/**
 * Spaces, tabs and backslash line continuations that stay on one logical line.
 */
public record SimpleWhitespace(String value) implements BaseParenthesizableWhitespace {

	public static final SimpleWhitespace EMPTY = new SimpleWhitespace("");
	public static final SimpleWhitespace SPACE = new SimpleWhitespace(" ");

	public SimpleWhitespace {
		Objects.requireNonNull(value, "value must not be null");
		for (int i = 0; i < value.length(); i++) {
			char c = value.charAt(i);
			if ((c == '\n' || c == '\r') && (i == 0 || value.charAt(i - 1) != '\\')
					&& !(c == '\n' && i >= 2 && value.charAt(i - 1) == '\r' && value.charAt(i - 2) == '\\')) {
				throw new IllegalArgumentException("Simple whitespace cannot contain a line break outside a continuation");
			}
			if (c != ' ' && c != '\t' && c != '\f' && c != '\\' && c != '\n' && c != '\r') {
				throw new IllegalArgumentException("Simple whitespace cannot contain '" + c + "'");
			}
		}
	}

	public static SimpleWhitespace of(String value) {
		if (value.isEmpty()) {
			return EMPTY;
		}
		return " ".equals(value) ? SPACE : new SimpleWhitespace(value);
	}

	@Override
	public boolean isEmpty() {
		return value.isEmpty();
	}

	@Override
	public void codegen(CodegenState state) {
		state.add(value);
	}
}
