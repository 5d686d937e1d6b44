package org.javai.cst.nodes;

import java.util.Objects;
import org.javai.cst.codegen.CodegenState;

/**
 * A comparison operator. The two-word operators {@code not in} and
 * {@code is not} keep the whitespace between their words in {@code between};
 * for every other operator it is absent.
 */
public record CompOp(Kind kind, BaseParenthesizableWhitespace whitespaceBefore,
		@OptionalChild BaseParenthesizableWhitespace between, BaseParenthesizableWhitespace whitespaceAfter)
		implements CstNode {

	public enum Kind {
		LESS_THAN("<"),
		GREATER_THAN(">"),
		EQUAL("=="),
		GREATER_THAN_EQUAL(">="),
		LESS_THAN_EQUAL("<="),
		NOT_EQUAL("!="),
		IN("in"),
		NOT_IN("not", "in"),
		IS("is"),
		IS_NOT("is", "not");

		private final String first;
		private final String second;

		Kind(String first) {
			this(first, null);
		}

		Kind(String first, String second) {
			this.first = first;
			this.second = second;
		}

		public boolean isTwoWords() {
			return second != null;
		}

		public String token() {
			return second == null ? first : first + " " + second;
		}
	}

	public CompOp {
		Objects.requireNonNull(kind, "kind must not be null");
		Objects.requireNonNull(whitespaceBefore, "whitespaceBefore must not be null");
		Objects.requireNonNull(whitespaceAfter, "whitespaceAfter must not be null");
		if (!kind.isTwoWords() && between != null) {
			throw new IllegalArgumentException("Operator " + kind.token() + " has no whitespace between words");
		}
	}

	public static CompOp of(Kind kind) {
		return new CompOp(kind, SimpleWhitespace.SPACE, kind.isTwoWords() ? SimpleWhitespace.SPACE : null,
				SimpleWhitespace.SPACE);
	}

	@Override
	public void codegen(CodegenState state) {
		state.emit(whitespaceBefore);
		state.add(kind.first);
		if (kind.isTwoWords()) {
			if (between != null) {
				state.emit(between);
			}
			else {
				state.add(" ");
			}
			state.add(kind.second);
		}
		state.emit(whitespaceAfter);
	}
}
