package org.javai.cst.nodes;

import java.util.Objects;
import org.javai.cst.codegen.CodegenState;

public record BooleanOp(Kind kind, BaseParenthesizableWhitespace whitespaceBefore,
		BaseParenthesizableWhitespace whitespaceAfter) implements CstNode {

	public enum Kind {
		AND("and"),
		OR("or");

		private final String token;

		Kind(String token) {
			this.token = token;
		}

		public String token() {
			return token;
		}
	}

	public BooleanOp {
		Objects.requireNonNull(kind, "kind must not be null");
		Objects.requireNonNull(whitespaceBefore, "whitespaceBefore must not be null");
		Objects.requireNonNull(whitespaceAfter, "whitespaceAfter must not be null");
	}

	public static BooleanOp of(Kind kind) {
		return new BooleanOp(kind, SimpleWhitespace.SPACE, SimpleWhitespace.SPACE);
	}

	@Override
	public void codegen(CodegenState state) {
		state.emit(whitespaceBefore);
		state.add(kind.token());
		state.emit(whitespaceAfter);
	}
}
