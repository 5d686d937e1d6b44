package org.javai.cst.nodes;

import java.util.Objects;
import org.javai.cst.codegen.CodegenState;

public record UnaryOp(Kind kind, BaseParenthesizableWhitespace whitespaceAfter) implements CstNode {

	public enum Kind {
		PLUS("+"),
		MINUS("-"),
		BITWISE_INVERT("~"),
		NOT("not");

		private final String token;

		Kind(String token) {
			this.token = token;
		}

		public String token() {
			return token;
		}
	}

	public UnaryOp {
		Objects.requireNonNull(kind, "kind must not be null");
		Objects.requireNonNull(whitespaceAfter, "whitespaceAfter must not be null");
	}

	/**
	 * The operator with the conventional spacing: a space after {@code not},
	 * none after the symbolic operators.
	 */
	public static UnaryOp of(Kind kind) {
		return new UnaryOp(kind, kind == Kind.NOT ? SimpleWhitespace.SPACE : SimpleWhitespace.EMPTY);
	}

	@Override
	public void codegen(CodegenState state) {
		state.add(kind.token());
		state.emit(whitespaceAfter);
	}
}
