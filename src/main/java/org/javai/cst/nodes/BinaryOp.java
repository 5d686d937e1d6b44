package org.javai.cst.nodes;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;
import org.javai.cst.codegen.CodegenState;

/**
 * A binary arithmetic or bitwise operator with the whitespace around it.
 */
public record BinaryOp(Kind kind, BaseParenthesizableWhitespace whitespaceBefore,
		BaseParenthesizableWhitespace whitespaceAfter) implements CstNode {

	public enum Kind {
		ADD("+"),
		SUBTRACT("-"),
		MULTIPLY("*"),
		MATRIX_MULTIPLY("@"),
		DIVIDE("/"),
		FLOOR_DIVIDE("//"),
		MODULO("%"),
		POWER("**"),
		LEFT_SHIFT("<<"),
		RIGHT_SHIFT(">>"),
		BITWISE_OR("|"),
		BITWISE_AND("&"),
		BITWISE_XOR("^");

		private final String token;

		Kind(String token) {
			this.token = token;
		}

		public String token() {
			return token;
		}

		public static Optional<Kind> fromToken(String token) {
			return Arrays.stream(values()).filter(k -> k.token.equals(token)).findFirst();
		}
	}

	public BinaryOp {
		Objects.requireNonNull(kind, "kind must not be null");
		Objects.requireNonNull(whitespaceBefore, "whitespaceBefore must not be null");
		Objects.requireNonNull(whitespaceAfter, "whitespaceAfter must not be null");
	}

	/**
	 * The operator surrounded by single spaces.
	 */
	public static BinaryOp of(Kind kind) {
		return new BinaryOp(kind, SimpleWhitespace.SPACE, SimpleWhitespace.SPACE);
	}

	@Override
	public void codegen(CodegenState state) {
		state.emit(whitespaceBefore);
		state.add(kind.token());
		state.emit(whitespaceAfter);
	}
}
