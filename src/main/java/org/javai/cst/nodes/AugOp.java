package org.javai.cst.nodes;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;
import org.javai.cst.codegen.CodegenState;

/**
 * An augmented assignment operator such as {@code +=}.
 */
public record AugOp(Kind kind, BaseParenthesizableWhitespace whitespaceBefore,
		BaseParenthesizableWhitespace whitespaceAfter) implements CstNode {

	public enum Kind {
		ADD_ASSIGN("+="),
		SUBTRACT_ASSIGN("-="),
		MULTIPLY_ASSIGN("*="),
		MATRIX_MULTIPLY_ASSIGN("@="),
		DIVIDE_ASSIGN("/="),
		FLOOR_DIVIDE_ASSIGN("//="),
		MODULO_ASSIGN("%="),
		POWER_ASSIGN("**="),
		LEFT_SHIFT_ASSIGN("<<="),
		RIGHT_SHIFT_ASSIGN(">>="),
		BITWISE_OR_ASSIGN("|="),
		BITWISE_AND_ASSIGN("&="),
		BITWISE_XOR_ASSIGN("^=");

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

	public AugOp {
		Objects.requireNonNull(kind, "kind must not be null");
		Objects.requireNonNull(whitespaceBefore, "whitespaceBefore must not be null");
		Objects.requireNonNull(whitespaceAfter, "whitespaceAfter must not be null");
	}

	public static AugOp of(Kind kind) {
		return new AugOp(kind, SimpleWhitespace.SPACE, SimpleWhitespace.SPACE);
	}

	@Override
	public void codegen(CodegenState state) {
		state.emit(whitespaceBefore);
		state.add(kind.token());
		state.emit(whitespaceAfter);
	}
}
