package org.javai.cst.nodes;

import java.util.List;
import java.util.Objects;
import org.javai.cst.codegen.CodegenState;

/**
 * Adjacent string literals, which Python joins into one. Longer runs nest to the
 * right: {@code "a" "b" "c"} is {@code "a"} followed by the concatenation of
 * {@code "b"} and {@code "c"}.
 */
public record ConcatenatedString(
	List<LeftParen> lpar,
	BaseString left,
	BaseParenthesizableWhitespace whitespaceBetween,
	BaseString right,
	List<RightParen> rpar
) implements BaseString {

	public ConcatenatedString {
		lpar = List.copyOf(lpar);
		Objects.requireNonNull(left, "left must not be null");
		Objects.requireNonNull(whitespaceBetween, "whitespaceBetween must not be null");
		Objects.requireNonNull(right, "right must not be null");
		rpar = List.copyOf(rpar);
		Parens.checkBalanced(lpar, rpar);
	}

	@Override
	public void codegen(CodegenState state) {
		state.emitAll(lpar);
		state.emit(left);
		state.emit(whitespaceBetween);
		state.emit(right);
		state.emitAll(rpar);
	}
}
