package org.javai.cst.nodes;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import org.javai.cst.codegen.CodegenState;

/**
 * A call, {@code func(args)}.
 */
public record Call(
	List<LeftParen> lpar,
	BaseExpression func,
	BaseParenthesizableWhitespace whitespaceAfterFunc,
	BaseParenthesizableWhitespace whitespaceBeforeArgs,
	List<Arg> args,
	List<RightParen> rpar
) implements BaseExpression {

	public Call {
		lpar = List.copyOf(lpar);
		Objects.requireNonNull(func, "func must not be null");
		Objects.requireNonNull(whitespaceAfterFunc, "whitespaceAfterFunc must not be null");
		Objects.requireNonNull(whitespaceBeforeArgs, "whitespaceBeforeArgs must not be null");
		args = List.copyOf(args);
		rpar = List.copyOf(rpar);
		Parens.checkBalanced(lpar, rpar);
	}

	public static Call of(BaseExpression func, Arg... args) {
		return new Call(List.of(), func, SimpleWhitespace.EMPTY, SimpleWhitespace.EMPTY, Arrays.asList(args), List.of());
	}

	@Override
	public void codegen(CodegenState state) {
		state.emitAll(lpar);
		state.emit(func);
		state.emit(whitespaceAfterFunc);
		state.add("(");
		state.emit(whitespaceBeforeArgs);
		state.emitSeparated(args);
		state.add(")");
		state.emitAll(rpar);
	}
}
