package org.javai.cst.nodes;

import java.util.List;
import java.util.Objects;
import org.javai.cst.codegen.CodegenState;

/**
 * A conditional expression, {@code body if test else orelse}.
 */
public record IfExp(
	List<LeftParen> lpar,
	BaseExpression body,
	BaseParenthesizableWhitespace whitespaceBeforeIf,
	BaseParenthesizableWhitespace whitespaceAfterIf,
	BaseExpression test,
	BaseParenthesizableWhitespace whitespaceBeforeElse,
	BaseParenthesizableWhitespace whitespaceAfterElse,
	BaseExpression orelse,
	List<RightParen> rpar
) implements BaseExpression {

	public IfExp {
		lpar = List.copyOf(lpar);
		Objects.requireNonNull(body, "body must not be null");
		Objects.requireNonNull(whitespaceBeforeIf, "whitespaceBeforeIf must not be null");
		Objects.requireNonNull(whitespaceAfterIf, "whitespaceAfterIf must not be null");
		Objects.requireNonNull(test, "test must not be null");
		Objects.requireNonNull(whitespaceBeforeElse, "whitespaceBeforeElse must not be null");
		Objects.requireNonNull(whitespaceAfterElse, "whitespaceAfterElse must not be null");
		Objects.requireNonNull(orelse, "orelse must not be null");
		rpar = List.copyOf(rpar);
		Parens.checkBalanced(lpar, rpar);
	}

	@Override
	public void codegen(CodegenState state) {
		state.emitAll(lpar);
		state.emit(body);
		state.emit(whitespaceBeforeIf);
		state.add("if");
		state.emit(whitespaceAfterIf);
		state.emit(test);
		state.emit(whitespaceBeforeElse);
		state.add("else");
		state.emit(whitespaceAfterElse);
		state.emit(orelse);
		state.emitAll(rpar);
	}
}
