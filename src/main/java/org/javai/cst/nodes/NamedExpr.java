package org.javai.cst.nodes;

import java.util.List;
import java.util.Objects;
import org.javai.cst.codegen.CodegenState;

/**
 * An assignment expression, {@code target := value}.
 */
public record NamedExpr(
	List<LeftParen> lpar,
	Name target,
	BaseParenthesizableWhitespace whitespaceBeforeWalrus,
	BaseParenthesizableWhitespace whitespaceAfterWalrus,
	BaseExpression value,
	List<RightParen> rpar
) implements BaseExpression {

	public NamedExpr {
		lpar = List.copyOf(lpar);
		Objects.requireNonNull(target, "target must not be null");
		Objects.requireNonNull(whitespaceBeforeWalrus, "whitespaceBeforeWalrus must not be null");
		Objects.requireNonNull(whitespaceAfterWalrus, "whitespaceAfterWalrus must not be null");
		Objects.requireNonNull(value, "value must not be null");
		rpar = List.copyOf(rpar);
		Parens.checkBalanced(lpar, rpar);
	}

	@Override
	public void codegen(CodegenState state) {
		state.emitAll(lpar);
		state.emit(target);
		state.emit(whitespaceBeforeWalrus);
		state.add(":=");
		state.emit(whitespaceAfterWalrus);
		state.emit(value);
		state.emitAll(rpar);
	}
}
