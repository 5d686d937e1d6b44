package org.javai.cst.nodes;

import java.util.List;
import java.util.Objects;
import org.javai.cst.codegen.CodegenState;

public record DictComp(
	List<LeftParen> lpar,
	LeftCurlyBrace lbrace,
	BaseExpression key,
	BaseParenthesizableWhitespace whitespaceBeforeColon,
	BaseParenthesizableWhitespace whitespaceAfterColon,
	BaseExpression value,
	CompFor forIn,
	RightCurlyBrace rbrace,
	List<RightParen> rpar
) implements BaseExpression {

	public DictComp {
		lpar = List.copyOf(lpar);
		Objects.requireNonNull(lbrace, "lbrace must not be null");
		Objects.requireNonNull(key, "key must not be null");
		Objects.requireNonNull(whitespaceBeforeColon, "whitespaceBeforeColon must not be null");
		Objects.requireNonNull(whitespaceAfterColon, "whitespaceAfterColon must not be null");
		Objects.requireNonNull(value, "value must not be null");
		Objects.requireNonNull(forIn, "forIn must not be null");
		Objects.requireNonNull(rbrace, "rbrace must not be null");
		rpar = List.copyOf(rpar);
		Parens.checkBalanced(lpar, rpar);
	}

	@Override
	public void codegen(CodegenState state) {
		state.emitAll(lpar);
		state.emit(lbrace);
		state.emit(key);
		state.emit(whitespaceBeforeColon);
		state.add(":");
		state.emit(whitespaceAfterColon);
		state.emit(value);
		state.emit(forIn);
		state.emit(rbrace);
		state.emitAll(rpar);
	}
}
