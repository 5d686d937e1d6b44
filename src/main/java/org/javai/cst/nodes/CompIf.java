package org.javai.cst.nodes;

import java.util.Objects;
import org.javai.cst.codegen.CodegenState;

public record CompIf(BaseParenthesizableWhitespace whitespaceBefore, BaseParenthesizableWhitespace whitespaceBeforeTest,
		BaseExpression test) implements CstNode {

	public CompIf {
		Objects.requireNonNull(whitespaceBefore, "whitespaceBefore must not be null");
		Objects.requireNonNull(whitespaceBeforeTest, "whitespaceBeforeTest must not be null");
		Objects.requireNonNull(test, "test must not be null");
	}

	@Override
	public void codegen(CodegenState state) {
		state.emit(whitespaceBefore);
		state.add("if");
		state.emit(whitespaceBeforeTest);
		state.emit(test);
	}
}
