package org.javai.cst.nodes;

import java.util.Objects;
import org.javai.cst.codegen.CodegenState;

/**
 * The {@code as name} of an import alias, a with item or an except handler.
 */
public record AsName(BaseParenthesizableWhitespace whitespaceBeforeAs, BaseParenthesizableWhitespace whitespaceAfterAs,
		BaseExpression name) implements CstNode {

	public AsName {
		Objects.requireNonNull(whitespaceBeforeAs, "whitespaceBeforeAs must not be null");
		Objects.requireNonNull(whitespaceAfterAs, "whitespaceAfterAs must not be null");
		Objects.requireNonNull(name, "name must not be null");
	}

	public static AsName of(BaseExpression name) {
		return new AsName(SimpleWhitespace.SPACE, SimpleWhitespace.SPACE, name);
	}

	@Override
	public void codegen(CodegenState state) {
		state.emit(whitespaceBeforeAs);
		state.add("as");
		state.emit(whitespaceAfterAs);
		state.emit(name);
	}
}
