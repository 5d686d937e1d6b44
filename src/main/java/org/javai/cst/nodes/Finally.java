package org.javai.cst.nodes;

import java.util.List;
import java.util.Objects;
import org.javai.cst.codegen.CodegenState;

public record Finally(List<EmptyLine> leadingLines, SimpleWhitespace whitespaceBeforeColon, BaseSuite body)
		implements CstNode {

	public Finally {
		leadingLines = List.copyOf(leadingLines);
		Objects.requireNonNull(whitespaceBeforeColon, "whitespaceBeforeColon must not be null");
		Objects.requireNonNull(body, "body must not be null");
	}

	@Override
	public void codegen(CodegenState state) {
		state.emitAll(leadingLines);
		state.addIndent();
		state.add("finally");
		state.emit(whitespaceBeforeColon);
		state.add(":");
		state.emit(body);
	}
}
