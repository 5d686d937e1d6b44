package org.javai.cst.nodes;

import java.util.List;
import java.util.Objects;
import org.javai.cst.codegen.CodegenState;

/**
 * An {@code else} clause of an {@code if}, loop or {@code try}.
 */
public record Else(List<EmptyLine> leadingLines, SimpleWhitespace whitespaceBeforeColon, BaseSuite body)
		implements BaseOrElse {

	public Else {
		leadingLines = List.copyOf(leadingLines);
		Objects.requireNonNull(whitespaceBeforeColon, "whitespaceBeforeColon must not be null");
		Objects.requireNonNull(body, "body must not be null");
	}

	@Override
	public void codegen(CodegenState state) {
		state.emitAll(leadingLines);
		state.addIndent();
		state.add("else");
		state.emit(whitespaceBeforeColon);
		state.add(":");
		state.emit(body);
	}
}
