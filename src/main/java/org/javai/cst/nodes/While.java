package org.javai.cst.nodes;

import java.util.List;
import java.util.Objects;
import org.javai.cst.codegen.CodegenState;

public record While(
	List<EmptyLine> leadingLines,
	SimpleWhitespace whitespaceAfterWhile,
	BaseExpression test,
	SimpleWhitespace whitespaceBeforeColon,
	BaseSuite body,
	@OptionalChild Else orelse
) implements BaseCompoundStatement {

	public While {
		leadingLines = List.copyOf(leadingLines);
		Objects.requireNonNull(whitespaceAfterWhile, "whitespaceAfterWhile must not be null");
		Objects.requireNonNull(test, "test must not be null");
		Objects.requireNonNull(whitespaceBeforeColon, "whitespaceBeforeColon must not be null");
		Objects.requireNonNull(body, "body must not be null");
	}

	@Override
	public void codegen(CodegenState state) {
		state.emitAll(leadingLines);
		state.addIndent();
		state.add("while");
		state.emit(whitespaceAfterWhile);
		state.emit(test);
		state.emit(whitespaceBeforeColon);
		state.add(":");
		state.emit(body);
		state.emitOptional(orelse);
	}
}
