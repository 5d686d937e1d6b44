package org.javai.cst.nodes;

import java.util.List;
import java.util.Objects;
import org.javai.cst.codegen.CodegenState;

public record ExceptHandler(
	List<EmptyLine> leadingLines,
	SimpleWhitespace whitespaceAfterExcept,
	@OptionalChild BaseExpression type,
	@OptionalChild AsName name,
	SimpleWhitespace whitespaceBeforeColon,
	BaseSuite body
) implements CstNode {

	public ExceptHandler {
		leadingLines = List.copyOf(leadingLines);
		Objects.requireNonNull(whitespaceAfterExcept, "whitespaceAfterExcept must not be null");
		Objects.requireNonNull(whitespaceBeforeColon, "whitespaceBeforeColon must not be null");
		Objects.requireNonNull(body, "body must not be null");
		if (name != null && type == null) {
			throw new IllegalArgumentException("An except clause with a name needs an exception type");
		}
		if (name != null && !(name.name() instanceof Name)) {
			throw new IllegalArgumentException("An except clause can only bind a plain name");
		}
	}

	@Override
	public void codegen(CodegenState state) {
		state.emitAll(leadingLines);
		state.addIndent();
		state.add("except");
		state.emit(whitespaceAfterExcept);
		state.emitOptional(type);
		state.emitOptional(name);
		state.emit(whitespaceBeforeColon);
		state.add(":");
		state.emit(body);
	}
}
