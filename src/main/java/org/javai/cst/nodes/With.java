package org.javai.cst.nodes;

import java.util.List;
import java.util.Objects;
import org.javai.cst.codegen.CodegenState;

public record With(
	List<EmptyLine> leadingLines,
	@OptionalChild Asynchronous asynchronous,
	SimpleWhitespace whitespaceAfterWith,
	List<WithItem> items,
	SimpleWhitespace whitespaceBeforeColon,
	BaseSuite body
) implements BaseCompoundStatement {

	public With {
		leadingLines = List.copyOf(leadingLines);
		Objects.requireNonNull(whitespaceAfterWith, "whitespaceAfterWith must not be null");
		items = List.copyOf(items);
		if (items.isEmpty()) {
			throw new IllegalArgumentException("A with statement needs at least one item");
		}
		Objects.requireNonNull(whitespaceBeforeColon, "whitespaceBeforeColon must not be null");
		Objects.requireNonNull(body, "body must not be null");
	}

	@Override
	public void codegen(CodegenState state) {
		state.emitAll(leadingLines);
		state.addIndent();
		state.emitOptional(asynchronous);
		state.add("with");
		state.emit(whitespaceAfterWith);
		state.emitSeparated(items);
		state.emit(whitespaceBeforeColon);
		state.add(":");
		state.emit(body);
	}
}
