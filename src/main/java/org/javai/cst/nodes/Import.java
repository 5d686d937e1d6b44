package org.javai.cst.nodes;

import java.util.List;
import java.util.Objects;
import org.javai.cst.codegen.CodegenState;

public record Import(SimpleWhitespace whitespaceAfterImport, List<ImportAlias> names,
		@OptionalChild Semicolon semicolon) implements BaseSmallStatement {

	public Import {
		Objects.requireNonNull(whitespaceAfterImport, "whitespaceAfterImport must not be null");
		names = List.copyOf(names);
		if (names.isEmpty()) {
			throw new IllegalArgumentException("An import needs at least one name");
		}
	}

	@Override
	public void codegen(CodegenState state) {
		state.add("import");
		state.emit(whitespaceAfterImport);
		state.emitSeparated(names);
		state.emitOptional(semicolon);
	}
}
