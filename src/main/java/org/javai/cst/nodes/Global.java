package org.javai.cst.nodes;

import java.util.List;
import java.util.Objects;
import org.javai.cst.codegen.CodegenState;

public record Global(SimpleWhitespace whitespaceAfterGlobal, List<NameItem> names, @OptionalChild Semicolon semicolon)
		implements BaseSmallStatement {

	public Global {
		Objects.requireNonNull(whitespaceAfterGlobal, "whitespaceAfterGlobal must not be null");
		names = List.copyOf(names);
		if (names.isEmpty()) {
			throw new IllegalArgumentException("A global statement needs at least one name");
		}
	}

	@Override
	public void codegen(CodegenState state) {
		state.add("global");
		state.emit(whitespaceAfterGlobal);
		state.emitSeparated(names);
		state.emitOptional(semicolon);
	}
}
