package org.javai.cst.nodes;

import java.util.List;
import java.util.Objects;
import org.javai.cst.codegen.CodegenState;

public record Nonlocal(SimpleWhitespace whitespaceAfterNonlocal, List<NameItem> names, @OptionalChild Semicolon semicolon)
		implements BaseSmallStatement {

	public Nonlocal {
		Objects.requireNonNull(whitespaceAfterNonlocal, "whitespaceAfterNonlocal must not be null");
		names = List.copyOf(names);
		if (names.isEmpty()) {
			throw new IllegalArgumentException("A nonlocal statement needs at least one name");
		}
	}

	@Override
	public void codegen(CodegenState state) {
		state.add("nonlocal");
		state.emit(whitespaceAfterNonlocal);
		state.emitSeparated(names);
		state.emitOptional(semicolon);
	}
}
