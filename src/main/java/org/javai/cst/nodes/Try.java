package org.javai.cst.nodes;

import java.util.List;
import java.util.Objects;
import org.javai.cst.codegen.CodegenState;

/**
 * A {@code try} statement with its handlers, {@code else} and {@code finally}
 * clauses.
 */
public record Try(
	List<EmptyLine> leadingLines,
	SimpleWhitespace whitespaceBeforeColon,
	BaseSuite body,
	List<ExceptHandler> handlers,
	@OptionalChild Else orelse,
	@OptionalChild Finally finalbody
) implements BaseCompoundStatement {

	public Try {
		leadingLines = List.copyOf(leadingLines);
		Objects.requireNonNull(whitespaceBeforeColon, "whitespaceBeforeColon must not be null");
		Objects.requireNonNull(body, "body must not be null");
		handlers = List.copyOf(handlers);
		if (handlers.isEmpty() && finalbody == null) {
			throw new IllegalArgumentException("A try statement needs an except or a finally clause");
		}
		if (handlers.isEmpty() && orelse != null) {
			throw new IllegalArgumentException("A try statement with an else clause needs an except clause");
		}
		for (int i = 0; i < handlers.size() - 1; i++) {
			if (handlers.get(i).type() == null) {
				throw new IllegalArgumentException("A bare except must be the last handler");
			}
		}
	}

	@Override
	public void codegen(CodegenState state) {
		state.emitAll(leadingLines);
		state.addIndent();
		state.add("try");
		state.emit(whitespaceBeforeColon);
		state.add(":");
		state.emit(body);
		state.emitAll(handlers);
		state.emitOptional(orelse);
		state.emitOptional(finalbody);
	}
}
