package org.javai.cst.nodes;

import java.util.List;
import java.util.Objects;
import org.javai.cst.codegen.CodegenState;

/**
 * Small statements on the same line as the header of a compound statement,
 * as in {@code if x: return y}.
 */
public record SimpleStatementSuite(SimpleWhitespace leadingWhitespace, List<BaseSmallStatement> body,
		TrailingWhitespace trailingWhitespace) implements BaseSuite {

	public SimpleStatementSuite {
		Objects.requireNonNull(leadingWhitespace, "leadingWhitespace must not be null");
		body = List.copyOf(body);
		Objects.requireNonNull(trailingWhitespace, "trailingWhitespace must not be null");
	}

	@Override
	public void codegen(CodegenState state) {
		state.emit(leadingWhitespace);
		if (body.isEmpty()) {
			state.add("pass");
		}
		else {
			state.emitStatements(body);
		}
		state.emit(trailingWhitespace);
	}
}
