package org.javai.cst.nodes;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import org.javai.cst.codegen.CodegenState;

/**
 * One line of small statements separated by semicolons. A line whose body is
 * empty renders {@code pass}.
 */
public record SimpleStatementLine(List<EmptyLine> leadingLines, List<BaseSmallStatement> body,
		TrailingWhitespace trailingWhitespace) implements BaseStatement {

	public SimpleStatementLine {
		leadingLines = List.copyOf(leadingLines);
		body = List.copyOf(body);
		Objects.requireNonNull(trailingWhitespace, "trailingWhitespace must not be null");
	}

	public static SimpleStatementLine of(BaseSmallStatement... body) {
		return new SimpleStatementLine(List.of(), Arrays.asList(body), TrailingWhitespace.plain());
	}

	@Override
	public void codegen(CodegenState state) {
		state.emitAll(leadingLines);
		state.addIndent();
		if (body.isEmpty()) {
			state.add("pass");
		}
		else {
			state.emitStatements(body);
		}
		state.emit(trailingWhitespace);
	}
}
