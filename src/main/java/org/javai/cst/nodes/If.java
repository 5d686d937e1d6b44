package org.javai.cst.nodes;

import java.util.List;
import java.util.Objects;
import org.javai.cst.codegen.CodegenState;

public record If(
	List<EmptyLine> leadingLines,
	SimpleWhitespace whitespaceBeforeTest,
	BaseExpression test,
	SimpleWhitespace whitespaceAfterTest,
	BaseSuite body,
	@OptionalChild BaseOrElse orelse
) implements BaseCompoundStatement {

	public If {
		leadingLines = List.copyOf(leadingLines);
		Objects.requireNonNull(whitespaceBeforeTest, "whitespaceBeforeTest must not be null");
		Objects.requireNonNull(test, "test must not be null");
		Objects.requireNonNull(whitespaceAfterTest, "whitespaceAfterTest must not be null");
		Objects.requireNonNull(body, "body must not be null");
	}

	@Override
	public void codegen(CodegenState state) {
		state.emitAll(leadingLines);
		state.addIndent();
		state.add("if");
		state.emit(whitespaceBeforeTest);
		state.emit(test);
		state.emit(whitespaceAfterTest);
		state.add(":");
		state.emit(body);
		state.emitOptional(orelse);
	}
}
