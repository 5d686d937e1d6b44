package org.javai.cst.nodes;

import java.util.List;
import java.util.Objects;
import org.javai.cst.codegen.CodegenState;

/**
 * An {@code elif} clause. It chains to the next {@code elif} or {@code else}
 * through {@code orelse}.
 */
public record Elif(
	List<EmptyLine> leadingLines,
	SimpleWhitespace whitespaceBeforeTest,
	BaseExpression test,
	SimpleWhitespace whitespaceAfterTest,
	BaseSuite body,
	@OptionalChild BaseOrElse orelse
) implements BaseOrElse {

	public Elif {
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
		state.add("elif");
		state.emit(whitespaceBeforeTest);
		state.emit(test);
		state.emit(whitespaceAfterTest);
		state.add(":");
		state.emit(body);
		state.emitOptional(orelse);
	}
}
