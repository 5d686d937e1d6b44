package org.javai.cst.nodes;

import java.util.List;
import java.util.Objects;
import org.javai.cst.codegen.CodegenState;

public record For(
	List<EmptyLine> leadingLines,
	@OptionalChild Asynchronous asynchronous,
	SimpleWhitespace whitespaceAfterFor,
	BaseExpression target,
	SimpleWhitespace whitespaceBeforeIn,
	SimpleWhitespace whitespaceAfterIn,
	BaseExpression iter,
	SimpleWhitespace whitespaceBeforeColon,
	BaseSuite body,
	@OptionalChild Else orelse
) implements BaseCompoundStatement {

	public For {
		leadingLines = List.copyOf(leadingLines);
		Objects.requireNonNull(whitespaceAfterFor, "whitespaceAfterFor must not be null");
		Objects.requireNonNull(target, "target must not be null");
		Objects.requireNonNull(whitespaceBeforeIn, "whitespaceBeforeIn must not be null");
		Objects.requireNonNull(whitespaceAfterIn, "whitespaceAfterIn must not be null");
		Objects.requireNonNull(iter, "iter must not be null");
		Objects.requireNonNull(whitespaceBeforeColon, "whitespaceBeforeColon must not be null");
		Objects.requireNonNull(body, "body must not be null");
	}

	@Override
	public void codegen(CodegenState state) {
		state.emitAll(leadingLines);
		state.addIndent();
		state.emitOptional(asynchronous);
		state.add("for");
		state.emit(whitespaceAfterFor);
		state.emit(target);
		state.emit(whitespaceBeforeIn);
		state.add("in");
		state.emit(whitespaceAfterIn);
		state.emit(iter);
		state.emit(whitespaceBeforeColon);
		state.add(":");
		state.emit(body);
		state.emitOptional(orelse);
	}
}
