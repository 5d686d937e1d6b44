package org.javai.cst.nodes;

import java.util.List;
import java.util.Objects;
import org.javai.cst.codegen.CodegenState;

/**
 * Whitespace inside brackets that spans lines: the rest of the first line, any
 * blank or comment lines, and the whitespace that starts the last line.
 */
public record ParenthesizedWhitespace(
	TrailingWhitespace firstLine,
	List<EmptyLine> emptyLines,
	boolean indent,
	SimpleWhitespace lastLine
) implements BaseParenthesizableWhitespace {

	public ParenthesizedWhitespace {
		Objects.requireNonNull(firstLine, "firstLine must not be null");
		emptyLines = List.copyOf(emptyLines);
		Objects.requireNonNull(lastLine, "lastLine must not be null");
	}

	@Override
	public boolean isEmpty() {
		return false;
	}

	@Override
	public void codegen(CodegenState state) {
		state.emit(firstLine);
		state.emitAll(emptyLines);
		if (indent) {
			state.addIndent();
		}
		state.emit(lastLine);
	}
}
