package org.javai.cst.nodes;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import org.javai.cst.codegen.CodegenState;

/**
 * An indented block of statements.
 *
 * @param header the rest of the header line after the colon
 * @param indent the indentation relative to the enclosing block, or null for the module default
 * @param body the statements; an empty block renders {@code pass}
 * @param footer blank and comment lines after the last statement that still belong to the block
 */
public record IndentedBlock(TrailingWhitespace header, String indent, List<BaseStatement> body, List<EmptyLine> footer)
		implements BaseSuite {

	public IndentedBlock {
		Objects.requireNonNull(header, "header must not be null");
		if (indent != null && (indent.isEmpty() || !indent.chars().allMatch(c -> c == ' ' || c == '\t' || c == '\f'))) {
			throw new IllegalArgumentException("indent must be non-empty whitespace");
		}
		body = List.copyOf(body);
		footer = List.copyOf(footer);
	}

	public static IndentedBlock of(BaseStatement... body) {
		return new IndentedBlock(TrailingWhitespace.plain(), null, Arrays.asList(body), List.of());
	}

	@Override
	public void codegen(CodegenState state) {
		state.emit(header);
		state.pushIndent(indent != null ? indent : state.defaultIndent());
		if (body.isEmpty()) {
			state.addIndent();
			state.add("pass");
			state.add(state.defaultNewline());
		}
		else {
			state.emitAll(body);
		}
		state.emitAll(footer);
		state.popIndent();
	}
}
