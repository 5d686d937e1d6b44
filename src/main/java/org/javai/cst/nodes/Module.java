package org.javai.cst.nodes;

import java.util.List;
import java.util.Objects;
import org.javai.cst.codegen.CodegenState;

/**
 * The root of a parsed source file.
 *
 * @param header blank and comment lines before the first statement
 * @param body the top-level statements
 * @param footer blank and comment lines after the last statement
 * @param encoding the source encoding, from a coding comment or {@code utf-8}
 * @param defaultIndent the indentation used for blocks without an explicit indent
 * @param defaultNewline the line ending used for newlines without an explicit value
 * @param hasTrailingNewline whether the source ended with a line break
 */
public record Module(
	List<EmptyLine> header,
	List<BaseStatement> body,
	List<EmptyLine> footer,
	String encoding,
	String defaultIndent,
	String defaultNewline,
	boolean hasTrailingNewline
) implements CstNode {

	public static final String DEFAULT_INDENT = "    ";
	public static final String DEFAULT_NEWLINE = "\n";
	public static final String DEFAULT_ENCODING = "utf-8";

	public Module {
		header = List.copyOf(header);
		body = List.copyOf(body);
		footer = List.copyOf(footer);
		Objects.requireNonNull(encoding, "encoding must not be null");
		Objects.requireNonNull(defaultIndent, "defaultIndent must not be null");
		Objects.requireNonNull(defaultNewline, "defaultNewline must not be null");
		if (!defaultNewline.equals("\n") && !defaultNewline.equals("\r\n") && !defaultNewline.equals("\r")) {
			throw new IllegalArgumentException("Unsupported default newline");
		}
	}

	public static Module of(List<? extends BaseStatement> body) {
		return new Module(List.of(), List.copyOf(body), List.of(), DEFAULT_ENCODING, DEFAULT_INDENT, DEFAULT_NEWLINE, true);
	}

	/**
	 * The source text of the whole module.
	 */
	public String code() {
		CodegenState state = new CodegenState(defaultIndent, defaultNewline);
		codegen(state);
		return state.code();
	}

	/**
	 * The source text of one node rendered with this module's defaults. Nested
	 * blocks are rendered at their own indentation only.
	 */
	public String codeForNode(CstNode node) {
		CodegenState state = new CodegenState(defaultIndent, defaultNewline);
		node.codegen(state);
		return state.code();
	}

	@Override
	public void codegen(CodegenState state) {
		state.emitAll(header);
		state.emitAll(body);
		state.emitAll(footer);
		if (!hasTrailingNewline) {
			state.dropTrailingNewline();
		}
	}
}
