package org.javai.cst.nodes;

import org.javai.cst.codegen.CodegenState;

/**
 * A line break. A null value renders the module's default line ending.
 */
public record Newline(String value) implements CstNode {

	public static final Newline DEFAULT = new Newline(null);

	public Newline {
		if (value != null && !value.isEmpty() && !value.equals("\n") && !value.equals("\r\n") && !value.equals("\r")) {
			throw new IllegalArgumentException("Unsupported line ending: " + value.replace("\r", "\\r").replace("\n", "\\n"));
		}
	}

	@Override
	public void codegen(CodegenState state) {
		state.add(value != null ? value : state.defaultNewline());
	}
}
