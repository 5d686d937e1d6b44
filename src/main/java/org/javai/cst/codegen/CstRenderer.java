package org.javai.cst.codegen;

import java.util.Objects;
import org.javai.cst.nodes.CstNode;
import org.javai.cst.nodes.Module;

/**
 * Renders nodes back to source text.
 */
public final class CstRenderer {

	private CstRenderer() {
	}

	/**
	 * The source text of {@code node}. A module renders with its own defaults;
	 * any other node with the library defaults, starting at indentation level
	 * zero.
	 */
	public static String render(CstNode node) {
		Objects.requireNonNull(node, "node must not be null");
		if (node instanceof Module module) {
			return module.code();
		}
		return render(node, Module.DEFAULT_INDENT, Module.DEFAULT_NEWLINE);
	}

	public static String render(CstNode node, String defaultIndent, String defaultNewline) {
		Objects.requireNonNull(node, "node must not be null");
		CodegenState state = new CodegenState(defaultIndent, defaultNewline);
		node.codegen(state);
		return state.code();
	}
}
