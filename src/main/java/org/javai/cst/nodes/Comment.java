package org.javai.cst.nodes;

import java.util.Objects;
import org.javai.cst.codegen.CodegenState;

/**
 * A comment, including its leading {@code #}, up to but not including the line
 * break.
 */
public record Comment(String value) implements CstNode {

	public Comment {
		Objects.requireNonNull(value, "value must not be null");
		if (!value.startsWith("#")) {
			throw new IllegalArgumentException("A comment must start with '#'");
		}
		if (value.indexOf('\n') >= 0 || value.indexOf('\r') >= 0) {
			throw new IllegalArgumentException("A comment cannot contain a line break");
		}
	}

	@Override
	public void codegen(CodegenState state) {
		state.add(value);
	}
}
