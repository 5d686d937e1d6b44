package org.javai.cst.nodes;

import java.util.Objects;
import org.javai.cst.codegen.CodegenState;

/**
 * An imported name, a {@link Name} or dotted {@link Attribute}, with an optional alias.
 */
public record ImportAlias(BaseExpression name, @OptionalChild AsName asname, @OptionalChild Comma comma)
		implements CommaSeparated {

	public ImportAlias {
		Objects.requireNonNull(name, "name must not be null");
		if (!(name instanceof Name) && !(name instanceof Attribute)) {
			throw new IllegalArgumentException("An imported name must be a name or dotted name");
		}
		if (asname != null && !(asname.name() instanceof Name)) {
			throw new IllegalArgumentException("An import alias must be a plain name");
		}
	}

	@Override
	public void codegen(CodegenState state) {
		state.emit(name);
		state.emitOptional(asname);
		state.emitOptional(comma);
	}
}
