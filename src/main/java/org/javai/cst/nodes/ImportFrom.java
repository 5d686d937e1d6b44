package org.javai.cst.nodes;

import java.util.List;
import java.util.Objects;
import org.javai.cst.codegen.CodegenState;

/**
 * {@code from module import names}, possibly relative and possibly importing
 * {@code *}. A {@code ...} in the relative part is held as three {@link Dot}s.
 */
public record ImportFrom(
	SimpleWhitespace whitespaceAfterFrom,
	List<Dot> relative,
	@OptionalChild BaseExpression module,
	SimpleWhitespace whitespaceBeforeImport,
	SimpleWhitespace whitespaceAfterImport,
	@OptionalChild LeftParen lpar,
	List<ImportAlias> names,
	@OptionalChild ImportStar star,
	@OptionalChild RightParen rpar,
	@OptionalChild Semicolon semicolon
) implements BaseSmallStatement {

	public ImportFrom {
		Objects.requireNonNull(whitespaceAfterFrom, "whitespaceAfterFrom must not be null");
		relative = List.copyOf(relative);
		Objects.requireNonNull(whitespaceBeforeImport, "whitespaceBeforeImport must not be null");
		Objects.requireNonNull(whitespaceAfterImport, "whitespaceAfterImport must not be null");
		names = List.copyOf(names);
		if (module == null && relative.isEmpty()) {
			throw new IllegalArgumentException("Must have a module or a relative import");
		}
		if (module != null && !(module instanceof Name) && !(module instanceof Attribute)) {
			throw new IllegalArgumentException("The imported module must be a name or dotted name");
		}
		if ((star == null) == names.isEmpty()) {
			throw new IllegalArgumentException("Must import either '*' or at least one name");
		}
		if ((lpar == null) != (rpar == null)) {
			throw new IllegalArgumentException("Cannot have unbalanced parentheses");
		}
		if (star != null && lpar != null) {
			throw new IllegalArgumentException("Cannot parenthesize '*'");
		}
	}

	@Override
	public void codegen(CodegenState state) {
		state.add("from");
		state.emit(whitespaceAfterFrom);
		state.emitAll(relative);
		state.emitOptional(module);
		state.emit(whitespaceBeforeImport);
		state.add("import");
		state.emit(whitespaceAfterImport);
		state.emitOptional(lpar);
		if (star != null) {
			state.emit(star);
		}
		else {
			state.emitSeparated(names);
		}
		state.emitOptional(rpar);
		state.emitOptional(semicolon);
	}
}
