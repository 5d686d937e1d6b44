package org.javai.cst.nodes;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.javai.cst.codegen.CodegenState;

/**
 * A class definition. Bases and keywords render inside one pair of parentheses;
 * when there are arguments but no explicit parentheses, plain ones are added.
 */
public record ClassDef(
	List<EmptyLine> leadingLines,
	List<Decorator> decorators,
	List<EmptyLine> linesAfterDecorators,
	SimpleWhitespace whitespaceAfterClass,
	Name name,
	SimpleWhitespace whitespaceAfterName,
	@OptionalChild LeftParen lpar,
	List<Arg> bases,
	List<Arg> keywords,
	@OptionalChild RightParen rpar,
	SimpleWhitespace whitespaceBeforeColon,
	BaseSuite body
) implements BaseCompoundStatement {

	public ClassDef {
		leadingLines = List.copyOf(leadingLines);
		decorators = List.copyOf(decorators);
		linesAfterDecorators = List.copyOf(linesAfterDecorators);
		Objects.requireNonNull(whitespaceAfterClass, "whitespaceAfterClass must not be null");
		Objects.requireNonNull(name, "name must not be null");
		Objects.requireNonNull(whitespaceAfterName, "whitespaceAfterName must not be null");
		bases = List.copyOf(bases);
		keywords = List.copyOf(keywords);
		if ((lpar == null) != (rpar == null)) {
			throw new IllegalArgumentException("Cannot have unbalanced parentheses");
		}
		for (Arg base : bases) {
			if (base.keyword() != null || base.star().equals("**")) {
				throw new IllegalArgumentException("Keyword arguments belong in keywords, not bases");
			}
		}
		for (Arg keyword : keywords) {
			if (keyword.keyword() == null && !keyword.star().equals("**")) {
				throw new IllegalArgumentException("Positional arguments belong in bases, not keywords");
			}
		}
		Objects.requireNonNull(whitespaceBeforeColon, "whitespaceBeforeColon must not be null");
		Objects.requireNonNull(body, "body must not be null");
	}

	@Override
	public void codegen(CodegenState state) {
		state.emitAll(leadingLines);
		state.emitAll(decorators);
		state.emitAll(linesAfterDecorators);
		state.addIndent();
		state.add("class");
		state.emit(whitespaceAfterClass);
		state.emit(name);
		state.emit(whitespaceAfterName);
		List<Arg> args = new ArrayList<>(bases);
		args.addAll(keywords);
		if (lpar != null) {
			state.emit(lpar);
		}
		else if (!args.isEmpty()) {
			state.add("(");
		}
		state.emitSeparated(args);
		if (rpar != null) {
			state.emit(rpar);
		}
		else if (!args.isEmpty()) {
			state.add(")");
		}
		state.emit(whitespaceBeforeColon);
		state.add(":");
		state.emit(body);
	}
}
