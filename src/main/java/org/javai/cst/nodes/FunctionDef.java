package org.javai.cst.nodes;

import java.util.List;
import java.util.Objects;
import org.javai.cst.codegen.CodegenState;

/**
 * A function definition, possibly async and decorated.
 * <p>
 * {@code leadingLines} precede the first decorator, or the {@code def} line
 * when there are none; {@code linesAfterDecorators} sit between the last
 * decorator and the {@code def} line.
 */
public record FunctionDef(
	List<EmptyLine> leadingLines,
	List<Decorator> decorators,
	List<EmptyLine> linesAfterDecorators,
	@OptionalChild Asynchronous asynchronous,
	SimpleWhitespace whitespaceAfterDef,
	Name name,
	SimpleWhitespace whitespaceAfterName,
	BaseParenthesizableWhitespace whitespaceBeforeParams,
	Parameters params,
	@OptionalChild Annotation returns,
	SimpleWhitespace whitespaceBeforeColon,
	BaseSuite body
) implements BaseCompoundStatement {

	public FunctionDef {
		leadingLines = List.copyOf(leadingLines);
		decorators = List.copyOf(decorators);
		linesAfterDecorators = List.copyOf(linesAfterDecorators);
		Objects.requireNonNull(whitespaceAfterDef, "whitespaceAfterDef must not be null");
		Objects.requireNonNull(name, "name must not be null");
		Objects.requireNonNull(whitespaceAfterName, "whitespaceAfterName must not be null");
		Objects.requireNonNull(whitespaceBeforeParams, "whitespaceBeforeParams must not be null");
		Objects.requireNonNull(params, "params must not be null");
		if (returns != null && !"->".equals(returns.indicator())) {
			throw new IllegalArgumentException("A return annotation must use '->'");
		}
		Objects.requireNonNull(whitespaceBeforeColon, "whitespaceBeforeColon must not be null");
		Objects.requireNonNull(body, "body must not be null");
	}

	public static FunctionDef of(String name, Parameters params, BaseSuite body) {
		return new FunctionDef(List.of(), List.of(), List.of(), null, SimpleWhitespace.SPACE, Name.of(name),
				SimpleWhitespace.EMPTY, SimpleWhitespace.EMPTY, params, null, SimpleWhitespace.EMPTY, body);
	}

	@Override
	public void codegen(CodegenState state) {
		state.emitAll(leadingLines);
		state.emitAll(decorators);
		state.emitAll(linesAfterDecorators);
		state.addIndent();
		state.emitOptional(asynchronous);
		state.add("def");
		state.emit(whitespaceAfterDef);
		state.emit(name);
		state.emit(whitespaceAfterName);
		state.add("(");
		state.emit(whitespaceBeforeParams);
		state.emit(params);
		state.add(")");
		state.emitOptional(returns);
		state.emit(whitespaceBeforeColon);
		state.add(":");
		state.emit(body);
	}
}
