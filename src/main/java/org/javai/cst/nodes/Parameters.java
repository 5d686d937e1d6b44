package org.javai.cst.nodes;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;
import org.javai.cst.codegen.CodegenState;

/**
 * The parameter list of a function or lambda, split into the groups Python
 * distinguishes. Rendering flattens the groups in order; the parentheses belong
 * to the enclosing definition.
 */
public record Parameters(
	List<Param> posonlyParams,
	@OptionalChild ParamSlash posonlyInd,
	List<Param> params,
	@OptionalChild BaseStarArg starArg,
	List<Param> kwonlyParams,
	@OptionalChild Param starKwarg
) implements CstNode {

	public static final Parameters EMPTY = new Parameters(List.of(), null, List.of(), null, List.of(), null);

	public Parameters {
		posonlyParams = List.copyOf(posonlyParams);
		params = List.copyOf(params);
		kwonlyParams = List.copyOf(kwonlyParams);
		if (!posonlyParams.isEmpty() && posonlyInd == null) {
			throw new IllegalArgumentException("Positional-only parameters need a '/' marker");
		}
		if (!kwonlyParams.isEmpty() && starArg == null) {
			throw new IllegalArgumentException("Keyword-only parameters need a star argument before them");
		}
		Stream.of(posonlyParams, params, kwonlyParams).flatMap(List::stream).forEach(p -> {
			if (!p.star().isEmpty()) {
				throw new IllegalArgumentException("Parameter '" + p.name().value() + "' cannot be starred here");
			}
		});
		if (starArg instanceof Param p && !"*".equals(p.star())) {
			throw new IllegalArgumentException("The star argument must use '*'");
		}
		if (starKwarg != null && !"**".equals(starKwarg.star())) {
			throw new IllegalArgumentException("The star keyword argument must use '**'");
		}
	}

	public static Parameters of(List<Param> params) {
		return new Parameters(List.of(), null, params, null, List.of(), null);
	}

	public boolean hasAnnotations() {
		return flatten().stream().anyMatch(p -> p instanceof Param param && param.annotation() != null);
	}

	private List<CommaSeparated> flatten() {
		List<CommaSeparated> items = new ArrayList<>(posonlyParams);
		if (posonlyInd != null) {
			items.add(posonlyInd);
		}
		items.addAll(params);
		if (starArg != null) {
			items.add(starArg);
		}
		items.addAll(kwonlyParams);
		if (starKwarg != null) {
			items.add(starKwarg);
		}
		return items;
	}

	@Override
	public void codegen(CodegenState state) {
		state.emitSeparated(flatten());
	}
}
