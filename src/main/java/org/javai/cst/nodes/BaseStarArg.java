package org.javai.cst.nodes;

/**
 * The star slot of a parameter list: {@code *args} as a {@link Param} or a bare
 * {@code *} as a {@link ParamStar}.
 */
public sealed interface BaseStarArg extends CommaSeparated
		permits Param, ParamStar {
}
