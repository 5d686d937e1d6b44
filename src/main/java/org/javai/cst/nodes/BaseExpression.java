package org.javai.cst.nodes;

import java.util.List;

/**
 * An expression. Every expression may be wrapped in any number of balanced
 * parentheses, held in {@link #lpar()} and {@link #rpar()}.
 */
public sealed interface BaseExpression extends BaseYieldValue
		permits Attribute, Await, BaseString, BinaryOperation, BooleanOperation, Call, Comparison,
		DictComp, DictExpr, Ellipsis, FloatLiteral, GeneratorExp, IfExp, ImaginaryLiteral,
		IntegerLiteral, Lambda, ListComp, ListExpr, Name, NamedExpr, SetComp, SetExpr, Subscript,
		TupleExpr, UnaryOperation, Yield {

	List<LeftParen> lpar();

	List<RightParen> rpar();
}
