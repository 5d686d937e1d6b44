package org.javai.cst.nodes;

import java.util.List;
import java.util.Map;
import org.javai.cst.codegen.CodegenState;
import org.javai.cst.visit.Replacement;

/**
 * A node of the concrete syntax tree.
 * <p>
 * Nodes are immutable records. Every record component is a slot: a required
 * child, an optional child (annotated {@link OptionalChild}), a sequence of
 * children ({@code List}) or a plain attribute. Together the slots and the fixed
 * token text a node renders account for every character of the source it was
 * parsed from.
 */
public sealed interface CstNode extends Replacement
		permits Annotation, AsName, AssignEqual, AssignTarget, Asynchronous, AugOp, BaseOrElse,
		BaseParenthesizableWhitespace, BaseSlice, BaseSmallStatement, BaseStatement, BaseSuite,
		BaseYieldValue, BinaryOp, BooleanOp, Colon, Comma, CommaSeparated, Comment, CompFor, CompIf,
		CompOp, ComparisonTarget, Decorator, Dot, EmptyLine, ExceptHandler, Finally, ImportStar,
		LeftCurlyBrace, LeftParen, LeftSquareBracket, Module, Newline, Parameters, RightCurlyBrace,
		RightParen, RightSquareBracket, Semicolon, TrailingWhitespace, UnaryOp {

	/**
	 * Appends the source text of this node, and only this node, to {@code state}.
	 * Children are rendered through {@link CodegenState#emit(CstNode)}.
	 */
	void codegen(CodegenState state);

	/**
	 * Child nodes in source order.
	 */
	default List<CstNode> children() {
		return CstNodes.children(this);
	}

	/**
	 * Returns a copy of this node with the named slots replaced. The original
	 * node is never modified.
	 *
	 * @throws ShapeException if a slot name is unknown or a value does not fit its slot
	 */
	default CstNode withChanges(Map<String, ?> changes) {
		return CstNodes.withChanges(this, changes);
	}
}
