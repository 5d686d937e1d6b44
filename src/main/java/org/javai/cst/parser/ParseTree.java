package org.javai.cst.parser;

import java.util.List;
import java.util.Objects;
import org.javai.cst.tokenize.Token;

/**
 * Untyped tree produced by a {@link ParsingStrategy}. A leaf wraps one token and
 * uses the token kind as its symbol; an inner node is named after the grammar
 * rule that produced it.
 *
 * @param symbol rule name, or token kind name for a leaf
 * @param token the token of a leaf, null for an inner node
 * @param children the children of an inner node in source order
 */
public record ParseTree(String symbol, Token token, List<ParseTree> children) {

	public ParseTree {
		Objects.requireNonNull(symbol, "symbol must not be null");
		children = children != null ? List.copyOf(children) : List.of();
	}

	public static ParseTree leaf(Token token) {
		return new ParseTree(token.kind().name(), token, List.of());
	}

	public static ParseTree node(String symbol, List<ParseTree> children) {
		return new ParseTree(symbol, null, children);
	}

	public boolean isLeaf() {
		return token != null;
	}

	/**
	 * True for a leaf holding the operator or keyword {@code literal}.
	 */
	public boolean isToken(String literal) {
		return token != null && token.is(literal);
	}

	public boolean is(String ruleName) {
		return token == null && symbol.equals(ruleName);
	}

	public ParseTree child(int index) {
		return children.get(index);
	}

	public int size() {
		return children.size();
	}

	public Token firstToken() {
		if (token != null) {
			return token;
		}
		return children.isEmpty() ? null : children.get(0).firstToken();
	}

	/**
	 * Indented outline of the tree, one node per line.
	 */
	public String dump() {
		StringBuilder sb = new StringBuilder();
		dump(sb, 0);
		return sb.toString();
	}

	private void dump(StringBuilder sb, int depth) {
		sb.append("  ".repeat(depth));
		if (token != null) {
			sb.append(token).append('\n');
			return;
		}
		sb.append(symbol).append('\n');
		for (ParseTree child : children) {
			child.dump(sb, depth + 1);
		}
	}
}
