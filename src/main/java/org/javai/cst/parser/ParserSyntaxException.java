package org.javai.cst.parser;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import org.javai.cst.CstSyntaxException;
import org.javai.cst.tokenize.LineIndex;
import org.javai.cst.tokenize.Token;

/**
 * Thrown when a token sequence does not match the grammar. Reports the token
 * found at the farthest position any alternative reached and the terminals that
 * would have been accepted there.
 */
public class ParserSyntaxException extends CstSyntaxException {

	private final String found;
	private final Set<String> expected;

	public ParserSyntaxException(String message, int offset, int line, int column, String found, Set<String> expected) {
		super(message, offset, line, column);
		this.found = found;
		this.expected = expected != null ? Set.copyOf(expected) : Set.of();
	}

	/**
	 * Builds the exception for a failure at {@code token}, computing line and
	 * column from the token list.
	 */
	public static ParserSyntaxException at(List<Token> tokens, Token token, Set<String> expected) {
		LineIndex index = new LineIndex(sourceOf(tokens));
		String found = token.describe();
		return new ParserSyntaxException(describe(found, expected), token.start(),
				index.line(token.start()), index.column(token.start()), found, expected);
	}

	/**
	 * Builds the exception for a problem detected while building nodes from
	 * an otherwise valid parse.
	 */
	public static ParserSyntaxException invalid(List<Token> tokens, Token token, String message) {
		LineIndex index = new LineIndex(sourceOf(tokens));
		return new ParserSyntaxException(message, token.start(), index.line(token.start()),
				index.column(token.start()), token.describe(), Set.of());
	}

	@Override
	public ParserSyntaxException relocate(int offset, int line, int column) {
		return new ParserSyntaxException(rawMessage(), offset, line, column, found, expected);
	}

	public String found() {
		return found;
	}

	/**
	 * The acceptable terminals in sorted order.
	 */
	public Set<String> expected() {
		return new TreeSet<>(expected);
	}

	private static String describe(String found, Set<String> expected) {
		if (expected == null || expected.isEmpty()) {
			return "Syntax error: unexpected " + found;
		}
		Set<String> sorted = new TreeSet<>(expected);
		if (sorted.size() == 1) {
			return "Syntax error: expected " + sorted.iterator().next() + " but found " + found;
		}
		return "Syntax error: expected one of " + String.join(", ", sorted) + " but found " + found;
	}

	static String sourceOf(List<Token> tokens) {
		StringBuilder sb = new StringBuilder();
		for (Token token : tokens) {
			sb.append(token.leadingTrivia()).append(token.text()).append(token.trailingTrivia());
		}
		return sb.toString();
	}
}
