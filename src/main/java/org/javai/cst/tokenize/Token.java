package org.javai.cst.tokenize;

import java.util.Objects;

/**
 * A token of Python source together with the trivia around it.
 *
 * @param kind the lexical category
 * @param text the exact source text of the token (empty for synthetic tokens)
 * @param leadingTrivia blank lines, comment lines and indentation before the token
 * @param trailingTrivia same-line whitespace and comment after the token
 * @param start offset of the first character of {@code text}
 * @param end offset just past {@code text}
 */
public record Token(TokenKind kind, String text, String leadingTrivia, String trailingTrivia, int start, int end) {

	public Token {
		Objects.requireNonNull(kind, "kind must not be null");
		Objects.requireNonNull(text, "text must not be null");
		leadingTrivia = leadingTrivia != null ? leadingTrivia : "";
		trailingTrivia = trailingTrivia != null ? trailingTrivia : "";
	}

	public boolean isKind(TokenKind expected) {
		return kind == expected;
	}

	/**
	 * True for an operator, delimiter or keyword with the given text.
	 */
	public boolean is(String literal) {
		return (kind == TokenKind.OP || kind == TokenKind.KEYWORD) && text.equals(literal);
	}

	Token withTrailingTrivia(String trivia) {
		return new Token(kind, text, leadingTrivia, trivia, start, end);
	}

	/**
	 * Short description used in diagnostics.
	 */
	public String describe() {
		return switch (kind) {
			case ENDMARKER -> "end of input";
			case NEWLINE -> "end of line";
			case INDENT -> "indent";
			case DEDENT -> "dedent";
			case OP, KEYWORD -> "'" + text + "'";
			default -> kind + "(" + text + ")";
		};
	}

	@Override
	public String toString() {
		return switch (kind) {
			case NAME, NUMBER, KEYWORD, OP -> kind + "(" + text + ")";
			case STRING -> "STRING(" + text + ")";
			default -> kind.toString();
		};
	}
}
