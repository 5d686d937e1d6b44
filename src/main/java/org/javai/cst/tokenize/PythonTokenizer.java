package org.javai.cst.tokenize;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.javai.cst.grammar.GrammarVersion;

/**
 * Tokenizer for Python source that keeps every byte of the input.
 * <p>
 * Whitespace and a comment that follow a token on the same physical line become
 * that token's trailing trivia. Everything after a line break (blank lines,
 * comment-only lines and the indentation of the next line) becomes the leading
 * trivia of the next token. Concatenating, for every token, its leading trivia,
 * text and trailing trivia reproduces the input exactly.
 * <p>
 * Blank lines, comment lines and line breaks inside brackets do not produce
 * {@link TokenKind#NEWLINE} tokens and do not affect indentation.
 */
public class PythonTokenizer {

	public static final Set<String> KEYWORDS = Set.of(
			"False", "None", "True", "and", "as", "assert", "async", "await", "break", "class",
			"continue", "def", "del", "elif", "else", "except", "finally", "for", "from", "global",
			"if", "import", "in", "is", "lambda", "nonlocal", "not", "or", "pass", "raise",
			"return", "try", "while", "with", "yield");

	private static final String[] OPERATORS_3 = { "**=", "//=", ">>=", "<<=", "..." };
	private static final String[] OPERATORS_2 = {
			"**", "//", "<<", ">>", "<=", ">=", "==", "!=", "->", "+=", "-=", "*=", "/=", "%=",
			"&=", "|=", "^=", "@=", ":=" };
	private static final String OPERATORS_1 = "+-*/%@&|^~<>()[]{},:.;=";

	private static final String DIGITS = "[0-9](?:_?[0-9])*";
	private static final String EXPONENT = "[eE][-+]?" + DIGITS;
	private static final Pattern NUMBER = Pattern.compile(
			"0[xX](?:_?[0-9a-fA-F])+"
					+ "|0[oO](?:_?[0-7])+"
					+ "|0[bB](?:_?[01])+"
					+ "|(?:(?:" + DIGITS + "\\.(?:" + DIGITS + ")?|\\." + DIGITS + ")(?:" + EXPONENT + ")?"
					+ "|" + DIGITS + EXPONENT + ")[jJ]?"
					+ "|" + DIGITS + "[jJ]?");

	private static final Set<String> STRING_PREFIXES = Set.of(
			"r", "u", "b", "f", "br", "rb", "fr", "rf");

	private final String input;
	private final GrammarVersion version;
	private final LineIndex lineIndex;

	private final List<Token> tokens = new ArrayList<>();
	private final List<String> indents = new ArrayList<>();
	private final StringBuilder leading = new StringBuilder();
	private int pos = 0;
	private int depth = 0;
	private boolean atLineStart = true;
	private boolean lineHasTokens = false;

	public PythonTokenizer(String input, GrammarVersion version) {
		this.input = input != null ? input : "";
		this.version = version != null ? version : GrammarVersion.latest();
		this.lineIndex = new LineIndex(this.input);
		this.indents.add("");
	}

	/**
	 * Tokenizes {@code text} for the given grammar version.
	 *
	 * @throws LexicalException if the text contains an invalid token
	 */
	public static List<Token> tokenize(String text, GrammarVersion version) {
		return new PythonTokenizer(text, version).tokenize();
	}

	/**
	 * Tokenizes the whole input. The result always ends with an
	 * {@link TokenKind#ENDMARKER} token.
	 */
	public List<Token> tokenize() {
		if (!tokens.isEmpty()) {
			return List.copyOf(tokens);
		}
		while (true) {
			if (atLineStart && depth == 0) {
				if (!startLine()) {
					break;
				}
			}
			if (isAtEnd()) {
				break;
			}
			char c = peek();
			if (isNewlineChar(c)) {
				String newline = consumeNewline();
				if (depth == 0) {
					addToken(TokenKind.NEWLINE, newline, pos - newline.length(), false);
					atLineStart = true;
					lineHasTokens = false;
				}
				else {
					leading.append(newline);
					continuationLines();
				}
				continue;
			}
			scanToken();
			attachTrailing();
		}
		finish();
		return List.copyOf(tokens);
	}

	/**
	 * Consumes blank and comment-only lines, then the indentation of the next
	 * logical line, emitting INDENT or DEDENT tokens. Returns false at end of input.
	 */
	private boolean startLine() {
		while (true) {
			int lineStart = pos;
			while (!isAtEnd() && isSpace(peek())) {
				pos++;
			}
			if (isAtEnd()) {
				leading.append(input, lineStart, pos);
				return false;
			}
			char c = peek();
			if (c == '#' || isNewlineChar(c)) {
				while (!isAtEnd() && !isNewlineChar(peek())) {
					pos++;
				}
				if (!isAtEnd()) {
					consumeNewline();
				}
				leading.append(input, lineStart, pos);
				if (isAtEnd()) {
					return false;
				}
				continue;
			}
			String indent = input.substring(lineStart, pos);
			leading.append(indent);
			adjustIndentation(indent);
			atLineStart = false;
			return true;
		}
	}

	private void adjustIndentation(String indent) {
		String current = indents.get(indents.size() - 1);
		if (indent.equals(current)) {
			return;
		}
		if (indent.startsWith(current)) {
			indents.add(indent);
			addSynthetic(TokenKind.INDENT);
			return;
		}
		if (!current.startsWith(indent)) {
			throw LexicalException.at("inconsistent indentation", lineIndex, pos);
		}
		while (indents.size() > 1 && indents.get(indents.size() - 1).length() > indent.length()) {
			indents.remove(indents.size() - 1);
			addSynthetic(TokenKind.DEDENT);
		}
		if (!indents.get(indents.size() - 1).equals(indent)) {
			throw LexicalException.at("unindent does not match any outer indentation level", lineIndex, pos);
		}
	}

	/**
	 * Inside brackets a line break is trivia, as are the blank and comment lines
	 * that follow it.
	 */
	private void continuationLines() {
		while (!isAtEnd()) {
			int start = pos;
			while (!isAtEnd() && isSpace(peek())) {
				pos++;
			}
			if (!isAtEnd() && peek() == '#') {
				while (!isAtEnd() && !isNewlineChar(peek())) {
					pos++;
				}
			}
			leading.append(input, start, pos);
			if (isAtEnd() || !isNewlineChar(peek())) {
				return;
			}
			leading.append(consumeNewline());
		}
	}

	/**
	 * Collects the same-line whitespace, continuations and comment after the last
	 * token into that token's trailing trivia.
	 */
	private void attachTrailing() {
		int start = pos;
		while (!isAtEnd()) {
			char c = peek();
			if (isSpace(c)) {
				pos++;
			}
			else if (c == '\\' && pos + 1 < input.length() && isNewlineChar(input.charAt(pos + 1))) {
				pos++;
				consumeNewline();
			}
			else if (c == '#') {
				while (!isAtEnd() && !isNewlineChar(peek())) {
					pos++;
				}
				break;
			}
			else {
				break;
			}
		}
		if (pos > start) {
			int last = tokens.size() - 1;
			Token token = tokens.get(last);
			tokens.set(last, token.withTrailingTrivia(input.substring(start, pos)));
		}
	}

	private void scanToken() {
		int start = pos;
		char c = peek();
		if (isIdentifierStart(c)) {
			scanNameOrString(start);
		}
		else if (isDigit(c) || (c == '.' && pos + 1 < input.length() && isDigit(input.charAt(pos + 1)))) {
			scanNumber(start);
		}
		else if (c == '"' || c == '\'') {
			scanString(start);
		}
		else {
			scanOperator(start);
		}
	}

	private void scanNameOrString(int start) {
		while (!isAtEnd() && isIdentifierPart(peek())) {
			pos++;
		}
		String name = input.substring(start, pos);
		if (!isAtEnd() && (peek() == '"' || peek() == '\'')
				&& STRING_PREFIXES.contains(name.toLowerCase())) {
			scanString(start);
			return;
		}
		addToken(KEYWORDS.contains(name) ? TokenKind.KEYWORD : TokenKind.NAME, name, start, true);
	}

	private void scanNumber(int start) {
		Matcher matcher = NUMBER.matcher(input);
		matcher.region(start, input.length());
		if (!matcher.lookingAt()) {
			throw LexicalException.at("invalid number literal", lineIndex, start);
		}
		pos = matcher.end();
		if (!isAtEnd() && isIdentifierPart(peek()) && !isDigit(peek()) && !keywordFollows()) {
			throw LexicalException.at("invalid number literal", lineIndex, start);
		}
		addToken(TokenKind.NUMBER, input.substring(start, pos), start, true);
	}

	// "1if x else 2" is a number directly followed by a keyword
	private boolean keywordFollows() {
		int end = pos;
		while (end < input.length() && isIdentifierPart(input.charAt(end))) {
			end++;
		}
		return KEYWORDS.contains(input.substring(pos, end));
	}

	private void scanString(int start) {
		char quote = peek();
		boolean triple = input.startsWith(String.valueOf(quote).repeat(3), pos);
		pos += triple ? 3 : 1;
		while (true) {
			if (isAtEnd()) {
				throw LexicalException.at(triple
						? "unterminated triple-quoted string literal"
						: "unterminated string literal", lineIndex, start);
			}
			char c = peek();
			if (c == '\\') {
				pos++;
				if (!isAtEnd()) {
					if (isNewlineChar(peek())) {
						consumeNewline();
					}
					else {
						pos++;
					}
				}
				continue;
			}
			if (!triple && isNewlineChar(c)) {
				throw LexicalException.at("unterminated string literal", lineIndex, start);
			}
			if (c == quote) {
				if (!triple) {
					pos++;
					break;
				}
				if (input.startsWith(String.valueOf(quote).repeat(3), pos)) {
					pos += 3;
					break;
				}
			}
			pos++;
		}
		addToken(TokenKind.STRING, input.substring(start, pos), start, true);
	}

	private void scanOperator(int start) {
		String op = matchOperator();
		if (op == null) {
			if (peek() == '\\') {
				throw LexicalException.at("unexpected character after line continuation", lineIndex, start);
			}
			throw LexicalException.at("invalid character '" + peek() + "'", lineIndex, start);
		}
		pos += op.length();
		switch (op) {
			case "(", "[", "{" -> depth++;
			case ")", "]", "}" -> depth = Math.max(0, depth - 1);
			default -> {
			}
		}
		addToken(TokenKind.OP, op, start, true);
	}

	private String matchOperator() {
		for (String op : OPERATORS_3) {
			if (input.startsWith(op, pos)) {
				return op;
			}
		}
		for (String op : OPERATORS_2) {
			if (input.startsWith(op, pos) && (!op.equals(":=") || version.isAtLeast(GrammarVersion.PYTHON_3_8))) {
				return op;
			}
		}
		return OPERATORS_1.indexOf(peek()) >= 0 ? String.valueOf(peek()) : null;
	}

	private void finish() {
		if (lineHasTokens && depth == 0) {
			addToken(TokenKind.NEWLINE, "", pos, false);
		}
		while (indents.size() > 1) {
			indents.remove(indents.size() - 1);
			addSynthetic(TokenKind.DEDENT);
		}
		tokens.add(new Token(TokenKind.ENDMARKER, "", leading.toString(), "", input.length(), input.length()));
		leading.setLength(0);
	}

	private void addToken(TokenKind kind, String text, int start, boolean real) {
		String lead = "";
		if (real) {
			lead = leading.toString();
			leading.setLength(0);
			lineHasTokens = true;
		}
		tokens.add(new Token(kind, text, lead, "", start, start + text.length()));
	}

	private void addSynthetic(TokenKind kind) {
		tokens.add(new Token(kind, "", "", "", pos, pos));
	}

	private String consumeNewline() {
		int start = pos;
		if (peek() == '\r' && pos + 1 < input.length() && input.charAt(pos + 1) == '\n') {
			pos += 2;
		}
		else {
			pos++;
		}
		return input.substring(start, pos);
	}

	private char peek() {
		return isAtEnd() ? '\0' : input.charAt(pos);
	}

	private boolean isAtEnd() {
		return pos >= input.length();
	}

	private static boolean isSpace(char c) {
		return c == ' ' || c == '\t' || c == '\f';
	}

	private static boolean isNewlineChar(char c) {
		return c == '\n' || c == '\r';
	}

	private static boolean isDigit(char c) {
		return c >= '0' && c <= '9';
	}

	private static boolean isIdentifierStart(char c) {
		return c == '_' || Character.isUnicodeIdentifierStart(c);
	}

	private static boolean isIdentifierPart(char c) {
		return c == '_' || (Character.isUnicodeIdentifierPart(c) && !Character.isIdentifierIgnorable(c));
	}
}
