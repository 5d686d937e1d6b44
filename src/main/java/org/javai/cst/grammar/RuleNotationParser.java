package org.javai.cst.grammar;

import java.util.ArrayList;
import java.util.List;
import org.javai.cst.tokenize.TokenKind;

/**
 * Parses the EBNF-like notation used for grammar alternatives.
 *
 * <pre>
 * choice   := sequence ('|' sequence)*
 * sequence := postfix+
 * postfix  := primary ('*' | '+')?
 * primary  := '(' choice ')' | '[' choice ']' | 'literal' | TOKEN_KIND | rule_name
 * </pre>
 */
public class RuleNotationParser {

	private final String input;
	private int pos = 0;

	public RuleNotationParser(String input) {
		this.input = input != null ? input : "";
	}

	public static RuleExpression parse(String notation) {
		return new RuleNotationParser(notation).parse();
	}

	public RuleExpression parse() {
		RuleExpression expression = parseChoice();
		skipWhitespace();
		if (!isAtEnd()) {
			throw error("Unexpected '" + peek() + "'");
		}
		return expression;
	}

	private RuleExpression parseChoice() {
		List<RuleExpression> options = new ArrayList<>();
		options.add(parseSequence());
		skipWhitespace();
		while (!isAtEnd() && peek() == '|') {
			pos++;
			options.add(parseSequence());
			skipWhitespace();
		}
		return options.size() == 1 ? options.get(0) : new RuleExpression.Choice(options);
	}

	private RuleExpression parseSequence() {
		List<RuleExpression> items = new ArrayList<>();
		while (true) {
			skipWhitespace();
			if (isAtEnd() || peek() == '|' || peek() == ')' || peek() == ']') {
				break;
			}
			items.add(parsePostfix());
		}
		if (items.isEmpty()) {
			throw error("Empty sequence");
		}
		return items.size() == 1 ? items.get(0) : new RuleExpression.Sequence(items);
	}

	private RuleExpression parsePostfix() {
		RuleExpression primary = parsePrimary();
		if (!isAtEnd() && peek() == '*') {
			pos++;
			return new RuleExpression.Repeat(primary, 0);
		}
		if (!isAtEnd() && peek() == '+') {
			pos++;
			return new RuleExpression.Repeat(primary, 1);
		}
		return primary;
	}

	private RuleExpression parsePrimary() {
		char c = peek();
		if (c == '(') {
			pos++;
			RuleExpression inner = parseChoice();
			expect(')');
			return inner;
		}
		if (c == '[') {
			pos++;
			RuleExpression inner = parseChoice();
			expect(']');
			return new RuleExpression.OptionalItem(inner);
		}
		if (c == '\'') {
			int end = input.indexOf('\'', pos + 1);
			if (end < 0) {
				throw error("Unterminated literal");
			}
			String text = input.substring(pos + 1, end);
			pos = end + 1;
			return new RuleExpression.Literal(text);
		}
		if (Character.isLetter(c) || c == '_') {
			int start = pos;
			while (!isAtEnd() && (Character.isLetterOrDigit(peek()) || peek() == '_')) {
				pos++;
			}
			String word = input.substring(start, pos);
			if (word.equals(word.toUpperCase())) {
				try {
					return new RuleExpression.Terminal(TokenKind.valueOf(word));
				}
				catch (IllegalArgumentException e) {
					throw error("Unknown token kind " + word);
				}
			}
			return new RuleExpression.RuleRef(word);
		}
		throw error("Unexpected '" + c + "'");
	}

	private void expect(char c) {
		skipWhitespace();
		if (isAtEnd() || peek() != c) {
			throw error("Expected '" + c + "'");
		}
		pos++;
	}

	private void skipWhitespace() {
		while (!isAtEnd() && Character.isWhitespace(peek())) {
			pos++;
		}
	}

	private char peek() {
		return isAtEnd() ? '\0' : input.charAt(pos);
	}

	private boolean isAtEnd() {
		return pos >= input.length();
	}

	private InvalidGrammarException error(String message) {
		return new InvalidGrammarException(message + " at position " + pos + " in \"" + input + "\"");
	}
}
