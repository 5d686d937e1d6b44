package org.javai.cst.grammar;

import java.util.List;
import org.javai.cst.tokenize.TokenKind;

/**
 * The right-hand side of a grammar alternative.
 */
public sealed interface RuleExpression {

	/**
	 * Items matched one after another.
	 */
	record Sequence(List<RuleExpression> items) implements RuleExpression {
		public Sequence {
			items = List.copyOf(items);
		}
	}

	/**
	 * Ordered choice: the first option that matches wins.
	 */
	record Choice(List<RuleExpression> options) implements RuleExpression {
		public Choice {
			options = List.copyOf(options);
		}
	}

	/**
	 * Greedy repetition with a lower bound of zero or one.
	 */
	record Repeat(RuleExpression item, int min) implements RuleExpression {
	}

	/**
	 * Zero or one occurrence.
	 */
	record OptionalItem(RuleExpression item) implements RuleExpression {
	}

	record RuleRef(String name) implements RuleExpression {
	}

	/**
	 * Any token of the given kind.
	 */
	record Terminal(TokenKind kind) implements RuleExpression {
	}

	/**
	 * An operator or keyword token with exactly this text.
	 */
	record Literal(String text) implements RuleExpression {
	}
}
