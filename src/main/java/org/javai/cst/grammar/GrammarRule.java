package org.javai.cst.grammar;

import java.util.List;

/**
 * A named rule with ordered alternatives.
 *
 * @param name the rule name, also the symbol of the parse tree nodes it builds
 * @param collapse whether a match with a single child is replaced by that child
 * @param alternatives the alternatives in priority order
 */
public record GrammarRule(String name, boolean collapse, List<Alternative> alternatives) {

	public GrammarRule {
		alternatives = List.copyOf(alternatives);
	}

	/**
	 * One alternative of a rule.
	 *
	 * @param expression the parsed notation
	 * @param since the first grammar version that has this alternative, or null for all
	 * @param notation the notation as written in the grammar resource
	 */
	public record Alternative(RuleExpression expression, GrammarVersion since, String notation) {

		public boolean isAvailableIn(GrammarVersion version) {
			return since == null || version.isAtLeast(since);
		}
	}
}
