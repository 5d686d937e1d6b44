package org.javai.cst.nodes;

import java.util.List;

final class Parens {

	private Parens() {
	}

	static void checkBalanced(List<LeftParen> lpar, List<RightParen> rpar) {
		if (lpar.size() != rpar.size()) {
			throw new IllegalArgumentException("Cannot have unbalanced parentheses: "
					+ lpar.size() + " opening, " + rpar.size() + " closing");
		}
	}
}
