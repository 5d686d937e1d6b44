package org.javai.cst.parser;

import java.util.List;
import org.javai.cst.grammar.GrammarVersion;
import org.javai.cst.tokenize.Token;

/**
 * Strategy interface for turning a token list into a parse tree.
 * Implementations must agree on the tree they build for every input and on the
 * class of exception they raise when the input is rejected.
 */
public interface ParsingStrategy {

	/**
	 * Parses tokens according to the grammar of {@code version}.
	 *
	 * @param tokens the tokens to parse, ending with an ENDMARKER token
	 * @param version the grammar generation to accept
	 * @param mode what kind of snippet the tokens must form
	 * @return the parse tree rooted at the entry rule of {@code mode}
	 * @throws ParserSyntaxException if the tokens do not form a valid snippet
	 */
	ParseTree parse(List<Token> tokens, GrammarVersion version, ParseMode mode) throws ParserSyntaxException;
}
