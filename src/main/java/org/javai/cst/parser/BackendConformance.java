package org.javai.cst.parser;

import java.util.List;
import java.util.Objects;
import org.javai.cst.grammar.GrammarVersion;
import org.javai.cst.helpers.CstJsonWriter;
import org.javai.cst.nodes.Module;
import org.javai.cst.tokenize.PythonTokenizer;
import org.javai.cst.tokenize.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs both parsing backends over the same tokens and checks that they agree.
 */
public final class BackendConformance {

	private static final Logger logger = LoggerFactory.getLogger(BackendConformance.class);

	private BackendConformance() {
	}

	public static ParseTree check(String source, ParseMode mode) {
		return check(source, mode, GrammarVersion.latest());
	}

	/**
	 * Parses {@code source} with every backend.
	 *
	 * @return the tree both backends built
	 * @throws ParserSyntaxException the interpreted backend's error, when both reject the input
	 * @throws BackendDivergenceException when the backends disagree
	 */
	public static ParseTree check(String source, ParseMode mode, GrammarVersion version) {
		Objects.requireNonNull(source, "source must not be null");
		Objects.requireNonNull(mode, "mode must not be null");
		List<Token> tokens = PythonTokenizer.tokenize(CstParser.prepare(source, mode, Module.DEFAULT_NEWLINE),
				version);
		return compare(tokens, version, mode, ParserBackend.INTERPRETED.newStrategy(),
				ParserBackend.COMPILED.newStrategy());
	}

	static ParseTree compare(List<Token> tokens, GrammarVersion version, ParseMode mode,
			ParsingStrategy interpretedStrategy, ParsingStrategy compiledStrategy) {
		Outcome interpreted = run(interpretedStrategy, tokens, version, mode);
		Outcome compiled = run(compiledStrategy, tokens, version, mode);
		if (interpreted.error() != null && compiled.error() != null) {
			if (interpreted.error().getClass() != compiled.error().getClass()) {
				throw new BackendDivergenceException("Backends failed differently", mode,
						interpreted.describe(), compiled.describe());
			}
			if (interpreted.error().offset() != compiled.error().offset()) {
				logger.debug("Backends rejected input at different offsets: {} and {}",
						interpreted.error().offset(), compiled.error().offset());
			}
			throw interpreted.error();
		}
		if (interpreted.error() != null || compiled.error() != null) {
			throw new BackendDivergenceException("Only one backend accepted the input", mode,
					interpreted.describe(), compiled.describe());
		}
		if (!interpreted.tree().equals(compiled.tree())) {
			throw new BackendDivergenceException("Backends built different parse trees", mode,
					interpreted.describe(), compiled.describe());
		}
		return interpreted.tree();
	}

	private static Outcome run(ParsingStrategy strategy, List<Token> tokens, GrammarVersion version, ParseMode mode) {
		try {
			return new Outcome(strategy.parse(tokens, version, mode), null);
		}
		catch (ParserSyntaxException e) {
			return new Outcome(null, e);
		}
	}

	private record Outcome(ParseTree tree, ParserSyntaxException error) {

		String describe() {
			return tree != null ? CstJsonWriter.write(tree) : error.getClass().getSimpleName() + ": " + error.getMessage();
		}
	}
}
