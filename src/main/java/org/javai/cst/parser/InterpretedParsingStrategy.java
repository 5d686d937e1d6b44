package org.javai.cst.parser;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import org.javai.cst.grammar.Grammar;
import org.javai.cst.grammar.GrammarRegistry;
import org.javai.cst.grammar.GrammarRule;
import org.javai.cst.grammar.GrammarVersion;
import org.javai.cst.grammar.RuleExpression;
import org.javai.cst.tokenize.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parsing strategy that executes a loaded {@link Grammar} directly.
 * <p>
 * Alternatives are tried in order and the first match wins. Rule results are
 * memoized per (rule, token position) for the duration of one call, so no rule
 * is evaluated twice at the same position. When nothing matches, the error
 * reports the farthest token any alternative reached together with every
 * terminal that was tried there.
 * <p>
 * This class is stateless; all per-call state lives in a {@code Run}.
 */
public class InterpretedParsingStrategy implements ParsingStrategy {

	private static final Logger logger = LoggerFactory.getLogger(InterpretedParsingStrategy.class);

	private final GrammarRegistry registry;

	/**
	 * Creates a strategy backed by the shared grammar registry.
	 */
	public InterpretedParsingStrategy() {
		this(GrammarRegistry.shared());
	}

	public InterpretedParsingStrategy(GrammarRegistry registry) {
		this.registry = Objects.requireNonNull(registry, "registry must not be null");
	}

	@Override
	public ParseTree parse(List<Token> tokens, GrammarVersion version, ParseMode mode) throws ParserSyntaxException {
		Objects.requireNonNull(tokens, "tokens must not be null");
		if (tokens.isEmpty()) {
			throw new IllegalArgumentException("Token list must end with an ENDMARKER token");
		}
		Grammar grammar = registry.requireGrammar(version);
		GrammarRule entry = grammar.entryRule(mode.name());
		Run run = new Run(grammar, tokens, version);
		List<ParseTree> out = new ArrayList<>(1);
		int end = run.matchRule(entry.name(), 0, out);
		if (end != tokens.size()) {
			throw run.error();
		}
		logger.debug("Parsed {} tokens as {} with {} memo entries", tokens.size(), mode, run.memo.size());
		return out.get(0);
	}

	private record Memo(ParseTree tree, int end) {
	}

	private static final Memo FAILED = new Memo(null, -1);

	private static final class Run {
		private final Grammar grammar;
		private final List<Token> tokens;
		private final GrammarVersion version;
		private final Map<String, Integer> ruleIndex = new HashMap<>();
		private final Map<Long, Memo> memo = new HashMap<>();
		private final Set<String> expected = new TreeSet<>();
		private int farthest = -1;

		Run(Grammar grammar, List<Token> tokens, GrammarVersion version) {
			this.grammar = grammar;
			this.tokens = tokens;
			this.version = version;
			int i = 0;
			for (String name : grammar.rules().keySet()) {
				ruleIndex.put(name, i++);
			}
		}

		int matchRule(String name, int pos, List<ParseTree> out) {
			long key = ((long) ruleIndex.get(name) << 32) | pos;
			Memo cached = memo.get(key);
			if (cached != null) {
				if (cached.end() < 0) {
					return -1;
				}
				out.add(cached.tree());
				return cached.end();
			}
			GrammarRule rule = grammar.requireRule(name);
			for (GrammarRule.Alternative alternative : rule.alternatives()) {
				if (!alternative.isAvailableIn(version)) {
					continue;
				}
				List<ParseTree> children = new ArrayList<>();
				int end = match(alternative.expression(), pos, children);
				if (end >= 0) {
					ParseTree tree = rule.collapse() && children.size() == 1
							? children.get(0)
							: ParseTree.node(name, children);
					memo.put(key, new Memo(tree, end));
					out.add(tree);
					return end;
				}
			}
			memo.put(key, FAILED);
			return -1;
		}

		private int match(RuleExpression expression, int pos, List<ParseTree> out) {
			if (expression instanceof RuleExpression.Literal literal) {
				Token token = tokenAt(pos);
				if (token.is(literal.text())) {
					out.add(ParseTree.leaf(token));
					return pos + 1;
				}
				fail(pos, "'" + literal.text() + "'");
				return -1;
			}
			if (expression instanceof RuleExpression.Terminal terminal) {
				Token token = tokenAt(pos);
				if (token.isKind(terminal.kind())) {
					out.add(ParseTree.leaf(token));
					return pos + 1;
				}
				fail(pos, terminal.kind().name());
				return -1;
			}
			if (expression instanceof RuleExpression.RuleRef ref) {
				return matchRule(ref.name(), pos, out);
			}
			int mark = out.size();
			if (expression instanceof RuleExpression.Sequence sequence) {
				int p = pos;
				for (RuleExpression item : sequence.items()) {
					p = match(item, p, out);
					if (p < 0) {
						truncate(out, mark);
						return -1;
					}
				}
				return p;
			}
			if (expression instanceof RuleExpression.Choice choice) {
				for (RuleExpression option : choice.options()) {
					int end = match(option, pos, out);
					if (end >= 0) {
						return end;
					}
					truncate(out, mark);
				}
				return -1;
			}
			if (expression instanceof RuleExpression.Repeat repeat) {
				int p = pos;
				int count = 0;
				while (true) {
					int itemMark = out.size();
					int end = match(repeat.item(), p, out);
					if (end < 0 || end == p) {
						truncate(out, itemMark);
						break;
					}
					p = end;
					count++;
				}
				if (count < repeat.min()) {
					truncate(out, mark);
					return -1;
				}
				return p;
			}
			if (expression instanceof RuleExpression.OptionalItem optional) {
				int end = match(optional.item(), pos, out);
				if (end < 0) {
					truncate(out, mark);
					return pos;
				}
				return end;
			}
			throw new IllegalStateException("Unknown rule expression: " + expression);
		}

		private Token tokenAt(int pos) {
			return tokens.get(Math.min(pos, tokens.size() - 1));
		}

		private void fail(int pos, String terminal) {
			if (pos > farthest) {
				farthest = pos;
				expected.clear();
			}
			if (pos == farthest) {
				expected.add(terminal);
			}
		}

		ParserSyntaxException error() {
			return ParserSyntaxException.at(tokens, tokenAt(Math.max(farthest, 0)), expected);
		}

		private static void truncate(List<ParseTree> out, int size) {
			while (out.size() > size) {
				out.remove(out.size() - 1);
			}
		}
	}
}
