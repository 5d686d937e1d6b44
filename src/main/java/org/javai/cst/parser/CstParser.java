package org.javai.cst.parser;

import java.util.List;
import java.util.Objects;
import org.javai.cst.CstSyntaxException;
import org.javai.cst.nodes.BaseExpression;
import org.javai.cst.nodes.BaseStatement;
import org.javai.cst.nodes.CstNode;
import org.javai.cst.nodes.Module;
import org.javai.cst.tokenize.LineIndex;
import org.javai.cst.tokenize.PythonTokenizer;
import org.javai.cst.tokenize.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for turning Python source into a concrete syntax tree.
 * <p>
 * Every method tokenizes the source, runs the configured backend and builds
 * nodes from the result. The tree renders back to exactly the source it was
 * parsed from. Module and statement sources that do not end with a line break
 * get one for parsing; a module remembers this and drops it again on output.
 */
public final class CstParser {

	private static final Logger logger = LoggerFactory.getLogger(CstParser.class);

	private CstParser() {
	}

	public static Module parseModule(String source) {
		return parseModule(source, ParserConfig.defaults());
	}

	/**
	 * @throws org.javai.cst.tokenize.LexicalException if the source cannot be tokenized
	 * @throws ParserSyntaxException if the tokens do not form a module
	 */
	public static Module parseModule(String source, ParserConfig config) {
		return (Module) parse(source, ParseMode.MODULE, config);
	}

	public static BaseStatement parseStatement(String source) {
		return parseStatement(source, ParserConfig.defaults());
	}

	/**
	 * Parses one simple statement line or one compound statement. Leading
	 * comments and blank lines are allowed; anything after the statement is not.
	 */
	public static BaseStatement parseStatement(String source, ParserConfig config) {
		return (BaseStatement) parse(source, ParseMode.STATEMENT, config);
	}

	public static BaseExpression parseExpression(String source) {
		return parseExpression(source, ParserConfig.defaults());
	}

	/**
	 * Parses a single expression, or an unparenthesized tuple, with no
	 * surrounding whitespace or line breaks.
	 */
	public static BaseExpression parseExpression(String source, ParserConfig config) {
		return (BaseExpression) parse(source, ParseMode.EXPRESSION, config);
	}

	/**
	 * Like the {@code parse*} methods, returning syntax errors as a value.
	 */
	public static ParseResult<CstNode> tryParse(String source, ParseMode mode, ParserConfig config) {
		try {
			return ParseResult.success(parse(source, mode, config));
		}
		catch (CstSyntaxException e) {
			logger.debug("Rejected {} source: {}", mode, e.getMessage());
			return ParseResult.failure(e);
		}
	}

	public static ParseResult<Module> tryParseModule(String source) {
		try {
			return ParseResult.success(parseModule(source));
		}
		catch (CstSyntaxException e) {
			logger.debug("Rejected module source: {}", e.getMessage());
			return ParseResult.failure(e);
		}
	}

	static CstNode parse(String source, ParseMode mode, ParserConfig config) {
		Objects.requireNonNull(source, "source must not be null");
		Objects.requireNonNull(mode, "mode must not be null");
		Objects.requireNonNull(config, "config must not be null");
		long start = System.nanoTime();
		CstBuilder.Settings settings = settings(source, mode, config);
		CstNode node;
		try {
			List<Token> tokens = PythonTokenizer.tokenize(prepare(source, mode, settings.defaultNewline()),
					config.version());
			ParseTree tree = config.backend().newStrategy().parse(tokens, config.version(), mode);
			node = CstBuilder.build(tree, tokens, mode, settings);
		}
		catch (CstSyntaxException e) {
			throw withinSource(e, source);
		}
		logger.debug("Parsed {} chars as {} with the {} backend in {} us", source.length(), mode,
				config.backend(), (System.nanoTime() - start) / 1000);
		return node;
	}

	/**
	 * The text actually tokenized: module and statement sources end with a line
	 * break.
	 */
	static String prepare(String source, ParseMode mode, String newline) {
		if (mode == ParseMode.EXPRESSION || source.isEmpty() || endsWithNewline(source)) {
			return source;
		}
		return source + newline;
	}

	/**
	 * Moves a failure reported on the appended line break back onto the end of
	 * the caller's text.
	 */
	static CstSyntaxException withinSource(CstSyntaxException e, String source) {
		if (e.offset() <= source.length()) {
			return e;
		}
		LineIndex index = new LineIndex(source);
		int offset = source.length();
		return e.relocate(offset, index.line(offset), index.column(offset));
	}

	static CstBuilder.Settings settings(String source, ParseMode mode, ParserConfig config) {
		if (mode != ParseMode.MODULE) {
			CstBuilder.Settings defaults = CstBuilder.Settings.defaults();
			return new CstBuilder.Settings(
					config.defaultIndent() != null ? config.defaultIndent() : defaults.defaultIndent(),
					config.defaultNewline() != null ? config.defaultNewline() : defaults.defaultNewline(),
					true, defaults.encoding());
		}
		String newline = config.defaultNewline() != null ? config.defaultNewline() : CstBuilder.detectNewline(source);
		boolean trailingNewline = source.isEmpty() || endsWithNewline(source);
		return new CstBuilder.Settings(config.defaultIndent(), newline, trailingNewline,
				CstBuilder.detectEncoding(source));
	}

	private static boolean endsWithNewline(String source) {
		return source.endsWith("\n") || source.endsWith("\r");
	}
}
