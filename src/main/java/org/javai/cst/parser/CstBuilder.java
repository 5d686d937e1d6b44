package org.javai.cst.parser;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.javai.cst.nodes.AnnAssign;
import org.javai.cst.nodes.Annotation;
import org.javai.cst.nodes.Arg;
import org.javai.cst.nodes.AsName;
import org.javai.cst.nodes.Assert;
import org.javai.cst.nodes.Assign;
import org.javai.cst.nodes.AssignEqual;
import org.javai.cst.nodes.AssignTarget;
import org.javai.cst.nodes.Asynchronous;
import org.javai.cst.nodes.Attribute;
import org.javai.cst.nodes.AugAssign;
import org.javai.cst.nodes.AugOp;
import org.javai.cst.nodes.Await;
import org.javai.cst.nodes.BaseDictElement;
import org.javai.cst.nodes.BaseElement;
import org.javai.cst.nodes.BaseExpression;
import org.javai.cst.nodes.BaseOrElse;
import org.javai.cst.nodes.BaseParenthesizableWhitespace;
import org.javai.cst.nodes.BaseSlice;
import org.javai.cst.nodes.BaseSmallStatement;
import org.javai.cst.nodes.BaseStarArg;
import org.javai.cst.nodes.BaseStatement;
import org.javai.cst.nodes.BaseString;
import org.javai.cst.nodes.BaseSuite;
import org.javai.cst.nodes.BaseYieldValue;
import org.javai.cst.nodes.BinaryOp;
import org.javai.cst.nodes.BinaryOperation;
import org.javai.cst.nodes.BooleanOp;
import org.javai.cst.nodes.BooleanOperation;
import org.javai.cst.nodes.Break;
import org.javai.cst.nodes.Call;
import org.javai.cst.nodes.ClassDef;
import org.javai.cst.nodes.Colon;
import org.javai.cst.nodes.Comma;
import org.javai.cst.nodes.Comment;
import org.javai.cst.nodes.CompFor;
import org.javai.cst.nodes.CompIf;
import org.javai.cst.nodes.CompOp;
import org.javai.cst.nodes.Comparison;
import org.javai.cst.nodes.ComparisonTarget;
import org.javai.cst.nodes.ConcatenatedString;
import org.javai.cst.nodes.Continue;
import org.javai.cst.nodes.CstNode;
import org.javai.cst.nodes.CstNodes;
import org.javai.cst.nodes.Decorator;
import org.javai.cst.nodes.Del;
import org.javai.cst.nodes.DictComp;
import org.javai.cst.nodes.DictElement;
import org.javai.cst.nodes.DictExpr;
import org.javai.cst.nodes.Dot;
import org.javai.cst.nodes.Element;
import org.javai.cst.nodes.Elif;
import org.javai.cst.nodes.Ellipsis;
import org.javai.cst.nodes.Else;
import org.javai.cst.nodes.EmptyLine;
import org.javai.cst.nodes.ExceptHandler;
import org.javai.cst.nodes.Expr;
import org.javai.cst.nodes.Finally;
import org.javai.cst.nodes.FloatLiteral;
import org.javai.cst.nodes.For;
import org.javai.cst.nodes.From;
import org.javai.cst.nodes.FunctionDef;
import org.javai.cst.nodes.GeneratorExp;
import org.javai.cst.nodes.Global;
import org.javai.cst.nodes.If;
import org.javai.cst.nodes.IfExp;
import org.javai.cst.nodes.ImaginaryLiteral;
import org.javai.cst.nodes.Import;
import org.javai.cst.nodes.ImportAlias;
import org.javai.cst.nodes.ImportFrom;
import org.javai.cst.nodes.ImportStar;
import org.javai.cst.nodes.IndentedBlock;
import org.javai.cst.nodes.Index;
import org.javai.cst.nodes.IntegerLiteral;
import org.javai.cst.nodes.Lambda;
import org.javai.cst.nodes.LeftCurlyBrace;
import org.javai.cst.nodes.LeftParen;
import org.javai.cst.nodes.LeftSquareBracket;
import org.javai.cst.nodes.ListComp;
import org.javai.cst.nodes.ListExpr;
import org.javai.cst.nodes.Module;
import org.javai.cst.nodes.Name;
import org.javai.cst.nodes.NameItem;
import org.javai.cst.nodes.NamedExpr;
import org.javai.cst.nodes.Newline;
import org.javai.cst.nodes.Nonlocal;
import org.javai.cst.nodes.Param;
import org.javai.cst.nodes.ParamSlash;
import org.javai.cst.nodes.ParamStar;
import org.javai.cst.nodes.Parameters;
import org.javai.cst.nodes.ParenthesizedWhitespace;
import org.javai.cst.nodes.Pass;
import org.javai.cst.nodes.Raise;
import org.javai.cst.nodes.Return;
import org.javai.cst.nodes.RightCurlyBrace;
import org.javai.cst.nodes.RightParen;
import org.javai.cst.nodes.RightSquareBracket;
import org.javai.cst.nodes.Semicolon;
import org.javai.cst.nodes.SetComp;
import org.javai.cst.nodes.SetExpr;
import org.javai.cst.nodes.SimpleStatementLine;
import org.javai.cst.nodes.SimpleStatementSuite;
import org.javai.cst.nodes.SimpleString;
import org.javai.cst.nodes.SimpleWhitespace;
import org.javai.cst.nodes.Slice;
import org.javai.cst.nodes.StarredDictElement;
import org.javai.cst.nodes.StarredElement;
import org.javai.cst.nodes.Subscript;
import org.javai.cst.nodes.SubscriptElement;
import org.javai.cst.nodes.TrailingWhitespace;
import org.javai.cst.nodes.Try;
import org.javai.cst.nodes.TupleExpr;
import org.javai.cst.nodes.UnaryOp;
import org.javai.cst.nodes.UnaryOperation;
import org.javai.cst.nodes.While;
import org.javai.cst.nodes.With;
import org.javai.cst.nodes.WithItem;
import org.javai.cst.nodes.Yield;
import org.javai.cst.tokenize.Token;
import org.javai.cst.tokenize.TokenKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a {@link ParseTree} and the tokens it was parsed from into CST nodes.
 * <p>
 * The whitespace between two adjacent tokens (the trailing trivia of one plus the
 * leading trivia of the next) is a <em>gap</em>. Every gap is handed out exactly
 * once: nodes are built in source order and each whitespace slot claims the part
 * of the gap it owns. Two claims are made out of order:
 * <ul>
 * <li>the trailing whitespace of a line (up to and including its newline) is
 * claimed before the statements on that line, so expressions never grab it;</li>
 * <li>the footer of an indented block (trailing comment lines at the block's
 * indentation) is claimed when the block closes, before the next statement takes
 * the remaining lines as its leading lines.</li>
 * </ul>
 * When the build finishes, any gap that was not fully claimed is a bug and is
 * reported as an {@link IllegalStateException}.
 */
public final class CstBuilder {

	private static final Logger logger = LoggerFactory.getLogger(CstBuilder.class);

	private static final Pattern CODING = Pattern.compile("^[ \\t\\f]*#.*?coding[:=][ \\t]*([-\\w.]+)");

	/**
	 * Module-level formatting defaults. A null {@code defaultIndent} is detected
	 * from the first indented block.
	 */
	public record Settings(String defaultIndent, String defaultNewline, boolean hasTrailingNewline, String encoding) {

		public Settings {
			Objects.requireNonNull(defaultNewline, "defaultNewline must not be null");
			Objects.requireNonNull(encoding, "encoding must not be null");
		}

		/**
		 * Fixed library defaults, used for statement and expression parsing.
		 */
		public static Settings defaults() {
			return new Settings(Module.DEFAULT_INDENT, Module.DEFAULT_NEWLINE, true, Module.DEFAULT_ENCODING);
		}
	}

	private final List<Token> tokens;
	private final Map<Token, Integer> indexOf = new IdentityHashMap<>();
	private final String[] gaps;
	private final int[] claimed;
	private final String defaultNewline;
	private final List<String> blockIndents = new ArrayList<>();
	private String defaultIndent;

	private CstBuilder(List<Token> tokens, Settings settings) {
		this.tokens = tokens;
		this.defaultNewline = settings.defaultNewline();
		this.defaultIndent = settings.defaultIndent();
		this.gaps = new String[tokens.size()];
		this.claimed = new int[tokens.size()];
		for (int i = 0; i < tokens.size(); i++) {
			Token token = tokens.get(i);
			indexOf.put(token, i);
			gaps[i] = i == 0 ? token.leadingTrivia() : tokens.get(i - 1).trailingTrivia() + token.leadingTrivia();
		}
	}

	/**
	 * Builds with settings detected from the tokens: newline and encoding for
	 * modules, the library defaults otherwise.
	 */
	public static CstNode build(ParseTree tree, List<Token> tokens, ParseMode mode) {
		Settings settings = Settings.defaults();
		if (mode == ParseMode.MODULE) {
			String source = ParserSyntaxException.sourceOf(tokens);
			settings = new Settings(null, detectNewline(source), true, detectEncoding(source));
		}
		return build(tree, tokens, mode, settings);
	}

	public static CstNode build(ParseTree tree, List<Token> tokens, ParseMode mode, Settings settings) {
		Objects.requireNonNull(tree, "tree must not be null");
		Objects.requireNonNull(tokens, "tokens must not be null");
		Objects.requireNonNull(mode, "mode must not be null");
		Objects.requireNonNull(settings, "settings must not be null");
		CstBuilder builder = new CstBuilder(tokens, settings);
		CstNode root;
		switch (mode) {
			case MODULE -> root = builder.module(tree, settings);
			case STATEMENT -> root = builder.statementInput(tree);
			case EXPRESSION -> root = builder.expressionInput(tree);
			default -> throw new IllegalArgumentException("Unknown parse mode " + mode);
		}
		builder.verifyAllClaimed();
		logger.debug("Built {} from {} tokens", root.getClass().getSimpleName(), tokens.size());
		return root;
	}

	/**
	 * The first line ending in {@code source}, or {@code "\n"} when it has none.
	 */
	public static String detectNewline(String source) {
		for (int i = 0; i < source.length(); i++) {
			char c = source.charAt(i);
			if (c == '\n') {
				return "\n";
			}
			if (c == '\r') {
				return i + 1 < source.length() && source.charAt(i + 1) == '\n' ? "\r\n" : "\r";
			}
		}
		return Module.DEFAULT_NEWLINE;
	}

	/**
	 * The encoding named by a coding declaration on one of the first two lines,
	 * or {@code utf-8}.
	 */
	public static String detectEncoding(String source) {
		List<String> lines = splitLines(source);
		for (int i = 0; i < Math.min(2, lines.size()); i++) {
			Matcher matcher = CODING.matcher(stripNewline(lines.get(i)));
			if (matcher.find()) {
				return matcher.group(1);
			}
		}
		return Module.DEFAULT_ENCODING;
	}

	// Entry points

	private Module module(ParseTree tree, Settings settings) {
		List<ParseTree> statements = tree.children().subList(0, tree.size() - 1);
		int end = index(tree.child(tree.size() - 1));
		List<EmptyLine> header = leadingLines(statements.isEmpty() ? end : index(statements.get(0).firstToken()));
		List<BaseStatement> body = statements(statements);
		List<EmptyLine> footer = leadingLines(end);
		String indent = defaultIndent != null ? defaultIndent : Module.DEFAULT_INDENT;
		return new Module(header, body, footer, settings.encoding(), indent, defaultNewline,
				settings.hasTrailingNewline());
	}

	private BaseStatement statementInput(ParseTree tree) {
		BaseStatement statement = statement(tree.child(0));
		int end = index(tree.child(1));
		if (!remaining(end).isEmpty()) {
			throw ParserSyntaxException.invalid(tokens, tokens.get(end), "Unexpected content after the statement");
		}
		return statement;
	}

	private BaseExpression expressionInput(ParseTree tree) {
		Token first = tokens.get(0);
		if (!first.leadingTrivia().isEmpty()) {
			throw ParserSyntaxException.invalid(tokens, first, "Expression must not start with whitespace");
		}
		int newline = index(tree.child(1));
		int end = index(tree.child(2));
		if (!remaining(newline).isEmpty() || !tokens.get(newline).text().isEmpty() || !remaining(end).isEmpty()) {
			throw ParserSyntaxException.invalid(tokens, tokens.get(newline),
					"Expression must not be followed by whitespace or newlines");
		}
		return expression(tree.child(0));
	}

	// Statements

	private List<BaseStatement> statements(List<ParseTree> trees) {
		List<BaseStatement> result = new ArrayList<>(trees.size());
		for (ParseTree tree : trees) {
			result.add(statement(tree));
		}
		return result;
	}

	private BaseStatement statement(ParseTree tree) {
		List<EmptyLine> leading = leadingLines(index(tree.firstToken()));
		switch (tree.symbol()) {
			case "simple_stmt":
				return simpleStatementLine(tree, leading);
			case "if_stmt":
				return ifStatement(tree, leading);
			case "while_stmt":
				return whileStatement(tree, leading);
			case "for_stmt":
				return forStatement(tree, leading, null);
			case "try_stmt":
				return tryStatement(tree, leading);
			case "with_stmt":
				return withStatement(tree, leading, null);
			case "funcdef":
				return functionDef(tree, leading, List.of(), List.of(), null);
			case "classdef":
				return classDef(tree, leading, List.of(), List.of());
			case "decorated":
				return decorated(tree, leading);
			case "async_stmt":
				return asyncStatement(tree, leading);
			default:
				throw new IllegalStateException("Unexpected statement rule " + tree.symbol());
		}
	}

	private SimpleStatementLine simpleStatementLine(ParseTree tree, List<EmptyLine> leading) {
		TrailingWhitespace trailing = trailingWhitespace(index(tree.child(tree.size() - 1)));
		List<BaseSmallStatement> body = smallStatements(tree.children().subList(0, tree.size() - 1));
		return new SimpleStatementLine(leading, body, trailing);
	}

	private SimpleStatementSuite simpleStatementSuite(ParseTree tree) {
		TrailingWhitespace trailing = trailingWhitespace(index(tree.child(tree.size() - 1)));
		SimpleWhitespace leading = simpleBefore(index(tree.firstToken()));
		List<BaseSmallStatement> body = smallStatements(tree.children().subList(0, tree.size() - 1));
		return new SimpleStatementSuite(leading, body, trailing);
	}

	private List<BaseSmallStatement> smallStatements(List<ParseTree> items) {
		List<BaseSmallStatement> result = new ArrayList<>();
		for (int i = 0; i < items.size(); i++) {
			ParseTree item = items.get(i);
			if (item.isToken(";")) {
				continue;
			}
			BaseSmallStatement statement = smallStatement(item);
			if (i + 1 < items.size() && items.get(i + 1).isToken(";")) {
				int semi = index(items.get(i + 1));
				Semicolon semicolon = new Semicolon(simpleBefore(semi), simpleAfter(semi));
				statement = CstNodes.withChanges(statement, Map.of("semicolon", semicolon));
			}
			result.add(statement);
		}
		return result;
	}

	private BaseSmallStatement smallStatement(ParseTree tree) {
		switch (tree.symbol()) {
			case "expr_stmt":
				return expressionStatement(tree);
			case "pass_stmt":
				return new Pass(null);
			case "break_stmt":
				return new Break(null);
			case "continue_stmt":
				return new Continue(null);
			case "del_stmt":
				return new Del(simpleAfter(index(tree.child(0))), expression(tree.child(1)), null);
			case "return_stmt":
				return new Return(simpleAfter(index(tree.child(0))),
						tree.size() > 1 ? expression(tree.child(1)) : null, null);
			case "raise_stmt":
				return raiseStatement(tree);
			case "global_stmt":
				return new Global(simpleAfter(index(tree.child(0))), nameItems(tree), null);
			case "nonlocal_stmt":
				return new Nonlocal(simpleAfter(index(tree.child(0))), nameItems(tree), null);
			case "assert_stmt":
				return assertStatement(tree);
			case "import_name":
				return new Import(simpleAfter(index(tree.child(0))), dottedAsNames(tree.child(1)), null);
			case "import_from":
				return importFrom(tree);
			case "yield_expr":
				return new Expr(yieldExpression(tree), null);
			default:
				throw new IllegalStateException("Unexpected small statement rule " + tree.symbol());
		}
	}

	private BaseSmallStatement expressionStatement(ParseTree tree) {
		if (tree.size() == 1) {
			return new Expr(expression(tree.child(0)), null);
		}
		ParseTree second = tree.child(1);
		if (second.is("annassign")) {
			BaseExpression target = expression(tree.child(0));
			if (target instanceof TupleExpr tuple && tuple.lpar().isEmpty()) {
				throw invalid(tree, "Only a single target can be annotated");
			}
			int colon = index(second.child(0));
			Annotation annotation = new Annotation(parenBefore(colon), ":", parenAfter(colon),
					expression(second.child(1)));
			AssignEqual equal = null;
			BaseExpression value = null;
			if (second.size() > 2) {
				equal = assignEqual(second.child(2));
				value = expression(second.child(3));
			}
			return new AnnAssign(target, annotation, equal, value, null);
		}
		if (!second.isToken("=")) {
			BaseExpression target = expression(tree.child(0));
			int op = index(second);
			AugOp.Kind kind = AugOp.Kind.fromToken(second.token().text())
					.orElseThrow(() -> new IllegalStateException("Unknown augmented operator " + second.token()));
			AugOp operator = new AugOp(kind, parenBefore(op), parenAfter(op));
			return new AugAssign(target, operator, expression(tree.child(2)), null);
		}
		List<AssignTarget> targets = new ArrayList<>();
		for (int i = 0; i < tree.size() - 1; i += 2) {
			BaseExpression target = expression(tree.child(i));
			int equal = index(tree.child(i + 1));
			targets.add(new AssignTarget(target, simpleBefore(equal), simpleAfter(equal)));
		}
		return new Assign(targets, expression(tree.child(tree.size() - 1)), null);
	}

	private Raise raiseStatement(ParseTree tree) {
		SimpleWhitespace afterRaise = simpleAfter(index(tree.child(0)));
		BaseExpression exc = tree.size() > 1 ? expression(tree.child(1)) : null;
		From cause = null;
		if (tree.size() > 2) {
			int from = index(tree.child(2));
			cause = new From(parenBefore(from), parenAfter(from), expression(tree.child(3)));
		}
		return new Raise(afterRaise, exc, cause, null);
	}

	private Assert assertStatement(ParseTree tree) {
		SimpleWhitespace afterAssert = simpleAfter(index(tree.child(0)));
		BaseExpression test = expression(tree.child(1));
		Comma comma = null;
		BaseExpression msg = null;
		if (tree.size() > 2) {
			comma = comma(tree.child(2));
			msg = expression(tree.child(3));
		}
		return new Assert(afterAssert, test, comma, msg, null);
	}

	private List<NameItem> nameItems(ParseTree tree) {
		List<NameItem> names = new ArrayList<>();
		for (int i = 1; i < tree.size(); i += 2) {
			Name name = name(tree.child(i));
			names.add(new NameItem(name, commaAt(tree.children(), i + 1)));
		}
		return names;
	}

	private List<ImportAlias> dottedAsNames(ParseTree tree) {
		List<ImportAlias> aliases = new ArrayList<>();
		for (int i = 0; i < tree.size(); i += 2) {
			ParseTree alias = tree.child(i);
			BaseExpression name = dottedName(alias.child(0));
			AsName asName = alias.size() > 1 ? asName(alias.child(1), alias.child(2)) : null;
			aliases.add(new ImportAlias(name, asName, commaAt(tree.children(), i + 1)));
		}
		return aliases;
	}

	private ImportFrom importFrom(ParseTree tree) {
		SimpleWhitespace afterFrom = simpleAfter(index(tree.child(0)));
		List<Dot> relative = new ArrayList<>();
		int i = 1;
		for (; tree.child(i).isToken(".") || tree.child(i).isToken("..."); i++) {
			int dot = index(tree.child(i));
			if (tree.child(i).isToken(".")) {
				relative.add(new Dot(parenBefore(dot), parenAfter(dot)));
			}
			else {
				relative.add(new Dot(parenBefore(dot), SimpleWhitespace.EMPTY));
				relative.add(new Dot(SimpleWhitespace.EMPTY, SimpleWhitespace.EMPTY));
				relative.add(new Dot(SimpleWhitespace.EMPTY, parenAfter(dot)));
			}
		}
		BaseExpression module = null;
		if (tree.child(i).is("dotted_name")) {
			module = dottedName(tree.child(i));
			i++;
		}
		int importKeyword = index(tree.child(i));
		SimpleWhitespace beforeImport = simpleBefore(importKeyword);
		SimpleWhitespace afterImport = simpleAfter(importKeyword);
		ParseTree targets = tree.child(i + 1);
		LeftParen lpar = null;
		RightParen rpar = null;
		ImportStar star = null;
		List<ImportAlias> names = List.of();
		if (targets.child(0).isToken("*")) {
			star = new ImportStar();
		}
		else if (targets.child(0).isToken("(")) {
			lpar = new LeftParen(parenAfter(index(targets.child(0))));
			names = importAsNames(targets.child(1));
			rpar = new RightParen(parenBefore(index(targets.child(2))));
		}
		else {
			ParseTree list = targets.child(0);
			if (list.child(list.size() - 1).isToken(",")) {
				throw invalid(list.child(list.size() - 1),
						"Trailing comma not allowed without surrounding parentheses");
			}
			names = importAsNames(list);
		}
		return new ImportFrom(afterFrom, relative, module, beforeImport, afterImport, lpar, names, star, rpar, null);
	}

	private List<ImportAlias> importAsNames(ParseTree tree) {
		List<ImportAlias> aliases = new ArrayList<>();
		for (int i = 0; i < tree.size(); i += 2) {
			ParseTree alias = tree.child(i);
			Name name = name(alias.child(0));
			AsName asName = alias.size() > 1 ? asName(alias.child(1), alias.child(2)) : null;
			aliases.add(new ImportAlias(name, asName, commaAt(tree.children(), i + 1)));
		}
		return aliases;
	}

	private AsName asName(ParseTree asKeyword, ParseTree target) {
		int keyword = index(asKeyword);
		BaseParenthesizableWhitespace beforeAs = parenBefore(keyword);
		BaseParenthesizableWhitespace afterAs = parenAfter(keyword);
		return new AsName(beforeAs, afterAs, expression(target));
	}

	// Compound statements

	private BaseSuite suite(ParseTree tree) {
		if (tree.child(0).is("simple_stmt")) {
			return simpleStatementSuite(tree.child(0));
		}
		return indentedBlock(tree);
	}

	private IndentedBlock indentedBlock(ParseTree tree) {
		TrailingWhitespace header = trailingWhitespace(index(tree.child(0)));
		String outer = currentIndent();
		String lineIndent = lastPartialLine(remaining(index(tree.child(2).firstToken())));
		if (!lineIndent.startsWith(outer) || lineIndent.length() <= outer.length()) {
			throw new IllegalStateException("Block indentation '" + lineIndent + "' does not extend '" + outer + "'");
		}
		String relative = lineIndent.substring(outer.length());
		if (defaultIndent == null) {
			defaultIndent = relative;
		}
		blockIndents.add(lineIndent);
		List<BaseStatement> body = statements(tree.children().subList(2, tree.size() - 1));
		List<EmptyLine> footer = blockFooter(index(tree.child(tree.size() - 1)), lineIndent);
		blockIndents.remove(blockIndents.size() - 1);
		return new IndentedBlock(header, relative.equals(defaultIndent) ? null : relative, body, footer);
	}

	/**
	 * Claims the comment lines after a block that are indented at least as deep
	 * as the block, up to the last such comment line.
	 */
	private List<EmptyLine> blockFooter(int dedent, String blockIndent) {
		int gap = dedent + 1;
		while (tokens.get(gap).kind() == TokenKind.DEDENT) {
			gap++;
		}
		List<String> lines = splitLines(remaining(gap));
		int last = -1;
		for (int i = 0; i < lines.size() - 1; i++) {
			String line = lines.get(i);
			if (line.startsWith(blockIndent) && line.stripLeading().startsWith("#")) {
				last = i;
			}
		}
		List<EmptyLine> footer = new ArrayList<>();
		int length = 0;
		for (int i = 0; i <= last; i++) {
			footer.add(emptyLine(lines.get(i), blockIndent));
			length += lines.get(i).length();
		}
		claimed[gap] += length;
		return footer;
	}

	private If ifStatement(ParseTree tree, List<EmptyLine> leading) {
		record Clause(List<EmptyLine> lines, SimpleWhitespace beforeTest, BaseExpression test,
				SimpleWhitespace afterTest, BaseSuite body) {
		}
		List<Clause> clauses = new ArrayList<>();
		Else orelse = null;
		int i = 0;
		while (i < tree.size()) {
			ParseTree keyword = tree.child(i);
			if (keyword.isToken("else")) {
				orelse = elseClause(tree, i);
				break;
			}
			int k = index(keyword);
			List<EmptyLine> lines = i == 0 ? leading : leadingLines(k);
			SimpleWhitespace beforeTest = simpleAfter(k);
			BaseExpression test = expression(tree.child(i + 1));
			SimpleWhitespace afterTest = simpleBefore(index(tree.child(i + 2)));
			clauses.add(new Clause(lines, beforeTest, test, afterTest, suite(tree.child(i + 3))));
			i += 4;
		}
		BaseOrElse tail = orelse;
		for (int j = clauses.size() - 1; j >= 1; j--) {
			Clause c = clauses.get(j);
			tail = new Elif(c.lines(), c.beforeTest(), c.test(), c.afterTest(), c.body(), tail);
		}
		Clause head = clauses.get(0);
		return new If(head.lines(), head.beforeTest(), head.test(), head.afterTest(), head.body(), tail);
	}

	private Else elseClause(ParseTree tree, int at) {
		int keyword = index(tree.child(at));
		List<EmptyLine> lines = leadingLines(keyword);
		return new Else(lines, simpleAfter(keyword), suite(tree.child(at + 2)));
	}

	private While whileStatement(ParseTree tree, List<EmptyLine> leading) {
		SimpleWhitespace afterWhile = simpleAfter(index(tree.child(0)));
		BaseExpression test = expression(tree.child(1));
		SimpleWhitespace beforeColon = simpleBefore(index(tree.child(2)));
		BaseSuite body = suite(tree.child(3));
		Else orelse = tree.size() > 4 ? elseClause(tree, 4) : null;
		return new While(leading, afterWhile, test, beforeColon, body, orelse);
	}

	private For forStatement(ParseTree tree, List<EmptyLine> leading, Asynchronous asynchronous) {
		SimpleWhitespace afterFor = simpleAfter(index(tree.child(0)));
		BaseExpression target = expression(tree.child(1));
		int in = index(tree.child(2));
		SimpleWhitespace beforeIn = simpleBefore(in);
		SimpleWhitespace afterIn = simpleAfter(in);
		BaseExpression iter = expression(tree.child(3));
		SimpleWhitespace beforeColon = simpleBefore(index(tree.child(4)));
		BaseSuite body = suite(tree.child(5));
		Else orelse = tree.size() > 6 ? elseClause(tree, 6) : null;
		return new For(leading, asynchronous, afterFor, target, beforeIn, afterIn, iter, beforeColon, body, orelse);
	}

	private Try tryStatement(ParseTree tree, List<EmptyLine> leading) {
		SimpleWhitespace beforeColon = simpleBefore(index(tree.child(1)));
		BaseSuite body = suite(tree.child(2));
		List<ExceptHandler> handlers = new ArrayList<>();
		Else orelse = null;
		Finally finalbody = null;
		for (int i = 3; i < tree.size(); i += 3) {
			ParseTree clause = tree.child(i);
			if (clause.is("except_clause")) {
				if (!handlers.isEmpty() && handlers.get(handlers.size() - 1).type() == null) {
					throw invalid(clause, "Default 'except:' must be last");
				}
				handlers.add(exceptHandler(clause, tree.child(i + 1), tree.child(i + 2)));
			}
			else if (clause.isToken("else")) {
				orelse = elseClause(tree, i);
			}
			else {
				int keyword = index(clause);
				List<EmptyLine> lines = leadingLines(keyword);
				finalbody = new Finally(lines, simpleAfter(keyword), suite(tree.child(i + 2)));
			}
		}
		return new Try(leading, beforeColon, body, handlers, orelse, finalbody);
	}

	private ExceptHandler exceptHandler(ParseTree clause, ParseTree colon, ParseTree suite) {
		int keyword = index(clause.child(0));
		List<EmptyLine> lines = leadingLines(keyword);
		SimpleWhitespace afterExcept = simpleAfter(keyword);
		BaseExpression type = null;
		AsName name = null;
		if (clause.size() > 1) {
			type = expression(clause.child(1));
			if (clause.size() > 2) {
				name = asName(clause.child(2), clause.child(3));
			}
		}
		return new ExceptHandler(lines, afterExcept, type, name, simpleBefore(index(colon)), suite(suite));
	}

	private With withStatement(ParseTree tree, List<EmptyLine> leading, Asynchronous asynchronous) {
		SimpleWhitespace afterWith = simpleAfter(index(tree.child(0)));
		List<WithItem> items = new ArrayList<>();
		int i = 1;
		while (!tree.child(i).isToken(":")) {
			ParseTree item = tree.child(i);
			BaseExpression value = expression(item.child(0));
			AsName asName = item.size() > 1 ? asName(item.child(1), item.child(2)) : null;
			items.add(new WithItem(value, asName, commaAt(tree.children(), i + 1)));
			i += tree.child(i + 1).isToken(",") ? 2 : 1;
		}
		SimpleWhitespace beforeColon = simpleBefore(index(tree.child(i)));
		return new With(leading, asynchronous, afterWith, items, beforeColon, suite(tree.child(i + 1)));
	}

	private BaseStatement asyncStatement(ParseTree tree, List<EmptyLine> leading) {
		Asynchronous asynchronous = new Asynchronous(simpleAfter(index(tree.child(0))));
		ParseTree inner = tree.child(1);
		switch (inner.symbol()) {
			case "funcdef":
				return functionDef(inner, leading, List.of(), List.of(), asynchronous);
			case "with_stmt":
				return withStatement(inner, leading, asynchronous);
			case "for_stmt":
				return forStatement(inner, leading, asynchronous);
			default:
				throw new IllegalStateException("Unexpected async statement " + inner.symbol());
		}
	}

	private BaseStatement decorated(ParseTree tree, List<EmptyLine> leading) {
		List<Decorator> decorators = new ArrayList<>();
		for (int i = 0; i < tree.size() - 1; i++) {
			ParseTree decorator = tree.child(i);
			List<EmptyLine> lines = decorators.isEmpty() ? List.of() : leadingLines(index(decorator.child(0)));
			decorators.add(decorator(decorator, lines));
		}
		ParseTree definition = tree.child(tree.size() - 1);
		List<EmptyLine> linesAfter = leadingLines(index(definition.firstToken()));
		switch (definition.symbol()) {
			case "classdef":
				return classDef(definition, leading, decorators, linesAfter);
			case "funcdef":
				return functionDef(definition, leading, decorators, linesAfter, null);
			default: {
				Asynchronous asynchronous = new Asynchronous(simpleAfter(index(definition.child(0))));
				return functionDef(definition.child(1), leading, decorators, linesAfter, asynchronous);
			}
		}
	}

	private Decorator decorator(ParseTree tree, List<EmptyLine> lines) {
		TrailingWhitespace trailing = trailingWhitespace(index(tree.child(tree.size() - 1)));
		SimpleWhitespace afterAt = simpleAfter(index(tree.child(0)));
		BaseExpression expression = dottedName(tree.child(1));
		if (tree.size() > 3) {
			int open = index(tree.child(2));
			BaseParenthesizableWhitespace afterFunc = parenBefore(open);
			BaseParenthesizableWhitespace beforeArgs = parenAfter(open);
			List<Arg> args = tree.child(3).is("arglist") ? arguments(tree.child(3)) : List.of();
			expression = new Call(List.of(), expression, afterFunc, beforeArgs, args, List.of());
		}
		return new Decorator(lines, afterAt, expression, trailing);
	}

	private FunctionDef functionDef(ParseTree tree, List<EmptyLine> leading, List<Decorator> decorators,
			List<EmptyLine> linesAfter, Asynchronous asynchronous) {
		SimpleWhitespace afterDef = simpleAfter(index(tree.child(0)));
		Name name = name(tree.child(1));
		ParseTree parameters = tree.child(2);
		int open = index(parameters.child(0));
		SimpleWhitespace afterName = simpleBefore(open);
		BaseParenthesizableWhitespace beforeParams = parenAfter(open);
		Parameters params = parameters.size() == 3 ? parameters(parameters.child(1)) : Parameters.EMPTY;
		int i = 3;
		Annotation returns = null;
		if (tree.child(3).isToken("->")) {
			int arrow = index(tree.child(3));
			returns = new Annotation(parenBefore(arrow), "->", parenAfter(arrow), expression(tree.child(4)));
			i = 5;
		}
		SimpleWhitespace beforeColon = simpleBefore(index(tree.child(i)));
		BaseSuite body = suite(tree.child(i + 1));
		return new FunctionDef(leading, decorators, linesAfter, asynchronous, afterDef, name, afterName,
				beforeParams, params, returns, beforeColon, body);
	}

	private ClassDef classDef(ParseTree tree, List<EmptyLine> leading, List<Decorator> decorators,
			List<EmptyLine> linesAfter) {
		SimpleWhitespace afterClass = simpleAfter(index(tree.child(0)));
		Name name = name(tree.child(1));
		SimpleWhitespace afterName = simpleAfter(index(tree.child(1)));
		LeftParen lpar = null;
		RightParen rpar = null;
		List<Arg> bases = new ArrayList<>();
		List<Arg> keywords = new ArrayList<>();
		int i = 2;
		if (tree.child(2).isToken("(")) {
			lpar = new LeftParen(parenAfter(index(tree.child(2))));
			i = 3;
			if (tree.child(3).is("arglist")) {
				for (Arg arg : arguments(tree.child(3))) {
					if (arg.keyword() != null || "**".equals(arg.star())) {
						keywords.add(arg);
					}
					else {
						bases.add(arg);
					}
				}
				i = 4;
			}
			rpar = new RightParen(parenBefore(index(tree.child(i))));
			i++;
		}
		SimpleWhitespace beforeColon = simpleBefore(index(tree.child(i)));
		BaseSuite body = suite(tree.child(i + 1));
		return new ClassDef(leading, decorators, linesAfter, afterClass, name, afterName, lpar, bases, keywords,
				rpar, beforeColon, body);
	}

	// Expressions

	private BaseExpression expression(ParseTree tree) {
		if (tree.isLeaf()) {
			return atomLeaf(tree);
		}
		switch (tree.symbol()) {
			case "atom":
				return atom(tree);
			case "strings":
				return strings(tree, 0);
			case "atom_expr":
				return atomExpression(tree);
			case "power":
			case "term":
			case "arith_expr":
			case "shift_expr":
			case "and_expr":
			case "xor_expr":
			case "expr":
				return binaryChain(tree);
			case "factor":
				return unary(tree);
			case "not_test":
				return unary(tree);
			case "comparison":
				return comparison(tree);
			case "and_test":
			case "or_test":
				return booleanChain(tree);
			case "test":
				return ifExpression(tree);
			case "lambdef":
			case "lambdef_nocond":
				return lambda(tree);
			case "namedexpr_test":
				return namedExpression(tree);
			case "yield_expr":
				return yieldExpression(tree);
			case "testlist_star_expr":
			case "testlist":
			case "exprlist":
				return new TupleExpr(List.of(), elements(tree.children()), List.of());
			case "star_expr":
				throw invalid(tree, "Starred expression is not allowed here");
			default:
				throw new IllegalStateException("Unexpected expression rule " + tree.symbol());
		}
	}

	private BaseExpression atomLeaf(ParseTree leaf) {
		Token token = leaf.token();
		String text = token.text();
		switch (token.kind()) {
			case NAME:
			case KEYWORD:
				if (token.kind() == TokenKind.KEYWORD && !text.equals("None") && !text.equals("True")
						&& !text.equals("False")) {
					throw invalid(leaf, "Unexpected keyword '" + text + "'");
				}
				return Name.of(text);
			case NUMBER:
				return number(text);
			case STRING:
				return new SimpleString(List.of(), text, List.of());
			case OP:
				if (text.equals("...")) {
					return new Ellipsis(List.of(), List.of());
				}
				throw invalid(leaf, "Unexpected operator '" + text + "'");
			default:
				throw new IllegalStateException("Unexpected token " + token);
		}
	}

	private static BaseExpression number(String text) {
		String lower = text.toLowerCase();
		if (lower.endsWith("j")) {
			return new ImaginaryLiteral(List.of(), text, List.of());
		}
		if (lower.startsWith("0x") || lower.startsWith("0o") || lower.startsWith("0b")) {
			return new IntegerLiteral(List.of(), text, List.of());
		}
		if (lower.contains(".") || lower.contains("e")) {
			return new FloatLiteral(List.of(), text, List.of());
		}
		return new IntegerLiteral(List.of(), text, List.of());
	}

	private BaseString strings(ParseTree tree, int at) {
		SimpleString left = new SimpleString(List.of(), tree.child(at).token().text(), List.of());
		if (at == tree.size() - 1) {
			return left;
		}
		BaseParenthesizableWhitespace between = parenBefore(index(tree.child(at + 1)));
		return new ConcatenatedString(List.of(), left, between, strings(tree, at + 1), List.of());
	}

	private BaseExpression atom(ParseTree tree) {
		ParseTree open = tree.child(0);
		int o = index(open);
		if (open.isToken("(")) {
			LeftParen lpar = new LeftParen(parenAfter(o));
			if (tree.size() == 2) {
				RightParen rpar = new RightParen(parenBefore(index(tree.child(1))));
				return new TupleExpr(List.of(lpar), List.of(), List.of(rpar));
			}
			ParseTree inner = tree.child(1);
			BaseExpression value;
			if (inner.is("testlist_comp") && inner.child(1).is("comp_for")) {
				value = new GeneratorExp(List.of(), expression(inner.child(0)), compFor(inner.child(1)), List.of());
			}
			else if (inner.is("testlist_comp")) {
				value = new TupleExpr(List.of(), elements(inner.children()), List.of());
			}
			else {
				value = expression(inner);
			}
			RightParen rpar = new RightParen(parenBefore(index(tree.child(2))));
			return parenthesize(lpar, value, rpar);
		}
		if (open.isToken("[")) {
			LeftSquareBracket lbracket = new LeftSquareBracket(parenAfter(o));
			if (tree.size() == 2) {
				return new ListExpr(List.of(), lbracket, List.of(),
						new RightSquareBracket(parenBefore(index(tree.child(1)))), List.of());
			}
			ParseTree inner = tree.child(1);
			if (inner.is("testlist_comp") && inner.child(1).is("comp_for")) {
				BaseExpression elt = expression(inner.child(0));
				CompFor forIn = compFor(inner.child(1));
				return new ListComp(List.of(), lbracket, elt, forIn,
						new RightSquareBracket(parenBefore(index(tree.child(2)))), List.of());
			}
			List<BaseElement> elements = elements(inner.is("testlist_comp") ? inner.children() : List.of(inner));
			return new ListExpr(List.of(), lbracket, elements,
					new RightSquareBracket(parenBefore(index(tree.child(2)))), List.of());
		}
		LeftCurlyBrace lbrace = new LeftCurlyBrace(parenAfter(o));
		if (tree.size() == 2) {
			return new DictExpr(List.of(), lbrace, List.of(),
					new RightCurlyBrace(parenBefore(index(tree.child(1)))), List.of());
		}
		ParseTree maker = tree.child(1);
		boolean comprehension = maker.size() == 2 && maker.child(1).is("comp_for");
		if (maker.child(0).is("dict_entry")) {
			if (comprehension) {
				ParseTree entry = maker.child(0);
				if (entry.child(0).isToken("**")) {
					throw invalid(entry, "Dict unpacking cannot be used in dict comprehension");
				}
				BaseExpression key = expression(entry.child(0));
				int colon = index(entry.child(1));
				BaseParenthesizableWhitespace beforeColon = parenBefore(colon);
				BaseParenthesizableWhitespace afterColon = parenAfter(colon);
				BaseExpression value = expression(entry.child(2));
				CompFor forIn = compFor(maker.child(1));
				return new DictComp(List.of(), lbrace, key, beforeColon, afterColon, value, forIn,
						new RightCurlyBrace(parenBefore(index(tree.child(2)))), List.of());
			}
			List<BaseDictElement> elements = dictElements(maker.children());
			return new DictExpr(List.of(), lbrace, elements,
					new RightCurlyBrace(parenBefore(index(tree.child(2)))), List.of());
		}
		if (comprehension) {
			BaseExpression elt = expression(maker.child(0));
			CompFor forIn = compFor(maker.child(1));
			return new SetComp(List.of(), lbrace, elt, forIn,
					new RightCurlyBrace(parenBefore(index(tree.child(2)))), List.of());
		}
		List<BaseElement> elements = elements(maker.children());
		return new SetExpr(List.of(), lbrace, elements,
				new RightCurlyBrace(parenBefore(index(tree.child(2)))), List.of());
	}

	private static BaseExpression parenthesize(LeftParen lpar, BaseExpression inner, RightParen rpar) {
		List<LeftParen> lpars = new ArrayList<>();
		lpars.add(lpar);
		lpars.addAll(inner.lpar());
		List<RightParen> rpars = new ArrayList<>(inner.rpar());
		rpars.add(rpar);
		return CstNodes.withChanges(inner, Map.of("lpar", lpars, "rpar", rpars));
	}

	private List<BaseElement> elements(List<ParseTree> items) {
		List<BaseElement> elements = new ArrayList<>();
		for (int i = 0; i < items.size(); i++) {
			ParseTree item = items.get(i);
			if (item.isToken(",")) {
				continue;
			}
			if (item.is("star_expr")) {
				BaseParenthesizableWhitespace beforeValue = parenAfter(index(item.child(0)));
				BaseExpression value = expression(item.child(1));
				elements.add(new StarredElement(beforeValue, value, commaAt(items, i + 1)));
			}
			else {
				BaseExpression value = expression(item);
				elements.add(new Element(value, commaAt(items, i + 1)));
			}
		}
		return elements;
	}

	private List<BaseDictElement> dictElements(List<ParseTree> items) {
		List<BaseDictElement> elements = new ArrayList<>();
		for (int i = 0; i < items.size(); i++) {
			ParseTree entry = items.get(i);
			if (entry.isToken(",")) {
				continue;
			}
			if (entry.child(0).isToken("**")) {
				BaseParenthesizableWhitespace beforeValue = parenAfter(index(entry.child(0)));
				BaseExpression value = expression(entry.child(1));
				elements.add(new StarredDictElement(beforeValue, value, commaAt(items, i + 1)));
			}
			else {
				BaseExpression key = expression(entry.child(0));
				int colon = index(entry.child(1));
				BaseParenthesizableWhitespace beforeColon = parenBefore(colon);
				BaseParenthesizableWhitespace afterColon = parenAfter(colon);
				BaseExpression value = expression(entry.child(2));
				elements.add(new DictElement(key, beforeColon, afterColon, value, commaAt(items, i + 1)));
			}
		}
		return elements;
	}

	private BaseExpression atomExpression(ParseTree tree) {
		int i = 0;
		BaseParenthesizableWhitespace afterAwait = null;
		if (tree.child(0).isToken("await")) {
			afterAwait = parenAfter(index(tree.child(0)));
			i = 1;
		}
		BaseExpression value = expression(tree.child(i));
		for (int j = i + 1; j < tree.size(); j++) {
			value = trailer(value, tree.child(j));
		}
		return afterAwait == null ? value : new Await(List.of(), afterAwait, value, List.of());
	}

	private BaseExpression trailer(BaseExpression base, ParseTree trailer) {
		ParseTree open = trailer.child(0);
		int o = index(open);
		if (open.isToken("(")) {
			BaseParenthesizableWhitespace afterFunc = parenBefore(o);
			BaseParenthesizableWhitespace beforeArgs = parenAfter(o);
			List<Arg> args = trailer.size() == 3 ? arguments(trailer.child(1)) : List.of();
			return new Call(List.of(), base, afterFunc, beforeArgs, args, List.of());
		}
		if (open.isToken("[")) {
			BaseParenthesizableWhitespace afterValue = parenBefore(o);
			LeftSquareBracket lbracket = new LeftSquareBracket(parenAfter(o));
			List<SubscriptElement> slice = subscripts(trailer.child(1));
			RightSquareBracket rbracket = new RightSquareBracket(parenBefore(index(trailer.child(2))));
			return new Subscript(List.of(), base, afterValue, lbracket, slice, rbracket, List.of());
		}
		Dot dot = new Dot(parenBefore(o), parenAfter(o));
		return new Attribute(List.of(), base, dot, name(trailer.child(1)), List.of());
	}

	private List<SubscriptElement> subscripts(ParseTree tree) {
		List<ParseTree> items = tree.is("subscriptlist") ? tree.children() : List.of(tree);
		List<SubscriptElement> elements = new ArrayList<>();
		for (int i = 0; i < items.size(); i++) {
			if (items.get(i).isToken(",")) {
				continue;
			}
			BaseSlice slice = slice(items.get(i));
			elements.add(new SubscriptElement(slice, commaAt(items, i + 1)));
		}
		return elements;
	}

	private BaseSlice slice(ParseTree subscript) {
		if (subscript.size() == 1 && !subscript.child(0).isToken(":")) {
			return new Index(expression(subscript.child(0)));
		}
		int i = 0;
		BaseExpression lower = null;
		if (!subscript.child(0).isToken(":")) {
			lower = expression(subscript.child(0));
			i = 1;
		}
		Colon first = colon(subscript.child(i++));
		BaseExpression upper = null;
		if (i < subscript.size() && !subscript.child(i).is("sliceop")) {
			upper = expression(subscript.child(i++));
		}
		Colon second = null;
		BaseExpression step = null;
		if (i < subscript.size()) {
			ParseTree sliceop = subscript.child(i);
			second = colon(sliceop.child(0));
			if (sliceop.size() > 1) {
				step = expression(sliceop.child(1));
			}
		}
		return new Slice(lower, first, upper, second, step);
	}

	private List<Arg> arguments(ParseTree arglist) {
		List<ParseTree> items = arglist.children();
		List<Arg> args = new ArrayList<>();
		boolean keywordSeen = false;
		for (int i = 0; i < items.size(); i++) {
			ParseTree argument = items.get(i);
			if (argument.isToken(",")) {
				continue;
			}
			Arg arg = argument(argument, i + 1 < items.size() ? items.get(i + 1) : null);
			if (arg.keyword() != null || "**".equals(arg.star())) {
				keywordSeen = true;
			}
			else if (keywordSeen && arg.star().isEmpty()) {
				throw invalid(argument, "Positional argument follows keyword argument");
			}
			if (argument.size() == 2 && argument.child(1).is("comp_for") && items.size() > 2) {
				throw invalid(argument, "Generator expression must be parenthesized");
			}
			args.add(arg);
		}
		return args;
	}

	private Arg argument(ParseTree argument, ParseTree next) {
		ParseTree first = argument.child(0);
		String star = "";
		BaseParenthesizableWhitespace afterStar = SimpleWhitespace.EMPTY;
		Name keyword = null;
		AssignEqual equal = null;
		BaseExpression value;
		if (first.isToken("*") || first.isToken("**")) {
			star = first.token().text();
			afterStar = parenAfter(index(first));
			value = expression(argument.child(1));
		}
		else if (argument.size() == 3 && argument.child(1).isToken("=")) {
			keyword = name(first);
			equal = assignEqual(argument.child(1));
			value = expression(argument.child(2));
		}
		else if (argument.size() == 3) {
			value = namedExpression(argument);
		}
		else if (argument.size() == 2) {
			BaseExpression elt = expression(first);
			value = new GeneratorExp(List.of(), elt, compFor(argument.child(1)), List.of());
		}
		else {
			value = expression(first);
		}
		Comma comma = next != null && next.isToken(",") ? comma(next) : null;
		BaseParenthesizableWhitespace afterArg = parenAfter(comma != null ? index(next) : lastIndex(argument));
		return new Arg(star, afterStar, keyword, equal, value, comma, afterArg);
	}

	private CompFor compFor(ParseTree tree) {
		BaseParenthesizableWhitespace before = parenBefore(index(tree.child(0)));
		Asynchronous asynchronous = null;
		int i = 0;
		if (tree.child(0).isToken("async")) {
			asynchronous = new Asynchronous(parenAfter(index(tree.child(0))));
			i = 1;
		}
		BaseParenthesizableWhitespace afterFor = parenAfter(index(tree.child(i)));
		BaseExpression target = expression(tree.child(i + 1));
		int in = index(tree.child(i + 2));
		BaseParenthesizableWhitespace beforeIn = parenBefore(in);
		BaseParenthesizableWhitespace afterIn = parenAfter(in);
		BaseExpression iter = expression(tree.child(i + 3));
		List<CompIf> ifs = new ArrayList<>();
		ParseTree next = tree.size() > i + 4 ? tree.child(i + 4) : null;
		while (next != null && next.is("comp_if")) {
			int keyword = index(next.child(0));
			BaseParenthesizableWhitespace beforeIf = parenBefore(keyword);
			BaseParenthesizableWhitespace beforeTest = parenAfter(keyword);
			ifs.add(new CompIf(beforeIf, beforeTest, expression(next.child(1))));
			next = next.size() > 2 ? next.child(2) : null;
		}
		CompFor inner = next != null ? compFor(next) : null;
		return new CompFor(before, asynchronous, afterFor, target, beforeIn, afterIn, iter, ifs, inner);
	}

	private BaseExpression binaryChain(ParseTree tree) {
		BaseExpression left = expression(tree.child(0));
		for (int i = 1; i < tree.size(); i += 2) {
			ParseTree op = tree.child(i);
			int o = index(op);
			BinaryOp.Kind kind = BinaryOp.Kind.fromToken(op.token().text())
					.orElseThrow(() -> new IllegalStateException("Unknown binary operator " + op.token()));
			BinaryOp operator = new BinaryOp(kind, parenBefore(o), parenAfter(o));
			BaseExpression right = expression(tree.child(i + 1));
			left = new BinaryOperation(List.of(), left, operator, right, List.of());
		}
		return left;
	}

	private BaseExpression unary(ParseTree tree) {
		ParseTree op = tree.child(0);
		UnaryOp.Kind kind;
		switch (op.token().text()) {
			case "+" -> kind = UnaryOp.Kind.PLUS;
			case "-" -> kind = UnaryOp.Kind.MINUS;
			case "~" -> kind = UnaryOp.Kind.BITWISE_INVERT;
			case "not" -> kind = UnaryOp.Kind.NOT;
			default -> throw new IllegalStateException("Unknown unary operator " + op.token());
		}
		UnaryOp operator = new UnaryOp(kind, parenAfter(index(op)));
		return new UnaryOperation(List.of(), operator, expression(tree.child(1)), List.of());
	}

	private BaseExpression booleanChain(ParseTree tree) {
		BaseExpression left = expression(tree.child(0));
		for (int i = 1; i < tree.size(); i += 2) {
			int o = index(tree.child(i));
			BooleanOp.Kind kind = tree.child(i).isToken("and") ? BooleanOp.Kind.AND : BooleanOp.Kind.OR;
			BooleanOp operator = new BooleanOp(kind, parenBefore(o), parenAfter(o));
			BaseExpression right = expression(tree.child(i + 1));
			left = new BooleanOperation(List.of(), left, operator, right, List.of());
		}
		return left;
	}

	private BaseExpression comparison(ParseTree tree) {
		BaseExpression left = expression(tree.child(0));
		List<ComparisonTarget> targets = new ArrayList<>();
		for (int i = 1; i < tree.size(); i += 2) {
			CompOp operator = compOp(tree.child(i));
			targets.add(new ComparisonTarget(operator, expression(tree.child(i + 1))));
		}
		return new Comparison(List.of(), left, targets, List.of());
	}

	private CompOp compOp(ParseTree op) {
		if (op.isLeaf()) {
			int o = index(op);
			CompOp.Kind kind;
			switch (op.token().text()) {
				case "<" -> kind = CompOp.Kind.LESS_THAN;
				case ">" -> kind = CompOp.Kind.GREATER_THAN;
				case "==" -> kind = CompOp.Kind.EQUAL;
				case ">=" -> kind = CompOp.Kind.GREATER_THAN_EQUAL;
				case "<=" -> kind = CompOp.Kind.LESS_THAN_EQUAL;
				case "!=" -> kind = CompOp.Kind.NOT_EQUAL;
				case "in" -> kind = CompOp.Kind.IN;
				case "is" -> kind = CompOp.Kind.IS;
				default -> throw new IllegalStateException("Unknown comparison operator " + op.token());
			}
			return new CompOp(kind, parenBefore(o), null, parenAfter(o));
		}
		CompOp.Kind kind = op.child(0).isToken("not") ? CompOp.Kind.NOT_IN : CompOp.Kind.IS_NOT;
		int firstWord = index(op.child(0));
		int secondWord = index(op.child(1));
		return new CompOp(kind, parenBefore(firstWord), parenAfter(firstWord), parenAfter(secondWord));
	}

	private BaseExpression ifExpression(ParseTree tree) {
		BaseExpression body = expression(tree.child(0));
		int ifKeyword = index(tree.child(1));
		BaseParenthesizableWhitespace beforeIf = parenBefore(ifKeyword);
		BaseParenthesizableWhitespace afterIf = parenAfter(ifKeyword);
		BaseExpression test = expression(tree.child(2));
		int elseKeyword = index(tree.child(3));
		BaseParenthesizableWhitespace beforeElse = parenBefore(elseKeyword);
		BaseParenthesizableWhitespace afterElse = parenAfter(elseKeyword);
		BaseExpression orelse = expression(tree.child(4));
		return new IfExp(List.of(), body, beforeIf, afterIf, test, beforeElse, afterElse, orelse, List.of());
	}

	private BaseExpression lambda(ParseTree tree) {
		BaseParenthesizableWhitespace afterLambda = parenAfter(index(tree.child(0)));
		int i = 1;
		Parameters params = Parameters.EMPTY;
		if (tree.child(1).is("varargslist")) {
			params = parameters(tree.child(1));
			i = 2;
		}
		Colon colon = colon(tree.child(i));
		BaseExpression body = expression(tree.child(i + 1));
		return new Lambda(List.of(), afterLambda, params, colon, body, List.of());
	}

	private BaseExpression namedExpression(ParseTree tree) {
		Name target = name(tree.child(0));
		int walrus = index(tree.child(1));
		BaseParenthesizableWhitespace beforeWalrus = parenBefore(walrus);
		BaseParenthesizableWhitespace afterWalrus = parenAfter(walrus);
		BaseExpression value = expression(tree.child(2));
		return new NamedExpr(List.of(), target, beforeWalrus, afterWalrus, value, List.of());
	}

	private Yield yieldExpression(ParseTree tree) {
		BaseParenthesizableWhitespace afterYield = parenAfter(index(tree.child(0)));
		BaseYieldValue value = null;
		if (tree.size() > 1) {
			ParseTree arg = tree.child(1);
			if (arg.is("yield_arg")) {
				int from = index(arg.child(0));
				BaseParenthesizableWhitespace beforeFrom = parenBefore(from);
				BaseParenthesizableWhitespace afterFrom = parenAfter(from);
				value = new From(beforeFrom, afterFrom, expression(arg.child(1)));
			}
			else {
				value = expression(arg);
			}
		}
		return new Yield(List.of(), afterYield, value, List.of());
	}

	private Parameters parameters(ParseTree list) {
		List<ParseTree> items = list.children();
		List<Param> posonly = new ArrayList<>();
		List<Param> params = new ArrayList<>();
		List<Param> kwonly = new ArrayList<>();
		ParamSlash slash = null;
		BaseStarArg starArg = null;
		Param starKwarg = null;
		for (int i = 0; i < items.size(); i++) {
			ParseTree item = items.get(i);
			if (item.isToken(",")) {
				continue;
			}
			ParseTree next = i + 1 < items.size() && items.get(i + 1).isToken(",") ? items.get(i + 1) : null;
			ParseTree first = item.child(0);
			if (first.isToken("/")) {
				if (slash != null || starArg != null || starKwarg != null || params.isEmpty()) {
					throw invalid(item, "Invalid position for '/'");
				}
				Comma comma = next != null ? comma(next) : null;
				slash = new ParamSlash(comma, parenAfter(next != null ? index(next) : index(first)));
				posonly.addAll(params);
				params.clear();
			}
			else if (first.isToken("*")) {
				if (starArg != null || starKwarg != null) {
					throw invalid(item, "Duplicate '*' in parameter list");
				}
				if (item.size() == 1) {
					if (next == null) {
						throw invalid(item, "Named arguments must follow bare *");
					}
					starArg = new ParamStar(comma(next));
				}
				else {
					starArg = param("*", item, next);
				}
			}
			else if (first.isToken("**")) {
				if (starKwarg != null) {
					throw invalid(item, "Duplicate '**' in parameter list");
				}
				starKwarg = param("**", item, next);
			}
			else {
				if (starKwarg != null) {
					throw invalid(item, "Parameter follows '**'");
				}
				Param param = param("", item, next);
				if (starArg != null) {
					kwonly.add(param);
				}
				else {
					if (param.defaultValue() == null && hasDefault(posonly, params)) {
						throw invalid(item, "Non-default argument follows default argument");
					}
					params.add(param);
				}
			}
		}
		if (starArg instanceof ParamStar && kwonly.isEmpty()) {
			throw invalid(list, "Named arguments must follow bare *");
		}
		return new Parameters(posonly, slash, params, starArg, kwonly, starKwarg);
	}

	private static boolean hasDefault(List<Param> posonly, List<Param> params) {
		return posonly.stream().anyMatch(p -> p.defaultValue() != null)
				|| params.stream().anyMatch(p -> p.defaultValue() != null);
	}

	private Param param(String star, ParseTree item, ParseTree next) {
		int i = 0;
		BaseParenthesizableWhitespace afterStar = SimpleWhitespace.EMPTY;
		if (!star.isEmpty()) {
			afterStar = parenAfter(index(item.child(0)));
			i = 1;
		}
		ParseTree definition = item.child(i);
		Name name;
		Annotation annotation = null;
		if (definition.is("tfpdef")) {
			name = name(definition.child(0));
			if (definition.size() == 3) {
				int colon = index(definition.child(1));
				annotation = new Annotation(parenBefore(colon), ":", parenAfter(colon),
						expression(definition.child(2)));
			}
		}
		else {
			name = name(definition);
		}
		AssignEqual equal = null;
		BaseExpression defaultValue = null;
		if (item.size() > i + 1) {
			equal = assignEqual(item.child(i + 1));
			defaultValue = expression(item.child(i + 2));
		}
		Comma comma = next != null ? comma(next) : null;
		BaseParenthesizableWhitespace afterParam = parenAfter(next != null ? index(next) : lastIndex(item));
		return new Param(star, afterStar, name, annotation, equal, defaultValue, comma, afterParam);
	}

	private BaseExpression dottedName(ParseTree tree) {
		BaseExpression result = name(tree.child(0));
		for (int i = 1; i < tree.size(); i += 2) {
			int o = index(tree.child(i));
			Dot dot = new Dot(parenBefore(o), parenAfter(o));
			result = new Attribute(List.of(), result, dot, name(tree.child(i + 1)), List.of());
		}
		return result;
	}

	private static Name name(ParseTree leaf) {
		return Name.of(leaf.token().text());
	}

	// Punctuation

	private Comma comma(ParseTree leaf) {
		int i = index(leaf);
		return new Comma(parenBefore(i), parenAfter(i));
	}

	private Comma commaAt(List<ParseTree> items, int at) {
		return at < items.size() && items.get(at).isToken(",") ? comma(items.get(at)) : null;
	}

	private Colon colon(ParseTree leaf) {
		int i = index(leaf);
		return new Colon(parenBefore(i), parenAfter(i));
	}

	private AssignEqual assignEqual(ParseTree leaf) {
		int i = index(leaf);
		return new AssignEqual(parenBefore(i), parenAfter(i));
	}

	// Whitespace

	private String currentIndent() {
		return blockIndents.isEmpty() ? "" : blockIndents.get(blockIndents.size() - 1);
	}

	private String remaining(int gap) {
		return gaps[gap].substring(claimed[gap]);
	}

	private String take(int gap) {
		String text = remaining(gap);
		claimed[gap] = gaps[gap].length();
		return text;
	}

	private SimpleWhitespace simpleBefore(int token) {
		return SimpleWhitespace.of(take(token));
	}

	private SimpleWhitespace simpleAfter(int token) {
		return SimpleWhitespace.of(take(token + 1));
	}

	private BaseParenthesizableWhitespace parenBefore(int token) {
		return parenthesizable(take(token));
	}

	private BaseParenthesizableWhitespace parenAfter(int token) {
		return parenthesizable(take(token + 1));
	}

	/**
	 * Whitespace that may span lines: plain when it contains no real line break,
	 * otherwise the first line's trailing whitespace, any full lines, and the
	 * indentation of the last line.
	 */
	private BaseParenthesizableWhitespace parenthesizable(String text) {
		int lineEnd = firstLineBreak(text);
		if (lineEnd < 0) {
			return SimpleWhitespace.of(text);
		}
		int restStart = lineEnd + (text.startsWith("\r\n", lineEnd) ? 2 : 1);
		String firstLine = text.substring(0, lineEnd);
		String firstNewline = text.substring(lineEnd, restStart);
		int hash = firstLine.indexOf('#');
		TrailingWhitespace trailing = new TrailingWhitespace(
				SimpleWhitespace.of(hash < 0 ? firstLine : firstLine.substring(0, hash)),
				hash < 0 ? null : new Comment(firstLine.substring(hash)),
				newline(firstNewline));
		List<String> lines = splitLines(text.substring(restStart));
		String indent = currentIndent();
		List<EmptyLine> emptyLines = new ArrayList<>();
		for (int i = 0; i < lines.size() - 1; i++) {
			emptyLines.add(emptyLine(lines.get(i), indent));
		}
		String last = lines.get(lines.size() - 1);
		boolean indented = last.startsWith(indent);
		SimpleWhitespace lastLine = SimpleWhitespace.of(indented ? last.substring(indent.length()) : last);
		return new ParenthesizedWhitespace(trailing, emptyLines, indented, lastLine);
	}

	private TrailingWhitespace trailingWhitespace(int newlineToken) {
		String text = take(newlineToken);
		int hash = text.indexOf('#');
		return new TrailingWhitespace(
				SimpleWhitespace.of(hash < 0 ? text : text.substring(0, hash)),
				hash < 0 ? null : new Comment(text.substring(hash)),
				newline(tokens.get(newlineToken).text()));
	}

	/**
	 * The complete lines of a gap as empty lines; the final partial line is the
	 * statement's own indentation.
	 */
	private List<EmptyLine> leadingLines(int gap) {
		String text = take(gap);
		List<String> lines = splitLines(text);
		String indent = currentIndent();
		List<EmptyLine> result = new ArrayList<>();
		for (int i = 0; i < lines.size() - 1; i++) {
			result.add(emptyLine(lines.get(i), indent));
		}
		String partial = lines.get(lines.size() - 1);
		if (!text.isEmpty() && !partial.equals(indent)) {
			throw new IllegalStateException("Expected indentation '" + indent + "' but found '" + partial + "'");
		}
		return result;
	}

	private EmptyLine emptyLine(String line, String indent) {
		String body = stripNewline(line);
		boolean indented = body.startsWith(indent);
		String rest = indented ? body.substring(indent.length()) : body;
		int hash = rest.indexOf('#');
		return new EmptyLine(indented,
				SimpleWhitespace.of(hash < 0 ? rest : rest.substring(0, hash)),
				hash < 0 ? null : new Comment(rest.substring(hash)),
				newline(line.substring(body.length())));
	}

	private Newline newline(String text) {
		return text.equals(defaultNewline) ? Newline.DEFAULT : new Newline(text);
	}

	/**
	 * Index of the first line break not escaped by a backslash, or -1.
	 */
	private static int firstLineBreak(String text) {
		for (int i = 0; i < text.length(); i++) {
			char c = text.charAt(i);
			if (c == '\\') {
				i += text.startsWith("\r\n", i + 1) ? 2 : 1;
			}
			else if (c == '#') {
				while (i < text.length() && text.charAt(i) != '\n' && text.charAt(i) != '\r') {
					i++;
				}
				return i < text.length() ? i : -1;
			}
			else if (c == '\n' || c == '\r') {
				return i;
			}
		}
		return -1;
	}

	/**
	 * Splits into lines that keep their line endings; the last element is the
	 * unterminated remainder, possibly empty.
	 */
	static List<String> splitLines(String text) {
		List<String> lines = new ArrayList<>();
		int start = 0;
		for (int i = 0; i < text.length(); i++) {
			char c = text.charAt(i);
			if (c == '\r' && i + 1 < text.length() && text.charAt(i + 1) == '\n') {
				i++;
			}
			if (c == '\n' || c == '\r') {
				lines.add(text.substring(start, i + 1));
				start = i + 1;
			}
		}
		lines.add(text.substring(start));
		return lines;
	}

	private static String stripNewline(String line) {
		int end = line.length();
		while (end > 0 && (line.charAt(end - 1) == '\n' || line.charAt(end - 1) == '\r')) {
			end--;
		}
		return line.substring(0, end);
	}

	private static String lastPartialLine(String text) {
		List<String> lines = splitLines(text);
		return lines.get(lines.size() - 1);
	}

	// Bookkeeping

	private int index(ParseTree leaf) {
		return index(leaf.token());
	}

	private int index(Token token) {
		Integer i = indexOf.get(token);
		if (i == null) {
			throw new IllegalStateException("Token " + token + " is not part of this parse");
		}
		return i;
	}

	private int lastIndex(ParseTree tree) {
		ParseTree last = tree;
		while (!last.isLeaf()) {
			last = last.child(last.size() - 1);
		}
		return index(last);
	}

	private ParserSyntaxException invalid(ParseTree tree, String message) {
		return ParserSyntaxException.invalid(tokens, tree.firstToken(), message);
	}

	private void verifyAllClaimed() {
		for (int i = 0; i < gaps.length; i++) {
			if (claimed[i] != gaps[i].length()) {
				Token token = tokens.get(i);
				throw new IllegalStateException("Whitespace '" + remaining(i) + "' before " + token.describe()
						+ " at offset " + (token.start() - token.leadingTrivia().length())
						+ " was not assigned to any node");
			}
		}
	}
}
