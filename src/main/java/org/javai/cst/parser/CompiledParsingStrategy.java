package org.javai.cst.parser;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import org.javai.cst.grammar.GrammarVersion;
import org.javai.cst.tokenize.Token;
import org.javai.cst.tokenize.TokenKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hand-written recursive descent parser for the Python grammar.
 * <p>
 * Each rule of {@code META-INF/cst/python-grammar.yml} has one method here that
 * tries the same alternatives in the same order and builds the same parse tree,
 * including the collapse of single-child rules. The two must be kept in step:
 * {@link BackendConformance} compares them.
 * <p>
 * Every rule method either returns a tree and advances past it, or returns null
 * and leaves the position where it was.
 */
public class CompiledParsingStrategy implements ParsingStrategy {

	private static final Logger logger = LoggerFactory.getLogger(CompiledParsingStrategy.class);

	private static final String[] AUGMENTED_OPERATORS = {
			"+=", "-=", "*=", "@=", "/=", "%=", "&=", "|=", "^=", "<<=", ">>=", "**=", "//=" };
	private static final String[] COMPARISON_OPERATORS = { "<", ">", "==", ">=", "<=", "!=", "in" };

	@Override
	public ParseTree parse(List<Token> tokens, GrammarVersion version, ParseMode mode) throws ParserSyntaxException {
		Objects.requireNonNull(tokens, "tokens must not be null");
		if (tokens.isEmpty()) {
			throw new IllegalArgumentException("Token list must end with an ENDMARKER token");
		}
		Parser parser = new Parser(tokens, version);
		ParseTree tree = switch (mode) {
			case MODULE -> parser.fileInput();
			case STATEMENT -> parser.statementInput();
			case EXPRESSION -> parser.expressionInput();
		};
		if (tree == null) {
			throw parser.error();
		}
		logger.debug("Parsed {} tokens as {}", tokens.size(), mode);
		return tree;
	}

	@FunctionalInterface
	private interface Rule {
		ParseTree parse();
	}

	private record Memo(ParseTree tree, int end) {
	}

	private static final class Parser {
		private final List<Token> tokens;
		private final boolean walrus;
		private final Set<String> expected = new TreeSet<>();
		private final Map<Integer, Memo> testMemo = new HashMap<>();
		private int farthest = -1;
		private int pos = 0;

		Parser(List<Token> tokens, GrammarVersion version) {
			this.tokens = tokens;
			this.walrus = version.isAtLeast(GrammarVersion.PYTHON_3_8);
		}

		ParserSyntaxException error() {
			return ParserSyntaxException.at(tokens, tokenAt(Math.max(farthest, 0)), expected);
		}

		// Entry points

		ParseTree fileInput() {
			int start = pos;
			List<ParseTree> c = new ArrayList<>();
			repeat(c, this::stmt);
			if (!add(c, tok(TokenKind.ENDMARKER))) {
				return reset(start);
			}
			return node("file_input", c);
		}

		ParseTree statementInput() {
			int start = pos;
			List<ParseTree> c = new ArrayList<>();
			if (!add(c, stmt()) || !add(c, tok(TokenKind.ENDMARKER))) {
				return reset(start);
			}
			return node("statement_input", c);
		}

		ParseTree expressionInput() {
			int start = pos;
			List<ParseTree> c = new ArrayList<>();
			if (!add(c, testlistStarExpr()) || !add(c, tok(TokenKind.NEWLINE)) || !add(c, tok(TokenKind.ENDMARKER))) {
				return reset(start);
			}
			return node("expression_input", c);
		}

		// Statements

		private ParseTree stmt() {
			return first(this::compoundStmt, this::simpleStmt);
		}

		private ParseTree compoundStmt() {
			return first(this::ifStmt, this::whileStmt, this::forStmt, this::tryStmt, this::withStmt,
					this::funcdef, this::classdef, this::decorated, this::asyncStmt);
		}

		private ParseTree asyncStmt() {
			int start = pos;
			List<ParseTree> c = new ArrayList<>();
			if (!add(c, lit("async")) || !add(c, first(this::funcdef, this::withStmt, this::forStmt))) {
				return reset(start);
			}
			return node("async_stmt", c);
		}

		private ParseTree simpleStmt() {
			int start = pos;
			List<ParseTree> c = new ArrayList<>();
			if (!add(c, smallStmt())) {
				return reset(start);
			}
			separated(c, ";", this::smallStmt);
			optional(c, lit(";"));
			if (!add(c, tok(TokenKind.NEWLINE))) {
				return reset(start);
			}
			return node("simple_stmt", c);
		}

		private ParseTree smallStmt() {
			return first(this::delStmt, this::passStmt, this::breakStmt, this::continueStmt, this::returnStmt,
					this::raiseStmt, this::globalStmt, this::nonlocalStmt, this::assertStmt, this::importName,
					this::importFrom, this::exprStmt, this::yieldExpr);
		}

		private ParseTree exprStmt() {
			int start = pos;
			List<ParseTree> c = new ArrayList<>();
			if (!add(c, testlistStarExpr())) {
				return reset(start);
			}
			if (add(c, annassign())) {
				return node("expr_stmt", c);
			}
			int mark = pos;
			ParseTree augmented = augassign();
			if (augmented != null) {
				ParseTree value = first(this::yieldExpr, this::testlist);
				if (value != null) {
					c.add(augmented);
					c.add(value);
					return node("expr_stmt", c);
				}
				pos = mark;
			}
			while (true) {
				int iteration = pos;
				ParseTree equal = lit("=");
				if (equal == null) {
					break;
				}
				ParseTree value = first(this::yieldExpr, this::testlistStarExpr);
				if (value == null) {
					pos = iteration;
					break;
				}
				c.add(equal);
				c.add(value);
			}
			return node("expr_stmt", c);
		}

		private ParseTree annassign() {
			int start = pos;
			List<ParseTree> c = new ArrayList<>();
			if (!add(c, lit(":")) || !add(c, test())) {
				return reset(start);
			}
			int mark = pos;
			ParseTree equal = lit("=");
			if (equal != null) {
				ParseTree value = first(this::yieldExpr, this::testlistStarExpr);
				if (value != null) {
					c.add(equal);
					c.add(value);
				}
				else {
					pos = mark;
				}
			}
			return node("annassign", c);
		}

		private ParseTree augassign() {
			return anyLit(AUGMENTED_OPERATORS);
		}

		private ParseTree delStmt() {
			return keywordThen("del_stmt", "del", this::exprlist);
		}

		private ParseTree passStmt() {
			return keywordOnly("pass_stmt", "pass");
		}

		private ParseTree breakStmt() {
			return keywordOnly("break_stmt", "break");
		}

		private ParseTree continueStmt() {
			return keywordOnly("continue_stmt", "continue");
		}

		private ParseTree returnStmt() {
			int start = pos;
			List<ParseTree> c = new ArrayList<>();
			if (!add(c, lit("return"))) {
				return reset(start);
			}
			optional(c, testlistStarExpr());
			return node("return_stmt", c);
		}

		private ParseTree raiseStmt() {
			int start = pos;
			List<ParseTree> c = new ArrayList<>();
			if (!add(c, lit("raise"))) {
				return reset(start);
			}
			if (add(c, test())) {
				pair(c, "from", this::test);
			}
			return node("raise_stmt", c);
		}

		private ParseTree globalStmt() {
			return nameList("global_stmt", "global");
		}

		private ParseTree nonlocalStmt() {
			return nameList("nonlocal_stmt", "nonlocal");
		}

		private ParseTree nameList(String symbol, String keyword) {
			int start = pos;
			List<ParseTree> c = new ArrayList<>();
			if (!add(c, lit(keyword)) || !add(c, tok(TokenKind.NAME))) {
				return reset(start);
			}
			separated(c, ",", this::name);
			return node(symbol, c);
		}

		private ParseTree assertStmt() {
			int start = pos;
			List<ParseTree> c = new ArrayList<>();
			if (!add(c, lit("assert")) || !add(c, test())) {
				return reset(start);
			}
			pair(c, ",", this::test);
			return node("assert_stmt", c);
		}

		private ParseTree importName() {
			return keywordThen("import_name", "import", this::dottedAsNames);
		}

		private ParseTree importFrom() {
			int start = pos;
			List<ParseTree> c = new ArrayList<>();
			if (add(c, lit("from"))) {
				repeat(c, this::importDot);
				if (add(c, dottedName()) && add(c, lit("import")) && add(c, importTargets())) {
					return node("import_from", c);
				}
			}
			reset(start);
			c = new ArrayList<>();
			if (add(c, lit("from")) && add(c, importDot())) {
				repeat(c, this::importDot);
				if (add(c, lit("import")) && add(c, importTargets())) {
					return node("import_from", c);
				}
			}
			return reset(start);
		}

		private ParseTree importDot() {
			return anyLit(".", "...");
		}

		private ParseTree importTargets() {
			int start = pos;
			List<ParseTree> c = new ArrayList<>();
			if (add(c, lit("*"))) {
				return node("import_targets", c);
			}
			if (add(c, lit("(")) && add(c, importAsNames()) && add(c, lit(")"))) {
				return node("import_targets", c);
			}
			reset(start);
			c = new ArrayList<>();
			if (add(c, importAsNames())) {
				return node("import_targets", c);
			}
			return reset(start);
		}

		private ParseTree importAsName() {
			int start = pos;
			List<ParseTree> c = new ArrayList<>();
			if (!add(c, tok(TokenKind.NAME))) {
				return reset(start);
			}
			pair(c, "as", this::name);
			return node("import_as_name", c);
		}

		private ParseTree dottedAsName() {
			int start = pos;
			List<ParseTree> c = new ArrayList<>();
			if (!add(c, dottedName())) {
				return reset(start);
			}
			pair(c, "as", this::name);
			return node("dotted_as_name", c);
		}

		private ParseTree importAsNames() {
			int start = pos;
			List<ParseTree> c = new ArrayList<>();
			if (!add(c, importAsName())) {
				return reset(start);
			}
			separated(c, ",", this::importAsName);
			optional(c, lit(","));
			return node("import_as_names", c);
		}

		private ParseTree dottedAsNames() {
			int start = pos;
			List<ParseTree> c = new ArrayList<>();
			if (!add(c, dottedAsName())) {
				return reset(start);
			}
			separated(c, ",", this::dottedAsName);
			return node("dotted_as_names", c);
		}

		private ParseTree dottedName() {
			int start = pos;
			List<ParseTree> c = new ArrayList<>();
			if (!add(c, tok(TokenKind.NAME))) {
				return reset(start);
			}
			separated(c, ".", this::name);
			return node("dotted_name", c);
		}

		// Compound statements

		private ParseTree ifStmt() {
			int start = pos;
			List<ParseTree> c = new ArrayList<>();
			if (!add(c, lit("if")) || !add(c, namedexprTest()) || !add(c, lit(":")) || !add(c, suite())) {
				return reset(start);
			}
			while (true) {
				int iteration = pos;
				List<ParseTree> clause = new ArrayList<>();
				if (!add(clause, lit("elif")) || !add(clause, namedexprTest()) || !add(clause, lit(":"))
						|| !add(clause, suite())) {
					pos = iteration;
					break;
				}
				c.addAll(clause);
			}
			elseClause(c);
			return node("if_stmt", c);
		}

		private ParseTree whileStmt() {
			int start = pos;
			List<ParseTree> c = new ArrayList<>();
			if (!add(c, lit("while")) || !add(c, namedexprTest()) || !add(c, lit(":")) || !add(c, suite())) {
				return reset(start);
			}
			elseClause(c);
			return node("while_stmt", c);
		}

		private ParseTree forStmt() {
			int start = pos;
			List<ParseTree> c = new ArrayList<>();
			if (!add(c, lit("for")) || !add(c, exprlist()) || !add(c, lit("in")) || !add(c, testlist())
					|| !add(c, lit(":")) || !add(c, suite())) {
				return reset(start);
			}
			elseClause(c);
			return node("for_stmt", c);
		}

		private ParseTree tryStmt() {
			int start = pos;
			List<ParseTree> c = new ArrayList<>();
			if (add(c, lit("try")) && add(c, lit(":")) && add(c, suite())) {
				int handlers = 0;
				while (true) {
					int iteration = pos;
					List<ParseTree> clause = new ArrayList<>();
					if (!add(clause, exceptClause()) || !add(clause, lit(":")) || !add(clause, suite())) {
						pos = iteration;
						break;
					}
					c.addAll(clause);
					handlers++;
				}
				if (handlers > 0) {
					elseClause(c);
					keywordSuite(c, "finally");
					return node("try_stmt", c);
				}
			}
			reset(start);
			c = new ArrayList<>();
			if (add(c, lit("try")) && add(c, lit(":")) && add(c, suite()) && add(c, lit("finally"))
					&& add(c, lit(":")) && add(c, suite())) {
				return node("try_stmt", c);
			}
			return reset(start);
		}

		private ParseTree exceptClause() {
			int start = pos;
			List<ParseTree> c = new ArrayList<>();
			if (!add(c, lit("except"))) {
				return reset(start);
			}
			if (add(c, test())) {
				pair(c, "as", this::name);
			}
			return node("except_clause", c);
		}

		private ParseTree withStmt() {
			int start = pos;
			List<ParseTree> c = new ArrayList<>();
			if (!add(c, lit("with")) || !add(c, withItem())) {
				return reset(start);
			}
			separated(c, ",", this::withItem);
			if (!add(c, lit(":")) || !add(c, suite())) {
				return reset(start);
			}
			return node("with_stmt", c);
		}

		private ParseTree withItem() {
			int start = pos;
			List<ParseTree> c = new ArrayList<>();
			if (!add(c, test())) {
				return reset(start);
			}
			pair(c, "as", this::expr);
			return node("with_item", c);
		}

		private ParseTree funcdef() {
			int start = pos;
			List<ParseTree> c = new ArrayList<>();
			if (!add(c, lit("def")) || !add(c, tok(TokenKind.NAME)) || !add(c, parameters())) {
				return reset(start);
			}
			pair(c, "->", this::test);
			if (!add(c, lit(":")) || !add(c, suite())) {
				return reset(start);
			}
			return node("funcdef", c);
		}

		private ParseTree parameters() {
			int start = pos;
			List<ParseTree> c = new ArrayList<>();
			if (!add(c, lit("("))) {
				return reset(start);
			}
			optional(c, typedargslist());
			if (!add(c, lit(")"))) {
				return reset(start);
			}
			return node("parameters", c);
		}

		private ParseTree typedargslist() {
			return argumentList("typedargslist", this::typedarg);
		}

		private ParseTree typedarg() {
			return parameter("typedarg", this::tfpdef);
		}

		private ParseTree tfpdef() {
			int start = pos;
			List<ParseTree> c = new ArrayList<>();
			if (!add(c, tok(TokenKind.NAME))) {
				return reset(start);
			}
			pair(c, ":", this::test);
			return node("tfpdef", c);
		}

		private ParseTree varargslist() {
			return argumentList("varargslist", this::vararg);
		}

		private ParseTree vararg() {
			return parameter("vararg", this::name);
		}

		private ParseTree argumentList(String symbol, Rule item) {
			int start = pos;
			List<ParseTree> c = new ArrayList<>();
			if (!add(c, item.parse())) {
				return reset(start);
			}
			separated(c, ",", item);
			optional(c, lit(","));
			return node(symbol, c);
		}

		/**
		 * {@code '**' p | '*' [p] | '/' | p ['=' test]} where {@code '/'} needs 3.8.
		 */
		private ParseTree parameter(String symbol, Rule target) {
			int start = pos;
			List<ParseTree> c = new ArrayList<>();
			if (add(c, lit("**")) && add(c, target.parse())) {
				return node(symbol, c);
			}
			reset(start);
			c = new ArrayList<>();
			if (add(c, lit("*"))) {
				optional(c, target.parse());
				return node(symbol, c);
			}
			if (walrus && add(c, lit("/"))) {
				return node(symbol, c);
			}
			if (add(c, target.parse())) {
				pair(c, "=", this::test);
				return node(symbol, c);
			}
			return reset(start);
		}

		private ParseTree classdef() {
			int start = pos;
			List<ParseTree> c = new ArrayList<>();
			if (!add(c, lit("class")) || !add(c, tok(TokenKind.NAME))) {
				return reset(start);
			}
			callParens(c);
			if (!add(c, lit(":")) || !add(c, suite())) {
				return reset(start);
			}
			return node("classdef", c);
		}

		private ParseTree decorated() {
			int start = pos;
			List<ParseTree> c = new ArrayList<>();
			if (!add(c, decorator())) {
				return reset(start);
			}
			repeat(c, this::decorator);
			if (!add(c, first(this::classdef, this::funcdef, this::asyncFuncdef))) {
				return reset(start);
			}
			return node("decorated", c);
		}

		private ParseTree asyncFuncdef() {
			return keywordThen("async_funcdef", "async", this::funcdef);
		}

		private ParseTree decorator() {
			int start = pos;
			List<ParseTree> c = new ArrayList<>();
			if (!add(c, lit("@")) || !add(c, dottedName())) {
				return reset(start);
			}
			callParens(c);
			if (!add(c, tok(TokenKind.NEWLINE))) {
				return reset(start);
			}
			return node("decorator", c);
		}

		private ParseTree suite() {
			int start = pos;
			List<ParseTree> c = new ArrayList<>();
			if (add(c, simpleStmt())) {
				return node("suite", c);
			}
			if (add(c, tok(TokenKind.NEWLINE)) && add(c, tok(TokenKind.INDENT)) && add(c, stmt())) {
				repeat(c, this::stmt);
				if (add(c, tok(TokenKind.DEDENT))) {
					return node("suite", c);
				}
			}
			return reset(start);
		}

		// Expressions

		private ParseTree namedexprTest() {
			int start = pos;
			if (walrus) {
				List<ParseTree> c = new ArrayList<>();
				if (add(c, tok(TokenKind.NAME)) && add(c, lit(":=")) && add(c, test())) {
					return node("namedexpr_test", c);
				}
				reset(start);
			}
			return test();
		}

		private ParseTree test() {
			int start = pos;
			Memo memo = testMemo.get(start);
			if (memo != null) {
				if (memo.tree() != null) {
					pos = memo.end();
				}
				return memo.tree();
			}
			ParseTree tree = testUncached();
			testMemo.put(start, new Memo(tree, pos));
			return tree;
		}

		private ParseTree testUncached() {
			int start = pos;
			List<ParseTree> c = new ArrayList<>();
			if (add(c, orTest())) {
				int mark = pos;
				List<ParseTree> conditional = new ArrayList<>();
				if (add(conditional, lit("if")) && add(conditional, orTest()) && add(conditional, lit("else"))
						&& add(conditional, test())) {
					c.addAll(conditional);
				}
				else {
					pos = mark;
				}
				return collapse("test", c);
			}
			ParseTree lambda = lambdef();
			return lambda != null ? lambda : reset(start);
		}

		private ParseTree testNocond() {
			return first(this::orTest, this::lambdefNocond);
		}

		private ParseTree lambdef() {
			return lambda("lambdef", this::test);
		}

		private ParseTree lambdefNocond() {
			return lambda("lambdef_nocond", this::testNocond);
		}

		private ParseTree lambda(String symbol, Rule body) {
			int start = pos;
			List<ParseTree> c = new ArrayList<>();
			if (!add(c, lit("lambda"))) {
				return reset(start);
			}
			optional(c, varargslist());
			if (!add(c, lit(":")) || !add(c, body.parse())) {
				return reset(start);
			}
			return node(symbol, c);
		}

		private ParseTree orTest() {
			return chain("or_test", this::andTest, "or");
		}

		private ParseTree andTest() {
			return chain("and_test", this::notTest, "and");
		}

		private ParseTree notTest() {
			int start = pos;
			List<ParseTree> c = new ArrayList<>();
			if (add(c, lit("not")) && add(c, notTest())) {
				return node("not_test", c);
			}
			reset(start);
			return comparison();
		}

		private ParseTree comparison() {
			return chain("comparison", this::expr, this::compOp);
		}

		private ParseTree compOp() {
			ParseTree single = anyLit(COMPARISON_OPERATORS);
			if (single != null) {
				return single;
			}
			int start = pos;
			List<ParseTree> c = new ArrayList<>();
			if (add(c, lit("not")) && add(c, lit("in"))) {
				return node("comp_op", c);
			}
			reset(start);
			c = new ArrayList<>();
			if (add(c, lit("is")) && add(c, lit("not"))) {
				return node("comp_op", c);
			}
			reset(start);
			return lit("is");
		}

		private ParseTree starExpr() {
			return keywordThen("star_expr", "*", this::expr);
		}

		private ParseTree expr() {
			return chain("expr", this::xorExpr, "|");
		}

		private ParseTree xorExpr() {
			return chain("xor_expr", this::andExpr, "^");
		}

		private ParseTree andExpr() {
			return chain("and_expr", this::shiftExpr, "&");
		}

		private ParseTree shiftExpr() {
			return chain("shift_expr", this::arithExpr, "<<", ">>");
		}

		private ParseTree arithExpr() {
			return chain("arith_expr", this::term, "+", "-");
		}

		private ParseTree term() {
			return chain("term", this::factor, "*", "@", "/", "%", "//");
		}

		private ParseTree factor() {
			int start = pos;
			List<ParseTree> c = new ArrayList<>();
			if (add(c, anyLit("+", "-", "~")) && add(c, factor())) {
				return node("factor", c);
			}
			reset(start);
			return power();
		}

		private ParseTree power() {
			int start = pos;
			List<ParseTree> c = new ArrayList<>();
			if (!add(c, atomExpr())) {
				return reset(start);
			}
			pair(c, "**", this::factor);
			return collapse("power", c);
		}

		private ParseTree atomExpr() {
			int start = pos;
			List<ParseTree> c = new ArrayList<>();
			optional(c, lit("await"));
			if (!add(c, atom())) {
				return reset(start);
			}
			repeat(c, this::trailer);
			return collapse("atom_expr", c);
		}

		private ParseTree atom() {
			int start = pos;
			List<ParseTree> c = new ArrayList<>();
			if (add(c, lit("("))) {
				optional(c, first(this::yieldExpr, this::testlistComp));
				if (add(c, lit(")"))) {
					return collapse("atom", c);
				}
				reset(start);
				c = new ArrayList<>();
			}
			if (add(c, lit("["))) {
				optional(c, testlistComp());
				if (add(c, lit("]"))) {
					return collapse("atom", c);
				}
				reset(start);
				c = new ArrayList<>();
			}
			if (add(c, lit("{"))) {
				optional(c, dictorsetmaker());
				if (add(c, lit("}"))) {
					return collapse("atom", c);
				}
				reset(start);
			}
			ParseTree single = first(this::name, this::number, this::strings, () -> lit("..."),
					() -> lit("None"), () -> lit("True"), () -> lit("False"));
			return single != null ? single : reset(start);
		}

		private ParseTree strings() {
			int start = pos;
			List<ParseTree> c = new ArrayList<>();
			if (!add(c, tok(TokenKind.STRING))) {
				return reset(start);
			}
			repeat(c, () -> tok(TokenKind.STRING));
			return collapse("strings", c);
		}

		private ParseTree testlistComp() {
			return comprehensionOrList("testlist_comp", this::namedexprOrStar, true);
		}

		private ParseTree namedexprOrStar() {
			return first(this::namedexprTest, this::starExpr);
		}

		private ParseTree trailer() {
			int start = pos;
			List<ParseTree> c = new ArrayList<>();
			if (add(c, lit("("))) {
				optional(c, arglist());
				if (add(c, lit(")"))) {
					return node("trailer", c);
				}
				reset(start);
				c = new ArrayList<>();
			}
			if (add(c, lit("["))) {
				if (add(c, subscriptlist()) && add(c, lit("]"))) {
					return node("trailer", c);
				}
				reset(start);
				c = new ArrayList<>();
			}
			if (add(c, lit(".")) && add(c, tok(TokenKind.NAME))) {
				return node("trailer", c);
			}
			return reset(start);
		}

		private ParseTree subscriptlist() {
			int start = pos;
			List<ParseTree> c = new ArrayList<>();
			if (!add(c, subscript())) {
				return reset(start);
			}
			separated(c, ",", this::subscript);
			optional(c, lit(","));
			return collapse("subscriptlist", c);
		}

		private ParseTree subscript() {
			int start = pos;
			List<ParseTree> c = new ArrayList<>();
			optional(c, test());
			if (add(c, lit(":"))) {
				optional(c, test());
				optional(c, sliceop());
				return node("subscript", c);
			}
			reset(start);
			c = new ArrayList<>();
			if (add(c, test())) {
				return node("subscript", c);
			}
			return reset(start);
		}

		private ParseTree sliceop() {
			int start = pos;
			List<ParseTree> c = new ArrayList<>();
			if (!add(c, lit(":"))) {
				return reset(start);
			}
			optional(c, test());
			return node("sliceop", c);
		}

		private ParseTree exprlist() {
			return plainList("exprlist", () -> first(this::expr, this::starExpr));
		}

		private ParseTree testlist() {
			return plainList("testlist", this::test);
		}

		private ParseTree testlistStarExpr() {
			return plainList("testlist_star_expr", () -> first(this::test, this::starExpr));
		}

		private ParseTree dictorsetmaker() {
			ParseTree dict = comprehensionOrList("dictorsetmaker", this::dictEntry, false);
			if (dict != null) {
				return dict;
			}
			return comprehensionOrList("dictorsetmaker", this::setEntry, false);
		}

		private ParseTree dictEntry() {
			int start = pos;
			List<ParseTree> c = new ArrayList<>();
			if (add(c, test()) && add(c, lit(":")) && add(c, test())) {
				return node("dict_entry", c);
			}
			reset(start);
			c = new ArrayList<>();
			if (add(c, lit("**")) && add(c, expr())) {
				return node("dict_entry", c);
			}
			return reset(start);
		}

		private ParseTree setEntry() {
			return first(this::namedexprTest, this::starExpr);
		}

		private ParseTree arglist() {
			int start = pos;
			List<ParseTree> c = new ArrayList<>();
			if (!add(c, argument())) {
				return reset(start);
			}
			separated(c, ",", this::argument);
			optional(c, lit(","));
			return node("arglist", c);
		}

		private ParseTree argument() {
			int start = pos;
			List<ParseTree> c = new ArrayList<>();
			if (walrus) {
				if (add(c, tok(TokenKind.NAME)) && add(c, lit(":=")) && add(c, test())) {
					return node("argument", c);
				}
				reset(start);
				c = new ArrayList<>();
			}
			if (add(c, tok(TokenKind.NAME)) && add(c, lit("=")) && add(c, test())) {
				return node("argument", c);
			}
			reset(start);
			c = new ArrayList<>();
			if (add(c, test())) {
				optional(c, compFor());
				return node("argument", c);
			}
			if (add(c, lit("**")) && add(c, test())) {
				return node("argument", c);
			}
			reset(start);
			c = new ArrayList<>();
			if (add(c, lit("*")) && add(c, test())) {
				return node("argument", c);
			}
			return reset(start);
		}

		private ParseTree compIter() {
			return first(this::compFor, this::compIf);
		}

		private ParseTree compFor() {
			int start = pos;
			List<ParseTree> c = new ArrayList<>();
			optional(c, lit("async"));
			if (!add(c, lit("for")) || !add(c, exprlist()) || !add(c, lit("in")) || !add(c, orTest())) {
				return reset(start);
			}
			optional(c, compIter());
			return node("comp_for", c);
		}

		private ParseTree compIf() {
			int start = pos;
			List<ParseTree> c = new ArrayList<>();
			if (!add(c, lit("if")) || !add(c, testNocond())) {
				return reset(start);
			}
			optional(c, compIter());
			return node("comp_if", c);
		}

		private ParseTree yieldExpr() {
			int start = pos;
			List<ParseTree> c = new ArrayList<>();
			if (!add(c, lit("yield"))) {
				return reset(start);
			}
			optional(c, yieldArg());
			return node("yield_expr", c);
		}

		private ParseTree yieldArg() {
			int start = pos;
			List<ParseTree> c = new ArrayList<>();
			if (add(c, lit("from")) && add(c, test())) {
				return node("yield_arg", c);
			}
			reset(start);
			return testlistStarExpr();
		}

		// Shapes shared by several rules

		/**
		 * {@code item (op item)*} for a collapsing rule.
		 */
		private ParseTree chain(String symbol, Rule item, String... operators) {
			return chain(symbol, item, () -> anyLit(operators));
		}

		private ParseTree chain(String symbol, Rule item, Rule operator) {
			int start = pos;
			List<ParseTree> c = new ArrayList<>();
			if (!add(c, item.parse())) {
				return reset(start);
			}
			while (true) {
				int iteration = pos;
				ParseTree op = operator.parse();
				if (op == null) {
					break;
				}
				ParseTree right = item.parse();
				if (right == null) {
					pos = iteration;
					break;
				}
				c.add(op);
				c.add(right);
			}
			return collapse(symbol, c);
		}

		/**
		 * {@code item (',' item)* [',']} for a collapsing rule.
		 */
		private ParseTree plainList(String symbol, Rule item) {
			int start = pos;
			List<ParseTree> c = new ArrayList<>();
			if (!add(c, item.parse())) {
				return reset(start);
			}
			separated(c, ",", item);
			optional(c, lit(","));
			return collapse(symbol, c);
		}

		/**
		 * {@code item (comp_for | (',' item)* [','])}.
		 */
		private ParseTree comprehensionOrList(String symbol, Rule item, boolean collapsing) {
			int start = pos;
			List<ParseTree> c = new ArrayList<>();
			if (!add(c, item.parse())) {
				return reset(start);
			}
			if (!add(c, compFor())) {
				separated(c, ",", item);
				optional(c, lit(","));
			}
			return collapsing ? collapse(symbol, c) : node(symbol, c);
		}

		private ParseTree keywordOnly(String symbol, String keyword) {
			int start = pos;
			List<ParseTree> c = new ArrayList<>();
			if (!add(c, lit(keyword))) {
				return reset(start);
			}
			return node(symbol, c);
		}

		private ParseTree keywordThen(String symbol, String keyword, Rule rest) {
			int start = pos;
			List<ParseTree> c = new ArrayList<>();
			if (!add(c, lit(keyword)) || !add(c, rest.parse())) {
				return reset(start);
			}
			return node(symbol, c);
		}

		private void elseClause(List<ParseTree> c) {
			keywordSuite(c, "else");
		}

		/**
		 * Optional {@code keyword ':' suite}.
		 */
		private void keywordSuite(List<ParseTree> c, String keyword) {
			int mark = pos;
			List<ParseTree> clause = new ArrayList<>();
			if (add(clause, lit(keyword)) && add(clause, lit(":")) && add(clause, suite())) {
				c.addAll(clause);
			}
			else {
				pos = mark;
			}
		}

		/**
		 * Optional {@code '(' [arglist] ')'}.
		 */
		private void callParens(List<ParseTree> c) {
			int mark = pos;
			List<ParseTree> parens = new ArrayList<>();
			if (add(parens, lit("("))) {
				optional(parens, arglist());
				if (add(parens, lit(")"))) {
					c.addAll(parens);
					return;
				}
			}
			pos = mark;
		}

		/**
		 * Optional {@code literal item}.
		 */
		private void pair(List<ParseTree> c, String literal, Rule item) {
			int mark = pos;
			ParseTree head = lit(literal);
			if (head == null) {
				return;
			}
			ParseTree tail = item.parse();
			if (tail == null) {
				pos = mark;
				return;
			}
			c.add(head);
			c.add(tail);
		}

		/**
		 * Zero or more {@code separator item}.
		 */
		private void separated(List<ParseTree> c, String separator, Rule item) {
			while (true) {
				int iteration = pos;
				ParseTree sep = lit(separator);
				if (sep == null) {
					return;
				}
				ParseTree next = item.parse();
				if (next == null) {
					pos = iteration;
					return;
				}
				c.add(sep);
				c.add(next);
			}
		}

		private void repeat(List<ParseTree> c, Rule item) {
			while (true) {
				ParseTree next = item.parse();
				if (next == null) {
					return;
				}
				c.add(next);
			}
		}

		private ParseTree first(Rule... options) {
			for (Rule option : options) {
				ParseTree tree = option.parse();
				if (tree != null) {
					return tree;
				}
			}
			return null;
		}

		private ParseTree name() {
			return tok(TokenKind.NAME);
		}

		private ParseTree number() {
			return tok(TokenKind.NUMBER);
		}

		// Terminals

		private ParseTree lit(String text) {
			Token token = tokenAt(pos);
			if (token.is(text)) {
				pos++;
				return ParseTree.leaf(token);
			}
			fail("'" + text + "'");
			return null;
		}

		private ParseTree anyLit(String... texts) {
			for (String text : texts) {
				ParseTree tree = lit(text);
				if (tree != null) {
					return tree;
				}
			}
			return null;
		}

		private ParseTree tok(TokenKind kind) {
			Token token = tokenAt(pos);
			if (token.isKind(kind)) {
				pos++;
				return ParseTree.leaf(token);
			}
			fail(kind.name());
			return null;
		}

		private void fail(String terminal) {
			if (pos > farthest) {
				farthest = pos;
				expected.clear();
			}
			if (pos == farthest) {
				expected.add(terminal);
			}
		}

		private Token tokenAt(int index) {
			return tokens.get(Math.min(index, tokens.size() - 1));
		}

		private ParseTree reset(int start) {
			pos = start;
			return null;
		}

		private static boolean add(List<ParseTree> c, ParseTree tree) {
			if (tree == null) {
				return false;
			}
			c.add(tree);
			return true;
		}

		private static void optional(List<ParseTree> c, ParseTree tree) {
			if (tree != null) {
				c.add(tree);
			}
		}

		private static ParseTree node(String symbol, List<ParseTree> c) {
			return ParseTree.node(symbol, c);
		}

		private static ParseTree collapse(String symbol, List<ParseTree> c) {
			return c.size() == 1 ? c.get(0) : ParseTree.node(symbol, c);
		}
	}
}
