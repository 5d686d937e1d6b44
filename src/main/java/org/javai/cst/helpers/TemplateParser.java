package org.javai.cst.helpers;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.javai.cst.codegen.CstRenderer;
import org.javai.cst.nodes.BaseCompoundStatement;
import org.javai.cst.nodes.BaseExpression;
import org.javai.cst.nodes.BaseStatement;
import org.javai.cst.nodes.CstNode;
import org.javai.cst.nodes.CstNodes;
import org.javai.cst.nodes.LeftParen;
import org.javai.cst.nodes.Module;
import org.javai.cst.nodes.Name;
import org.javai.cst.nodes.RightParen;
import org.javai.cst.nodes.SimpleStatementLine;
import org.javai.cst.parser.CstParser;
import org.javai.cst.parser.ParserConfig;
import org.javai.cst.visit.CstTransformer;
import org.javai.cst.visit.CstVisitor;
import org.javai.cst.visit.CstWalker;
import org.javai.cst.visit.Replacement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses source templates with {@code {name}} placeholders and substitutes
 * expression nodes for them.
 * <p>
 * Each placeholder is replaced by a reserved identifier before parsing, so the
 * template must be valid Python with the placeholders read as names. After
 * parsing, every reserved identifier is swapped for its replacement node.
 * Parentheses written around a placeholder are kept around the replacement.
 * <pre>{@code
 * Module module = TemplateParser.parseTemplateModule("from {mod} import Foo\n",
 *         Map.of("mod", Name.of("bar")));
 * }</pre>
 */
public final class TemplateParser {

	private static final Logger logger = LoggerFactory.getLogger(TemplateParser.class);

	static final String PREFIX = "__CST_MANGLED_NAME_";
	static final String SUFFIX = "_EMAN_DELGNAM_TSC__";

	private TemplateParser() {
	}

	public static Module parseTemplateModule(String template, Map<String, ? extends CstNode> replacements) {
		return parseTemplateModule(template, replacements, ParserConfig.defaults());
	}

	public static Module parseTemplateModule(String template, Map<String, ? extends CstNode> replacements,
			ParserConfig config) {
		Module module = CstParser.parseModule(mangle(template, replacements.keySet()), config);
		return CstNodes.ensureType(substitute(module, replacements), Module.class);
	}

	public static BaseStatement parseTemplateStatement(String template, Map<String, ? extends CstNode> replacements) {
		return parseTemplateStatement(template, replacements, ParserConfig.defaults());
	}

	/**
	 * Parses a statement template; a missing trailing newline is added.
	 *
	 * @throws IllegalArgumentException if the substituted result is not a statement
	 */
	public static BaseStatement parseTemplateStatement(String template, Map<String, ? extends CstNode> replacements,
			ParserConfig config) {
		BaseStatement statement = CstParser.parseStatement(mangle(template, replacements.keySet()), config);
		CstNode result = substitute(statement, replacements);
		if (!(result instanceof SimpleStatementLine) && !(result instanceof BaseCompoundStatement)) {
			throw new IllegalArgumentException("Expected a statement but got a " + result.getClass().getSimpleName());
		}
		return (BaseStatement) result;
	}

	public static BaseExpression parseTemplateExpression(String template, Map<String, ? extends CstNode> replacements) {
		return parseTemplateExpression(template, replacements, ParserConfig.defaults());
	}

	/**
	 * Parses an expression template written on one line without surrounding
	 * whitespace.
	 */
	public static BaseExpression parseTemplateExpression(String template, Map<String, ? extends CstNode> replacements,
			ParserConfig config) {
		BaseExpression expression = CstParser.parseExpression(mangle(template, replacements.keySet()), config);
		return CstNodes.ensureType(substitute(expression, replacements), BaseExpression.class);
	}

	static String mangledName(String variable) {
		return PREFIX + variable + SUFFIX;
	}

	/**
	 * Replaces every {@code {variable}} with its reserved identifier.
	 *
	 * @throws IllegalArgumentException if the template already contains a reserved
	 * marker or does not mention one of the variables
	 */
	static String mangle(String template, Set<String> variables) {
		Objects.requireNonNull(template, "template must not be null");
		if (template.contains(PREFIX) || template.contains(SUFFIX)) {
			throw new IllegalArgumentException("Cannot parse a template containing reserved strings");
		}
		String mangled = template;
		for (String variable : variables) {
			String placeholder = "{" + variable + "}";
			if (!mangled.contains(placeholder)) {
				throw new IllegalArgumentException("Template is missing a reference to " + variable);
			}
			mangled = mangled.replace(placeholder, mangledName(variable));
		}
		return mangled;
	}

	private static CstNode substitute(CstNode tree, Map<String, ? extends CstNode> replacements) {
		Objects.requireNonNull(replacements, "replacements must not be null");
		for (Map.Entry<String, ? extends CstNode> entry : replacements.entrySet()) {
			if (!(entry.getValue() instanceof BaseExpression)) {
				throw new IllegalArgumentException("Template replacement for " + entry.getKey() + " is unsupported");
			}
		}
		CstNode result = CstWalker.transform(tree, new Unmangler(replacements));
		CstWalker.visit(result, new PlaceholderChecker(replacements.keySet()));
		logger.debug("Substituted {} template variables into {}", replacements.size(),
				result.getClass().getSimpleName());
		return result;
	}

	private static final class Unmangler extends CstTransformer {

		private final Map<String, ? extends CstNode> replacements;

		Unmangler(Map<String, ? extends CstNode> replacements) {
			this.replacements = replacements;
		}

		@Override
		public Replacement leaveName(Name original, Name updated) {
			String value = updated.value();
			if (!value.startsWith(PREFIX) || !value.endsWith(SUFFIX)) {
				return updated;
			}
			String variable = value.substring(PREFIX.length(), value.length() - SUFFIX.length());
			CstNode replacement = replacements.get(variable);
			if (replacement == null) {
				return updated;
			}
			BaseExpression expression = (BaseExpression) replacement;
			if (updated.lpar().isEmpty()) {
				return expression;
			}
			List<LeftParen> lpar = new ArrayList<>(updated.lpar());
			lpar.addAll(expression.lpar());
			List<RightParen> rpar = new ArrayList<>(expression.rpar());
			rpar.addAll(updated.rpar());
			return CstNodes.withChanges(expression, Map.of("lpar", lpar, "rpar", rpar));
		}
	}

	private static final class PlaceholderChecker extends CstVisitor {

		private final Set<String> variables;

		PlaceholderChecker(Set<String> variables) {
			this.variables = variables;
		}

		@Override
		public boolean visitName(Name node) {
			for (String variable : variables) {
				if (node.value().equals(mangledName(variable))) {
					throw new IllegalArgumentException("Template variable " + variable + " was not replaced properly in "
							+ CstRenderer.render(node));
				}
			}
			return true;
		}
	}
}
