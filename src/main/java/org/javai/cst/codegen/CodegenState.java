package org.javai.cst.codegen;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.javai.cst.nodes.BaseSmallStatement;
import org.javai.cst.nodes.CommaSeparated;
import org.javai.cst.nodes.CstNode;

/**
 * Accumulates generated source while nodes render themselves.
 * <p>
 * Holds the indentation stack of the enclosing blocks and the module defaults
 * for indentation and line endings. When created with position tracking, it
 * records the range each emitted node covers.
 */
public final class CodegenState {

	private final StringBuilder out = new StringBuilder();
	private final List<String> indents = new ArrayList<>();
	private final String defaultIndent;
	private final String defaultNewline;
	private final Map<CstNode, CodeRange> positions;
	private int line = 1;
	private int column = 0;

	public CodegenState(String defaultIndent, String defaultNewline) {
		this(defaultIndent, defaultNewline, false);
	}

	CodegenState(String defaultIndent, String defaultNewline, boolean trackPositions) {
		this.defaultIndent = Objects.requireNonNull(defaultIndent, "defaultIndent must not be null");
		this.defaultNewline = Objects.requireNonNull(defaultNewline, "defaultNewline must not be null");
		this.positions = trackPositions ? new IdentityHashMap<>() : null;
	}

	public String defaultIndent() {
		return defaultIndent;
	}

	public String defaultNewline() {
		return defaultNewline;
	}

	/**
	 * Appends literal text.
	 */
	public void add(String text) {
		out.append(text);
		for (int i = 0; i < text.length(); i++) {
			char c = text.charAt(i);
			if (c == '\n' || (c == '\r' && (i + 1 >= text.length() || text.charAt(i + 1) != '\n'))) {
				line++;
				column = 0;
			}
			else if (c != '\r') {
				column++;
			}
		}
	}

	/**
	 * Appends the indentation of every enclosing block.
	 */
	public void addIndent() {
		for (String indent : indents) {
			add(indent);
		}
	}

	public void pushIndent(String indent) {
		indents.add(indent);
	}

	public void popIndent() {
		indents.remove(indents.size() - 1);
	}

	/**
	 * Renders a child node.
	 */
	public void emit(CstNode node) {
		if (positions == null) {
			node.codegen(this);
			return;
		}
		CodePosition start = position();
		node.codegen(this);
		positions.put(node, new CodeRange(start, position()));
	}

	public void emitOptional(CstNode node) {
		if (node != null) {
			emit(node);
		}
	}

	public void emitAll(List<? extends CstNode> nodes) {
		for (CstNode node : nodes) {
			emit(node);
		}
	}

	/**
	 * Renders list items, adding {@code ", "} after each item but the last that
	 * has no comma of its own.
	 */
	public void emitSeparated(List<? extends CommaSeparated> items) {
		for (int i = 0; i < items.size(); i++) {
			CommaSeparated item = items.get(i);
			emit(item);
			if (item.comma() == null && i < items.size() - 1) {
				add(", ");
			}
		}
	}

	/**
	 * Renders small statements, adding {@code "; "} between statements without
	 * a semicolon of their own.
	 */
	public void emitStatements(List<? extends BaseSmallStatement> statements) {
		for (int i = 0; i < statements.size(); i++) {
			BaseSmallStatement statement = statements.get(i);
			emit(statement);
			if (statement.semicolon() == null && i < statements.size() - 1) {
				add("; ");
			}
		}
	}

	/**
	 * Removes the default newline if the output ends with it.
	 */
	public void dropTrailingNewline() {
		if (out.length() == 0 || !out.toString().endsWith(defaultNewline)) {
			return;
		}
		out.setLength(out.length() - defaultNewline.length());
		line--;
		int lastBreak = Math.max(out.lastIndexOf("\n"), out.lastIndexOf("\r"));
		column = out.length() - lastBreak - 1;
	}

	public CodePosition position() {
		return new CodePosition(line, column, out.length());
	}

	public String code() {
		return out.toString();
	}

	Map<CstNode, CodeRange> positions() {
		return positions;
	}
}
