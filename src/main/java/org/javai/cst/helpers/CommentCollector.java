package org.javai.cst.helpers;

import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.regex.Pattern;
import org.javai.cst.codegen.CodeRange;
import org.javai.cst.codegen.PositionCalculator;
import org.javai.cst.nodes.Comment;
import org.javai.cst.nodes.CstNode;
import org.javai.cst.nodes.EmptyLine;
import org.javai.cst.nodes.Module;
import org.javai.cst.nodes.TrailingWhitespace;
import org.javai.cst.visit.CstVisitor;
import org.javai.cst.visit.CstWalker;

/**
 * Gathers the comments of a module that match a pattern, keyed by the line they
 * apply to. Useful for special-purpose comments such as lint suppressions.
 * <p>
 * A comment on a line of its own applies to the following line; a comment
 * after code applies to its own line. The pattern must match at the start of
 * the comment text, which includes the {@code #}.
 */
public final class CommentCollector extends CstVisitor {

	private final Pattern pattern;
	private final Map<CstNode, CodeRange> positions;
	private final Map<Integer, Comment> comments = new TreeMap<>();

	private CommentCollector(Pattern pattern, Map<CstNode, CodeRange> positions) {
		this.pattern = pattern;
		this.positions = positions;
	}

	public static Map<Integer, Comment> collect(Module module, String regex) {
		return collect(module, Pattern.compile(regex));
	}

	public static Map<Integer, Comment> collect(Module module, Pattern pattern) {
		Objects.requireNonNull(module, "module must not be null");
		Objects.requireNonNull(pattern, "pattern must not be null");
		CommentCollector collector = new CommentCollector(pattern, PositionCalculator.compute(module));
		CstWalker.visit(module, collector);
		return collector.comments;
	}

	@Override
	public boolean visitEmptyLine(EmptyLine node) {
		record(node.comment(), 1);
		return false;
	}

	@Override
	public boolean visitTrailingWhitespace(TrailingWhitespace node) {
		record(node.comment(), 0);
		return false;
	}

	private void record(Comment comment, int lineOffset) {
		if (comment == null || !pattern.matcher(comment.value()).lookingAt()) {
			return;
		}
		CodeRange range = positions.get(comment);
		comments.put(range.start().line() + lineOffset, comment);
	}
}
