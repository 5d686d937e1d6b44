package org.javai.cst.nodes;

import java.util.Objects;
import org.javai.cst.codegen.CodegenState;

/**
 * A line holding nothing but whitespace and possibly a comment.
 *
 * @param indent whether the line starts with the indentation of the enclosing block
 * @param whitespace whitespace after the indentation
 * @param comment the comment, if any
 * @param newline the line break
 */
public record EmptyLine(boolean indent, SimpleWhitespace whitespace, @OptionalChild Comment comment, Newline newline)
		implements CstNode {

	public EmptyLine {
		Objects.requireNonNull(whitespace, "whitespace must not be null");
		Objects.requireNonNull(newline, "newline must not be null");
	}

	public static EmptyLine blank() {
		return new EmptyLine(true, SimpleWhitespace.EMPTY, null, Newline.DEFAULT);
	}

	public static EmptyLine comment(String text) {
		return new EmptyLine(true, SimpleWhitespace.EMPTY, new Comment(text), Newline.DEFAULT);
	}

	@Override
	public void codegen(CodegenState state) {
		if (indent) {
			state.addIndent();
		}
		state.emit(whitespace);
		state.emitOptional(comment);
		state.emit(newline);
	}
}
