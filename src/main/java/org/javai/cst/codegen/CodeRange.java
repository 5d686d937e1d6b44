package org.javai.cst.codegen;

/**
 * The span of source a node renders, end exclusive.
 */
public record CodeRange(CodePosition start, CodePosition end) {

	public boolean contains(CodePosition position) {
		return position.offset() >= start.offset() && position.offset() < end.offset();
	}

	public int length() {
		return end.offset() - start.offset();
	}
}
