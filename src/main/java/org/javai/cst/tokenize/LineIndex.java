package org.javai.cst.tokenize;

import java.util.Arrays;

/**
 * Maps character offsets of a source text to lines and columns. Lines are
 * one-based, columns zero-based. {@code \r\n}, {@code \r} and {@code \n} all end
 * a line.
 */
public final class LineIndex {

	private final int[] lineStarts;
	private final int length;

	public LineIndex(String text) {
		int[] starts = new int[16];
		int count = 0;
		starts[count++] = 0;
		for (int i = 0; i < text.length(); i++) {
			char c = text.charAt(i);
			if (c == '\r' && i + 1 < text.length() && text.charAt(i + 1) == '\n') {
				continue;
			}
			if (c == '\n' || c == '\r') {
				if (count == starts.length) {
					starts = Arrays.copyOf(starts, count * 2);
				}
				starts[count++] = i + 1;
			}
		}
		this.lineStarts = Arrays.copyOf(starts, count);
		this.length = text.length();
	}

	public int line(int offset) {
		int idx = Arrays.binarySearch(lineStarts, clamp(offset));
		return idx >= 0 ? idx + 1 : -idx - 1;
	}

	public int column(int offset) {
		int clamped = clamp(offset);
		return clamped - lineStarts[line(clamped) - 1];
	}

	public int lineCount() {
		return lineStarts.length;
	}

	private int clamp(int offset) {
		return Math.max(0, Math.min(offset, length));
	}
}
