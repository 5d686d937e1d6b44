package org.javai.cst;

/**
 * A failure caused by the input text. Carries the byte offset of the problem
 * together with a one-based line and a zero-based column.
 */
public abstract class CstSyntaxException extends CstException {

	private final int offset;
	private final int line;
	private final int column;

	protected CstSyntaxException(String message, int offset, int line, int column) {
		super(message + " (line " + line + ", column " + column + ")");
		this.offset = offset;
		this.line = line;
		this.column = column;
	}

	/**
	 * The message without the appended location.
	 */
	public String rawMessage() {
		String message = getMessage();
		int idx = message.lastIndexOf(" (line ");
		return idx >= 0 ? message.substring(0, idx) : message;
	}

	/**
	 * The same failure reported at another position, keeping the concrete type
	 * and its details.
	 */
	public abstract CstSyntaxException relocate(int offset, int line, int column);

	public int offset() {
		return offset;
	}

	public int line() {
		return line;
	}

	public int column() {
		return column;
	}
}
