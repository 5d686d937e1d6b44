package org.javai.cst.parser;

/**
 * The interchangeable parsing strategies.
 */
public enum ParserBackend {
	/** Executes the grammar resource directly. The reference behavior. */
	INTERPRETED,
	/** Hand-written recursive descent mirroring the grammar resource. */
	COMPILED;

	public ParsingStrategy newStrategy() {
		return switch (this) {
			case INTERPRETED -> new InterpretedParsingStrategy();
			case COMPILED -> new CompiledParsingStrategy();
		};
	}
}
