package org.javai.cst.parser;

import java.util.Objects;
import java.util.Set;
import org.javai.cst.grammar.GrammarVersion;

/**
 * Options for one parse call.
 *
 * @param version the grammar generation to accept
 * @param defaultIndent the module's indentation unit, or null to detect it from the first block
 * @param defaultNewline the module's line ending, or null to detect it from the first line break
 * @param backend the parsing strategy to run
 */
public record ParserConfig(
		GrammarVersion version,
		String defaultIndent,
		String defaultNewline,
		ParserBackend backend
) {

	private static final Set<String> NEWLINES = Set.of("\n", "\r\n", "\r");

	public ParserConfig {
		Objects.requireNonNull(version, "version must not be null");
		Objects.requireNonNull(backend, "backend must not be null");
		if (defaultIndent != null && (defaultIndent.isEmpty() || !defaultIndent.isBlank())) {
			throw new IllegalArgumentException("defaultIndent must be non-empty whitespace");
		}
		if (defaultNewline != null && !NEWLINES.contains(defaultNewline)) {
			throw new IllegalArgumentException("defaultNewline must be one of \\n, \\r\\n or \\r");
		}
	}

	public static ParserConfig defaults() {
		return new ParserConfig(GrammarVersion.latest(), null, null, ParserBackend.COMPILED);
	}

	public ParserConfig withVersion(GrammarVersion version) {
		return new ParserConfig(version, defaultIndent, defaultNewline, backend);
	}

	public ParserConfig withDefaultIndent(String defaultIndent) {
		return new ParserConfig(version, defaultIndent, defaultNewline, backend);
	}

	public ParserConfig withDefaultNewline(String defaultNewline) {
		return new ParserConfig(version, defaultIndent, defaultNewline, backend);
	}

	public ParserConfig withBackend(ParserBackend backend) {
		return new ParserConfig(version, defaultIndent, defaultNewline, backend);
	}
}
