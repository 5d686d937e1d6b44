package org.javai.cst.parser;

import java.util.Objects;
import java.util.Optional;
import org.javai.cst.CstSyntaxException;

/**
 * Outcome of a parse for callers that prefer a value over an exception.
 * Exactly one of {@code value} and {@code error} is present.
 */
public record ParseResult<T>(T value, CstSyntaxException error) {

	public ParseResult {
		if ((value == null) == (error == null)) {
			throw new IllegalArgumentException("Exactly one of value and error must be present");
		}
	}

	public static <T> ParseResult<T> success(T value) {
		return new ParseResult<>(Objects.requireNonNull(value, "value must not be null"), null);
	}

	public static <T> ParseResult<T> failure(CstSyntaxException error) {
		return new ParseResult<>(null, Objects.requireNonNull(error, "error must not be null"));
	}

	public boolean isSuccess() {
		return value != null;
	}

	public Optional<T> toOptional() {
		return Optional.ofNullable(value);
	}

	/**
	 * The parsed value, or the recorded error rethrown.
	 */
	public T orElseThrow() {
		if (error != null) {
			throw error;
		}
		return value;
	}
}
