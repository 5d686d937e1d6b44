package org.javai.cst.grammar;

import java.util.Arrays;

/**
 * Supported generations of the Python grammar.
 */
public enum GrammarVersion {
	PYTHON_3_7("3.7"),
	PYTHON_3_8("3.8");

	private final String label;

	GrammarVersion(String label) {
		this.label = label;
	}

	public String label() {
		return label;
	}

	public static GrammarVersion latest() {
		return PYTHON_3_8;
	}

	/**
	 * True if this version includes everything introduced in {@code other}.
	 */
	public boolean isAtLeast(GrammarVersion other) {
		return compareTo(other) >= 0;
	}

	/**
	 * Looks up a version by its dotted label, for example {@code "3.8"}.
	 */
	public static GrammarVersion fromLabel(String label) {
		return Arrays.stream(values())
				.filter(v -> v.label.equals(label))
				.findFirst()
				.orElseThrow(() -> new IllegalArgumentException("Unsupported grammar version: " + label));
	}
}
