package org.javai.cst.grammar;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A grammar loaded from a resource: metadata, entry points per parse mode and
 * the rules in declaration order.
 */
public record Grammar(
	String id,
	String description,
	List<GrammarVersion> versions,
	Map<String, String> entryPoints,
	Map<String, GrammarRule> rules
) {

	public Grammar {
		versions = List.copyOf(versions);
		entryPoints = Map.copyOf(entryPoints);
		rules = Collections.unmodifiableMap(new LinkedHashMap<>(rules));
	}

	public Optional<GrammarRule> rule(String name) {
		return Optional.ofNullable(rules.get(name));
	}

	public GrammarRule requireRule(String name) {
		return rule(name).orElseThrow(() -> new InvalidGrammarException("Unknown rule: " + name));
	}

	/**
	 * The start rule for a parse mode name such as {@code MODULE}.
	 */
	public GrammarRule entryRule(String mode) {
		String name = entryPoints.get(mode);
		if (name == null) {
			throw new InvalidGrammarException("Grammar '" + id + "' has no entry point for " + mode);
		}
		return requireRule(name);
	}

	public boolean supports(GrammarVersion version) {
		return versions.contains(version);
	}
}
