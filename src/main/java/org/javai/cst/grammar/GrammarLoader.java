package org.javai.cst.grammar;

import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.javai.cst.grammar.GrammarRule.Alternative;
import org.yaml.snakeyaml.Yaml;

/**
 * Loads grammar YAML resources into {@link Grammar} instances and checks that
 * every rule reference resolves.
 */
public class GrammarLoader {

	private final Yaml yaml = new Yaml();

	/**
	 * Parse a grammar file from a path.
	 */
	public Grammar parse(Path path) {
		try (var reader = Files.newBufferedReader(path)) {
			return parse(reader);
		} catch (InvalidGrammarException e) {
			throw e;
		} catch (Exception e) {
			throw new InvalidGrammarException("Failed to parse grammar from path: " + path, e);
		}
	}

	/**
	 * Parse a grammar from an input stream.
	 */
	public Grammar parse(InputStream inputStream) {
		try {
			Map<String, Object> data = yaml.load(inputStream);
			return buildGrammar(data);
		} catch (InvalidGrammarException e) {
			throw e;
		} catch (Exception e) {
			throw new InvalidGrammarException("Failed to parse grammar from input stream", e);
		}
	}

	/**
	 * Parse a grammar from a reader.
	 */
	public Grammar parse(Reader reader) {
		try {
			Map<String, Object> data = yaml.load(reader);
			return buildGrammar(data);
		} catch (InvalidGrammarException e) {
			throw e;
		} catch (Exception e) {
			throw new InvalidGrammarException("Failed to parse grammar from reader", e);
		}
	}

	/**
	 * Parse a grammar from YAML text.
	 */
	public Grammar parseString(String yamlContent) {
		try {
			Map<String, Object> data = yaml.load(yamlContent);
			return buildGrammar(data);
		} catch (InvalidGrammarException e) {
			throw e;
		} catch (Exception e) {
			throw new InvalidGrammarException("Failed to parse grammar from string", e);
		}
	}

	@SuppressWarnings("unchecked")
	private Grammar buildGrammar(Map<String, Object> data) {
		if (data == null) {
			throw new InvalidGrammarException("Grammar document is empty");
		}
		Map<String, Object> header = (Map<String, Object>) data.get("grammar");
		if (header == null) {
			throw new InvalidGrammarException("Missing required 'grammar' section");
		}
		String id = toString(header.get("id"));
		if (id == null || id.isBlank()) {
			throw new InvalidGrammarException("Grammar is missing an id");
		}
		List<GrammarVersion> versions = new ArrayList<>();
		List<Object> versionList = (List<Object>) header.get("versions");
		if (versionList != null) {
			for (Object v : versionList) {
				versions.add(GrammarVersion.fromLabel(toString(v)));
			}
		}

		Map<String, String> entryPoints = new LinkedHashMap<>();
		Map<String, Object> entryMap = (Map<String, Object>) data.get("entry_points");
		if (entryMap == null || entryMap.isEmpty()) {
			throw new InvalidGrammarException("Grammar '" + id + "' declares no entry points");
		}
		entryMap.forEach((mode, rule) -> entryPoints.put(mode, toString(rule)));

		Map<String, Object> rulesMap = (Map<String, Object>) data.get("rules");
		if (rulesMap == null || rulesMap.isEmpty()) {
			throw new InvalidGrammarException("Grammar '" + id + "' declares no rules");
		}
		Map<String, GrammarRule> rules = new LinkedHashMap<>();
		for (Map.Entry<String, Object> entry : rulesMap.entrySet()) {
			rules.put(entry.getKey(), buildRule(entry.getKey(), (Map<String, Object>) entry.getValue()));
		}

		Grammar grammar = new Grammar(id, toString(header.get("description")), versions, entryPoints, rules);
		validate(grammar);
		return grammar;
	}

	@SuppressWarnings("unchecked")
	private GrammarRule buildRule(String name, Map<String, Object> ruleMap) {
		if (ruleMap == null) {
			throw new InvalidGrammarException("Rule '" + name + "' is empty");
		}
		boolean collapse = Boolean.TRUE.equals(ruleMap.get("collapse"));
		List<Object> alternativeList = (List<Object>) ruleMap.get("alternatives");
		if (alternativeList == null || alternativeList.isEmpty()) {
			throw new InvalidGrammarException("Rule '" + name + "' has no alternatives");
		}
		List<Alternative> alternatives = new ArrayList<>();
		for (Object alt : alternativeList) {
			String notation;
			GrammarVersion since = null;
			if (alt instanceof Map<?, ?> altMap) {
				notation = toString(altMap.get("expr"));
				Object sinceValue = altMap.get("since");
				if (sinceValue != null) {
					since = GrammarVersion.fromLabel(toString(sinceValue));
				}
			}
			else {
				notation = toString(alt);
			}
			if (notation == null) {
				throw new InvalidGrammarException("Rule '" + name + "' has an alternative without an expression");
			}
			alternatives.add(new Alternative(RuleNotationParser.parse(notation), since, notation));
		}
		return new GrammarRule(name, collapse, alternatives);
	}

	private void validate(Grammar grammar) {
		grammar.entryPoints().forEach((mode, rule) -> {
			if (!grammar.rules().containsKey(rule)) {
				throw new InvalidGrammarException("Entry point " + mode + " refers to undefined rule '" + rule + "'");
			}
		});
		for (GrammarRule rule : grammar.rules().values()) {
			for (Alternative alternative : rule.alternatives()) {
				checkReferences(grammar, rule.name(), alternative.expression());
			}
		}
	}

	private void checkReferences(Grammar grammar, String owner, RuleExpression expression) {
		if (expression instanceof RuleExpression.RuleRef ref) {
			if (!grammar.rules().containsKey(ref.name())) {
				throw new InvalidGrammarException("Rule '" + owner + "' refers to undefined rule '" + ref.name() + "'");
			}
		}
		else if (expression instanceof RuleExpression.Sequence seq) {
			seq.items().forEach(item -> checkReferences(grammar, owner, item));
		}
		else if (expression instanceof RuleExpression.Choice choice) {
			choice.options().forEach(option -> checkReferences(grammar, owner, option));
		}
		else if (expression instanceof RuleExpression.Repeat repeat) {
			checkReferences(grammar, owner, repeat.item());
		}
		else if (expression instanceof RuleExpression.OptionalItem optional) {
			checkReferences(grammar, owner, optional.item());
		}
	}

	private String toString(Object obj) {
		return obj != null ? obj.toString() : null;
	}
}
