package org.javai.cst.grammar;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("GrammarRegistry")
class GrammarRegistryTest {

	@Test
	void sharedRegistryHoldsThePythonGrammar() {
		GrammarRegistry registry = GrammarRegistry.shared();

		assertThat(registry.grammarFor("python")).isPresent();
		assertThat(registry.requireGrammar(GrammarVersion.PYTHON_3_7).id()).isEqualTo("python");
		assertThat(registry.requireGrammar(GrammarVersion.PYTHON_3_8).id()).isEqualTo("python");
		assertThat(GrammarRegistry.shared()).isSameAs(registry);
	}

	@Test
	void emptyRegistryHasNoGrammarForAVersion() {
		GrammarRegistry registry = GrammarRegistry.create();

		assertThat(registry.grammars()).isEmpty();
		assertThat(registry.grammarFor(GrammarVersion.PYTHON_3_8)).isEmpty();
		assertThatThrownBy(() -> registry.requireGrammar(GrammarVersion.PYTHON_3_8))
				.isInstanceOf(IllegalStateException.class)
				.hasMessageContaining("Python 3.8");
	}

	@Test
	void firstRegistrationForAnIdWins() {
		GrammarRegistry registry = GrammarRegistry.create();
		Grammar first = registry.registerResource("grammars/sum-grammar.yml");
		Grammar second = registry.registerResource("grammars/sum-grammar.yml");

		assertThat(second).isSameAs(first);
		assertThat(registry.grammars()).hasSize(1);
	}

	@Test
	void missingResourceIsAnArgumentError() {
		assertThatThrownBy(() -> GrammarRegistry.create().registerResource("grammars/absent.yml"))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("grammars/absent.yml");
	}

	@Test
	void brokenFileIsAStateError(@TempDir Path dir) throws Exception {
		Path file = dir.resolve("broken-grammar.yml");
		Files.writeString(file, "grammar:\n  id: broken\n");

		assertThatThrownBy(() -> GrammarRegistry.create().registerPath(file))
				.isInstanceOf(IllegalStateException.class)
				.hasCauseInstanceOf(InvalidGrammarException.class);
	}

	@Test
	void discoversGrammarsUnderMetaInf() {
		GrammarRegistry registry = GrammarRegistry.create()
				.registerMetaInfGrammars(GrammarRegistryTest.class.getClassLoader());

		assertThat(registry.grammarFor("python")).isPresent();
	}
}
