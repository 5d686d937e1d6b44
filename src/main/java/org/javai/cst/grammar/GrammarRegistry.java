package org.javai.cst.grammar;

import java.io.InputStream;
import java.net.JarURLConnection;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Enumeration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.jar.JarEntry;
import java.util.jar.JarFile;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registry of grammars available to the interpreted parsing strategy.
 * <p>
 * Grammars are registered once and looked up by id or by the Python version they
 * support. Registrations are idempotent per grammar id: the first one wins.
 */
public final class GrammarRegistry {

	private static final Logger logger = LoggerFactory.getLogger(GrammarRegistry.class);

	public static final String PYTHON_GRAMMAR_RESOURCE = "META-INF/cst/python-grammar.yml";

	private static final String GRAMMAR_DIRECTORY = "META-INF/cst/";
	private static final String GRAMMAR_SUFFIX = "-grammar.yml";

	private final Map<String, Grammar> grammars = new LinkedHashMap<>();
	private final GrammarLoader loader;

	private GrammarRegistry(GrammarLoader loader) {
		this.loader = loader;
	}

	/**
	 * Create an empty registry backed by a fresh loader.
	 */
	public static GrammarRegistry create() {
		return new GrammarRegistry(new GrammarLoader());
	}

	/**
	 * The shared registry holding the bundled Python grammar, loaded on first use.
	 */
	public static GrammarRegistry shared() {
		return SharedHolder.INSTANCE;
	}

	/**
	 * Register a grammar object directly. If a grammar with the same id is already
	 * present, the existing one is kept and returned.
	 */
	public synchronized Grammar register(Grammar grammar) {
		Objects.requireNonNull(grammar, "grammar must not be null");
		Grammar existing = grammars.get(grammar.id());
		if (existing != null) {
			logger.debug("Grammar with id '{}' already registered; skipping", grammar.id());
			return existing;
		}
		grammars.put(grammar.id(), grammar);
		logger.debug("Registered grammar '{}' with {} rules for versions {}",
				grammar.id(), grammar.rules().size(), grammar.versions());
		return grammar;
	}

	/**
	 * Load a grammar from a classpath resource using this class' loader.
	 */
	public Grammar registerResource(String resourcePath) {
		return registerResource(resourcePath, GrammarRegistry.class.getClassLoader());
	}

	/**
	 * Load and register a grammar from a classpath resource.
	 *
	 * @throws IllegalArgumentException if the resource cannot be found
	 * @throws IllegalStateException if parsing fails
	 */
	public Grammar registerResource(String resourcePath, ClassLoader classLoader) {
		Objects.requireNonNull(resourcePath, "resourcePath must not be null");
		Objects.requireNonNull(classLoader, "classLoader must not be null");
		try (InputStream is = classLoader.getResourceAsStream(resourcePath)) {
			if (is == null) {
				throw new IllegalArgumentException("Resource not found: " + resourcePath);
			}
			return register(loader.parse(is));
		} catch (IllegalArgumentException e) {
			throw e;
		} catch (Exception e) {
			throw new IllegalStateException("Failed to load grammar from resource: " + resourcePath, e);
		}
	}

	/**
	 * Load and register a grammar from a filesystem path.
	 *
	 * @throws IllegalStateException if parsing fails
	 */
	public Grammar registerPath(Path path) {
		Objects.requireNonNull(path, "path must not be null");
		try {
			return register(loader.parse(path));
		} catch (Exception e) {
			throw new IllegalStateException("Failed to load grammar from path: " + path, e);
		}
	}

	/**
	 * Discover and register grammars named {@code *-grammar.yml} under
	 * {@code META-INF/cst/}, in exploded directories and in JARs. Resources that
	 * fail to load are logged and skipped.
	 */
	public GrammarRegistry registerMetaInfGrammars(ClassLoader classLoader) {
		Objects.requireNonNull(classLoader, "classLoader must not be null");
		try {
			Enumeration<URL> resources = classLoader.getResources(GRAMMAR_DIRECTORY);
			while (resources.hasMoreElements()) {
				URL url = resources.nextElement();
				if ("file".equalsIgnoreCase(url.getProtocol())) {
					loadFromDirectory(url);
				}
				else if ("jar".equalsIgnoreCase(url.getProtocol())) {
					loadFromJar(url);
				}
			}
		}
		catch (Exception e) {
			throw new IllegalStateException("Failed to scan " + GRAMMAR_DIRECTORY + " for grammars", e);
		}
		return this;
	}

	/**
	 * Retrieve a grammar by id.
	 */
	public synchronized Optional<Grammar> grammarFor(String id) {
		return Optional.ofNullable(grammars.get(id));
	}

	/**
	 * Retrieve the first registered grammar that supports the given version.
	 */
	public synchronized Optional<Grammar> grammarFor(GrammarVersion version) {
		return grammars.values().stream()
				.filter(g -> g.supports(version))
				.findFirst();
	}

	/**
	 * Retrieve a grammar for the version or throw if none is registered.
	 */
	public Grammar requireGrammar(GrammarVersion version) {
		return grammarFor(version).orElseThrow(
				() -> new IllegalStateException("No grammar registered for Python " + version.label()));
	}

	/**
	 * All registered grammars in insertion order.
	 */
	public synchronized List<Grammar> grammars() {
		return List.copyOf(grammars.values());
	}

	private void loadFromDirectory(URL url) {
		try {
			Path path = Paths.get(url.toURI());
			if (!Files.isDirectory(path)) {
				return;
			}
			try (Stream<Path> files = Files.list(path)) {
				files.filter(Files::isRegularFile)
						.filter(p -> p.getFileName().toString().endsWith(GRAMMAR_SUFFIX))
						.forEach(p -> {
							try (InputStream is = Files.newInputStream(p)) {
								register(loader.parse(is));
							}
							catch (Exception ex) {
								logger.warn("Failed to load grammar from {}", p, ex);
							}
						});
			}
		}
		catch (Exception e) {
			logger.warn("Failed to scan directory {}", url, e);
		}
	}

	private void loadFromJar(URL url) {
		try {
			JarURLConnection conn = (JarURLConnection) url.openConnection();
			conn.setUseCaches(false);
			try (JarFile jar = conn.getJarFile()) {
				Enumeration<JarEntry> entries = jar.entries();
				while (entries.hasMoreElements()) {
					JarEntry entry = entries.nextElement();
					if (entry.isDirectory()) {
						continue;
					}
					String name = entry.getName();
					if (!name.startsWith(GRAMMAR_DIRECTORY) || !name.endsWith(GRAMMAR_SUFFIX)) {
						continue;
					}
					try (InputStream is = jar.getInputStream(entry)) {
						register(loader.parse(is));
					}
					catch (Exception ex) {
						logger.warn("Failed to load grammar from JAR entry {}", name, ex);
					}
				}
			}
		}
		catch (Exception e) {
			logger.warn("Failed to scan JAR {}", url, e);
		}
	}

	private static final class SharedHolder {
		private static final GrammarRegistry INSTANCE = create();

		static {
			INSTANCE.registerResource(PYTHON_GRAMMAR_RESOURCE);
		}
	}
}
