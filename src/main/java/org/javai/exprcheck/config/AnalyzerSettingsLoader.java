package org.javai.exprcheck.config;

import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import org.javai.exprcheck.equiv.EquivalenceMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

/**
 * Reads {@link AnalyzerSettings} from YAML.
 *
 * <pre>
 * normalizer:
 *   max_expansion_exponent: 3
 * equivalence:
 *   strategies: [polynomial, structural, rational]
 * </pre>
 *
 * Missing sections or keys keep their default values.
 */
public class AnalyzerSettingsLoader {

	private static final Logger logger = LoggerFactory.getLogger(AnalyzerSettingsLoader.class);

	public static final String DEFAULT_RESOURCE = "META-INF/exprcheck-settings.yml";

	private final Yaml yaml = new Yaml();

	/**
	 * Load the settings bundled with the library, falling back to built-in
	 * defaults when the resource is absent.
	 */
	public AnalyzerSettings loadDefaults() {
		ClassLoader loader = AnalyzerSettingsLoader.class.getClassLoader();
		try (InputStream is = loader.getResourceAsStream(DEFAULT_RESOURCE)) {
			if (is == null) {
				logger.debug("No {} on the classpath; using built-in defaults", DEFAULT_RESOURCE);
				return AnalyzerSettings.defaults();
			}
			return load(is);
		} catch (AnalyzerSettingsException e) {
			throw e;
		} catch (Exception e) {
			throw new AnalyzerSettingsException("Failed to load settings from resource: " + DEFAULT_RESOURCE, e);
		}
	}

	/**
	 * Load settings from a classpath resource.
	 *
	 * @throws AnalyzerSettingsException if the resource is missing or invalid
	 */
	public AnalyzerSettings loadResource(String resourcePath, ClassLoader loader) {
		Objects.requireNonNull(resourcePath, "resourcePath must not be null");
		Objects.requireNonNull(loader, "loader must not be null");
		try (InputStream is = loader.getResourceAsStream(resourcePath)) {
			if (is == null) {
				throw new AnalyzerSettingsException("Resource not found: " + resourcePath);
			}
			return load(is);
		} catch (AnalyzerSettingsException e) {
			throw e;
		} catch (Exception e) {
			throw new AnalyzerSettingsException("Failed to load settings from resource: " + resourcePath, e);
		}
	}

	public AnalyzerSettings load(Path path) {
		try (Reader reader = Files.newBufferedReader(path)) {
			return load(reader);
		} catch (AnalyzerSettingsException e) {
			throw e;
		} catch (Exception e) {
			throw new AnalyzerSettingsException("Failed to load settings from path: " + path, e);
		}
	}

	public AnalyzerSettings load(InputStream inputStream) {
		return build(parseYaml(() -> yaml.load(inputStream)));
	}

	public AnalyzerSettings load(Reader reader) {
		return build(parseYaml(() -> yaml.load(reader)));
	}

	public AnalyzerSettings loadString(String yamlContent) {
		return build(parseYaml(() -> yaml.load(yamlContent)));
	}

	private Object parseYaml(Supplier<Object> parser) {
		try {
			return parser.get();
		} catch (Exception e) {
			throw new AnalyzerSettingsException("Settings are not valid YAML", e);
		}
	}

	@SuppressWarnings("unchecked")
	private AnalyzerSettings build(Object document) {
		AnalyzerSettings defaults = AnalyzerSettings.defaults();
		if (document == null) {
			return defaults;
		}
		if (!(document instanceof Map)) {
			throw new AnalyzerSettingsException("Settings document must be a mapping");
		}
		Map<String, Object> data = (Map<String, Object>) document;

		Map<String, Object> normalizer = section(data, "normalizer");
		int maxExponent = defaults.maxExpansionExponent();
		Object exponentValue = normalizer.get("max_expansion_exponent");
		if (exponentValue != null) {
			if (!(exponentValue instanceof Integer)) {
				throw new AnalyzerSettingsException("normalizer.max_expansion_exponent must be an integer: " + exponentValue);
			}
			maxExponent = (Integer) exponentValue;
		}

		Map<String, Object> equivalence = section(data, "equivalence");
		List<EquivalenceMethod> strategies = defaults.strategies();
		Object strategyValue = equivalence.get("strategies");
		if (strategyValue != null) {
			strategies = toStrategies(strategyValue);
		}

		AnalyzerSettings settings = new AnalyzerSettings(maxExponent, strategies);
		logger.debug("Loaded analyzer settings: {}", settings);
		return settings;
	}

	@SuppressWarnings("unchecked")
	private Map<String, Object> section(Map<String, Object> data, String key) {
		Object value = data.get(key);
		if (value == null) {
			return Map.of();
		}
		if (!(value instanceof Map)) {
			throw new AnalyzerSettingsException("'" + key + "' must be a mapping");
		}
		return (Map<String, Object>) value;
	}

	private List<EquivalenceMethod> toStrategies(Object value) {
		if (!(value instanceof List<?> names)) {
			throw new AnalyzerSettingsException("equivalence.strategies must be a list: " + value);
		}
		List<EquivalenceMethod> methods = new ArrayList<>();
		for (Object name : names) {
			try {
				methods.add(EquivalenceMethod.fromWireName(String.valueOf(name)));
			} catch (IllegalArgumentException e) {
				throw new AnalyzerSettingsException("equivalence.strategies contains an unknown strategy: " + name, e);
			}
		}
		return methods;
	}
}
