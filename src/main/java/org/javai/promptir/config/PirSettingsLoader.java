package org.javai.promptir.config;

import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

/**
 * Loads {@link PirSettings} from YAML.
 * <p>
 * Expected layout:
 * <pre>
 * format:
 *   version: v1.0
 *   supported_major_versions: [1]
 *   indent: "\t"
 * render:
 *   default_engine: mustache
 *   default_strict: false
 *   enforce_unknown_inputs: false
 * </pre>
 */
public class PirSettingsLoader {

	private static final Logger logger = LoggerFactory.getLogger(PirSettingsLoader.class);

	private final Yaml yaml = new Yaml();

	public PirSettings load(Path path) {
		try (Reader reader = Files.newBufferedReader(path)) {
			return build(yaml.load(reader));
		} catch (ConfigurationException e) {
			throw e;
		} catch (Exception e) {
			throw new ConfigurationException("Failed to load settings from path: " + path, e);
		}
	}

	public PirSettings load(InputStream inputStream) {
		try {
			return build(yaml.load(inputStream));
		} catch (ConfigurationException e) {
			throw e;
		} catch (Exception e) {
			throw new ConfigurationException("Failed to load settings from input stream", e);
		}
	}

	public PirSettings loadString(String yamlContent) {
		try {
			return build(yaml.load(yamlContent));
		} catch (ConfigurationException e) {
			throw e;
		} catch (Exception e) {
			throw new ConfigurationException("Failed to load settings from string", e);
		}
	}

	/**
	 * Loads settings from a classpath resource.
	 *
	 * @throws ConfigurationException if the resource cannot be found or parsed
	 */
	public PirSettings loadResource(String resourcePath, ClassLoader loader) {
		Objects.requireNonNull(resourcePath, "resourcePath must not be null");
		Objects.requireNonNull(loader, "loader must not be null");
		try (InputStream is = loader.getResourceAsStream(resourcePath)) {
			if (is == null) {
				throw new ConfigurationException("Resource not found: " + resourcePath);
			}
			PirSettings settings = load(is);
			logger.debug("Loaded settings from '{}': {}", resourcePath, settings);
			return settings;
		} catch (ConfigurationException e) {
			throw e;
		} catch (Exception e) {
			throw new ConfigurationException("Failed to load settings resource: " + resourcePath, e);
		}
	}

	@SuppressWarnings("unchecked")
	private PirSettings build(Object loaded) {
		if (!(loaded instanceof Map<?, ?>)) {
			throw new ConfigurationException("Settings document must be a mapping");
		}
		Map<String, Object> data = (Map<String, Object>) loaded;
		Map<String, Object> format = section(data, "format");
		Map<String, Object> render = section(data, "render");

		return new PirSettings(
				string(format.get("version"), "v1.0"),
				majorVersions(format.get("supported_major_versions")),
				string(render.get("default_engine"), "mustache"),
				bool(render.get("default_strict")),
				bool(render.get("enforce_unknown_inputs")),
				string(format.get("indent"), "\t")
		);
	}

	@SuppressWarnings("unchecked")
	private Map<String, Object> section(Map<String, Object> data, String key) {
		Object value = data.get(key);
		if (value == null) {
			return Map.of();
		}
		if (!(value instanceof Map<?, ?>)) {
			throw new ConfigurationException("Settings section '" + key + "' must be a mapping");
		}
		return (Map<String, Object>) value;
	}

	private Set<Integer> majorVersions(Object value) {
		if (value == null) {
			return Set.of(1);
		}
		if (!(value instanceof List<?> list)) {
			throw new ConfigurationException("'supported_major_versions' must be a list of integers");
		}
		Set<Integer> versions = new LinkedHashSet<>();
		for (Object entry : list) {
			if (!(entry instanceof Number number)) {
				throw new ConfigurationException("Unsupported major version entry: " + entry);
			}
			versions.add(number.intValue());
		}
		return versions;
	}

	private String string(Object value, String fallback) {
		return value == null ? fallback : String.valueOf(value);
	}

	private boolean bool(Object value) {
		return value instanceof Boolean b ? b : value != null && Boolean.parseBoolean(String.valueOf(value));
	}
}
