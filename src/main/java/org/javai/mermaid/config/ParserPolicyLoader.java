package org.javai.mermaid.config;

import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

/**
 * Reads a {@link ParserPolicy} from YAML.
 *
 * <pre>
 * parser:
 *   references: warn        # fail | warn
 *   extract-icons: true
 *   front-matter: true
 * </pre>
 *
 * Missing keys fall back to {@link ParserPolicy#defaults()}.
 */
public class ParserPolicyLoader {

	private static final Logger logger = LoggerFactory.getLogger(ParserPolicyLoader.class);

	public static final String DEFAULT_RESOURCE = "META-INF/mermaid-parser.yml";

	private final Yaml yaml = new Yaml();

	/**
	 * Loads the policy from {@link #DEFAULT_RESOURCE}, or returns the defaults when
	 * the resource is absent.
	 */
	public ParserPolicy loadDefault(ClassLoader loader) {
		try (InputStream is = loader.getResourceAsStream(DEFAULT_RESOURCE)) {
			if (is == null) {
				logger.debug("No {} on classpath; using default parser policy", DEFAULT_RESOURCE);
				return ParserPolicy.defaults();
			}
			return load(is);
		} catch (IllegalArgumentException e) {
			throw e;
		} catch (Exception e) {
			throw new IllegalStateException("Failed to load parser policy from resource: " + DEFAULT_RESOURCE, e);
		}
	}

	public ParserPolicy load(Path path) {
		try (Reader reader = Files.newBufferedReader(path)) {
			return load(reader);
		} catch (IllegalArgumentException e) {
			throw e;
		} catch (Exception e) {
			throw new IllegalStateException("Failed to load parser policy from path: " + path, e);
		}
	}

	public ParserPolicy load(InputStream inputStream) {
		return build(yaml.load(inputStream));
	}

	public ParserPolicy load(Reader reader) {
		return build(yaml.load(reader));
	}

	public ParserPolicy loadString(String yamlContent) {
		return build(yaml.load(yamlContent));
	}

	@SuppressWarnings("unchecked")
	private ParserPolicy build(Object document) {
		ParserPolicy defaults = ParserPolicy.defaults();
		if (document == null) {
			return defaults;
		}
		if (!(document instanceof Map)) {
			throw new IllegalArgumentException("Parser policy must be a YAML mapping");
		}
		Object section = ((Map<String, Object>) document).get("parser");
		if (section == null) {
			return defaults;
		}
		if (!(section instanceof Map)) {
			throw new IllegalArgumentException("'parser' section must be a YAML mapping");
		}
		Map<String, Object> parser = (Map<String, Object>) section;
		ParserPolicy policy = new ParserPolicy(
				referencePolicy(parser.get("references"), defaults.referencePolicy()),
				bool(parser.get("extract-icons"), defaults.extractIcons(), "extract-icons"),
				bool(parser.get("front-matter"), defaults.frontMatter(), "front-matter"));
		logger.debug("Loaded parser policy {}", policy);
		return policy;
	}

	private static ReferencePolicy referencePolicy(Object value, ReferencePolicy fallback) {
		if (value == null) {
			return fallback;
		}
		try {
			return ReferencePolicy.valueOf(value.toString().trim().toUpperCase(Locale.ROOT));
		} catch (IllegalArgumentException e) {
			throw new IllegalArgumentException("Unknown reference policy '" + value + "', expected fail or warn", e);
		}
	}

	private static boolean bool(Object value, boolean fallback, String key) {
		if (value == null) {
			return fallback;
		}
		if (value instanceof Boolean b) {
			return b;
		}
		throw new IllegalArgumentException("'" + key + "' must be true or false, got: " + value);
	}
}
