package org.javai.mermaid.ast;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A reusable named style bundle declared with {@code classDef}.
 *
 * @param name the class name
 * @param properties style property name to value, in declaration order
 */
public record ClassStyle(String name, Map<String, String> properties) {

	/** Name of the class applied to every node. */
	public static final String DEFAULT_CLASS = "default";

	public ClassStyle {
		Objects.requireNonNull(name, "name must not be null");
		properties = properties != null ? Collections.unmodifiableMap(new LinkedHashMap<>(properties)) : Map.of();
	}

	public boolean isDefault() {
		return DEFAULT_CLASS.equals(name);
	}
}
