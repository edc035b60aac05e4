package org.javai.mermaid.ast;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A connection between two node identifiers.
 *
 * @param from source node id
 * @param to target node id
 * @param type the edge type
 * @param label edge label, or {@code null}
 * @param minLength minimum rank span hint when the line is drawn longer than its shortest form, or {@code null}
 * @param styles properties assigned by {@code linkStyle}
 */
public record Edge(
		String from,
		String to,
		EdgeType type,
		String label,
		Integer minLength,
		Map<String, String> styles
) {

	public Edge {
		Objects.requireNonNull(from, "from must not be null");
		Objects.requireNonNull(to, "to must not be null");
		Objects.requireNonNull(type, "type must not be null");
		styles = styles != null ? Collections.unmodifiableMap(new LinkedHashMap<>(styles)) : Map.of();
	}

	public Edge(String from, String to, EdgeType type, String label, Integer minLength) {
		this(from, to, type, label, minLength, Map.of());
	}

	public Optional<String> labelOptional() {
		return Optional.ofNullable(label);
	}

	public Edge withStyles(Map<String, String> newStyles) {
		return new Edge(from, to, type, label, minLength, newStyles);
	}
}
