package org.javai.mermaid.ast;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A named shape in the flowchart.
 *
 * @param id the node identifier
 * @param text display text, {@code null} when the node was never given any
 * @param shape the node shape
 * @param classes class names applied to the node, in application order
 * @param icon icon reference such as {@code fa:fa-car}, or {@code null}
 * @param styles effective style properties: class-derived values overridden by {@code style} lines
 */
public record Node(
		String id,
		String text,
		NodeShape shape,
		List<String> classes,
		String icon,
		Map<String, String> styles
) {

	public Node {
		Objects.requireNonNull(id, "id must not be null");
		shape = shape != null ? shape : NodeShape.RECTANGLE;
		classes = classes != null ? List.copyOf(classes) : List.of();
		styles = styles != null ? Collections.unmodifiableMap(new LinkedHashMap<>(styles)) : Map.of();
	}

	/**
	 * A node created implicitly by an edge reference: rectangle, no text.
	 */
	public static Node stub(String id) {
		return new Node(id, null, NodeShape.RECTANGLE, List.of(), null, Map.of());
	}

	public Optional<String> textOptional() {
		return Optional.ofNullable(text);
	}

	public Optional<String> iconOptional() {
		return Optional.ofNullable(icon);
	}

	public boolean hasClass(String className) {
		return classes.contains(className);
	}
}
