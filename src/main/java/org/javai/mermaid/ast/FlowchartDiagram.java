package org.javai.mermaid.ast;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Root of a parsed flowchart. Immutable; callers that need a modified diagram
 * re-parse or build a new value from these fields.
 *
 * @param title diagram title from front matter, or {@code null}
 * @param accessibility accessible title and description
 * @param direction the top-level layout direction
 * @param nodes nodes keyed by id, in order of first mention
 * @param edges edges in source order
 * @param subgraphs top-level subgraphs; nested ones hang off their parents
 * @param classDefs class definitions keyed by class name
 * @param clicks click bindings, one per node, in order of first {@code click} line
 */
public record FlowchartDiagram(
		String title,
		Accessibility accessibility,
		FlowDirection direction,
		Map<String, Node> nodes,
		List<Edge> edges,
		List<Subgraph> subgraphs,
		Map<String, ClassStyle> classDefs,
		List<ClickBinding> clicks
) {

	public FlowchartDiagram {
		accessibility = accessibility != null ? accessibility : Accessibility.NONE;
		direction = direction != null ? direction : FlowDirection.TD;
		nodes = nodes != null ? Collections.unmodifiableMap(new LinkedHashMap<>(nodes)) : Map.of();
		edges = edges != null ? List.copyOf(edges) : List.of();
		subgraphs = subgraphs != null ? List.copyOf(subgraphs) : List.of();
		classDefs = classDefs != null ? Collections.unmodifiableMap(new LinkedHashMap<>(classDefs)) : Map.of();
		clicks = clicks != null ? List.copyOf(clicks) : List.of();
	}

	public Optional<Node> node(String id) {
		return Optional.ofNullable(nodes.get(id));
	}

	public Optional<String> titleOptional() {
		return Optional.ofNullable(title);
	}

	/**
	 * Finds a subgraph anywhere in the forest.
	 */
	public Optional<Subgraph> subgraph(String id) {
		Objects.requireNonNull(id, "id must not be null");
		return SubgraphWalker.find(subgraphs, id);
	}

	public Optional<ClickBinding> click(String nodeId) {
		return clicks.stream().filter(c -> c.nodeId().equals(nodeId)).findFirst();
	}

	/**
	 * Depth of the subgraph forest; 0 when there are no subgraphs.
	 */
	public int subgraphDepth() {
		int deepest = 0;
		for (Subgraph subgraph : subgraphs) {
			deepest = Math.max(deepest, subgraph.depth());
		}
		return deepest;
	}

	/**
	 * Visits every node, then every edge, then the subgraph forest in pre-order.
	 */
	public void accept(DiagramVisitor<?> visitor) {
		nodes.values().forEach(visitor::visitNode);
		edges.forEach(visitor::visitEdge);
		SubgraphWalker.walkAll(subgraphs, visitor);
	}
}
