package org.javai.mermaid.ast;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A named, possibly nested, grouping of nodes and edges.
 *
 * @param id the subgraph identifier
 * @param title display title, or {@code null}
 * @param direction direction set inside the block, or {@code null} to inherit
 * @param nodeIds ids of nodes directly owned by this subgraph
 * @param edges edges declared inside this subgraph (also present in the diagram's edge list)
 * @param children nested subgraphs
 * @param styles properties assigned by {@code style} lines naming the subgraph
 */
public record Subgraph(
		String id,
		String title,
		FlowDirection direction,
		List<String> nodeIds,
		List<Edge> edges,
		List<Subgraph> children,
		Map<String, String> styles
) {

	public Subgraph {
		Objects.requireNonNull(id, "id must not be null");
		nodeIds = nodeIds != null ? List.copyOf(nodeIds) : List.of();
		edges = edges != null ? List.copyOf(edges) : List.of();
		children = children != null ? List.copyOf(children) : List.of();
		styles = styles != null ? Collections.unmodifiableMap(new LinkedHashMap<>(styles)) : Map.of();
	}

	public boolean owns(String nodeId) {
		return nodeIds.contains(nodeId);
	}

	/**
	 * Depth of the subtree rooted here; a subgraph without children has depth 1.
	 */
	public int depth() {
		int deepest = 0;
		for (Subgraph child : children) {
			deepest = Math.max(deepest, child.depth());
		}
		return deepest + 1;
	}
}
