package org.javai.mermaid.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Traversal helpers for subgraph trees.
 */
public final class SubgraphWalker {

	private SubgraphWalker() {
		// Utility class - no instantiation
	}

	/**
	 * Visits a subgraph before its children.
	 */
	public static <R> R walkPreOrder(Subgraph subgraph, DiagramVisitor<R> visitor) {
		return walkPreOrder(subgraph, visitor, 1);
	}

	/**
	 * Visits a subgraph after its children.
	 */
	public static <R> R walkPostOrder(Subgraph subgraph, DiagramVisitor<R> visitor) {
		return walkPostOrder(subgraph, visitor, 1);
	}

	/**
	 * Walks a forest of top-level subgraphs in pre-order.
	 */
	public static <R> void walkAll(List<Subgraph> subgraphs, DiagramVisitor<R> visitor) {
		if (subgraphs == null) {
			return;
		}
		for (Subgraph subgraph : subgraphs) {
			walkPreOrder(subgraph, visitor, 1);
		}
	}

	/**
	 * Finds a subgraph by id anywhere in the forest.
	 */
	public static Optional<Subgraph> find(List<Subgraph> subgraphs, String id) {
		for (Subgraph subgraph : subgraphs) {
			if (subgraph.id().equals(id)) {
				return Optional.of(subgraph);
			}
			Optional<Subgraph> nested = find(subgraph.children(), id);
			if (nested.isPresent()) {
				return nested;
			}
		}
		return Optional.empty();
	}

	/**
	 * All subgraphs of the forest in pre-order.
	 */
	public static List<Subgraph> flatten(List<Subgraph> subgraphs) {
		List<Subgraph> result = new ArrayList<>();
		for (Subgraph subgraph : subgraphs) {
			result.add(subgraph);
			result.addAll(flatten(subgraph.children()));
		}
		return result;
	}

	private static <R> R walkPreOrder(Subgraph subgraph, DiagramVisitor<R> visitor, int depth) {
		if (subgraph == null) {
			return null;
		}
		R result = visitor.visitSubgraph(subgraph, depth);
		for (Subgraph child : subgraph.children()) {
			walkPreOrder(child, visitor, depth + 1);
		}
		return result;
	}

	private static <R> R walkPostOrder(Subgraph subgraph, DiagramVisitor<R> visitor, int depth) {
		if (subgraph == null) {
			return null;
		}
		for (Subgraph child : subgraph.children()) {
			walkPostOrder(child, visitor, depth + 1);
		}
		return visitor.visitSubgraph(subgraph, depth);
	}
}
