package org.javai.mermaid.ast;

/**
 * Visitor over the elements of a parsed flowchart.
 *
 * @param <R> the return type of the visitor operations
 */
public interface DiagramVisitor<R> {

	R visitNode(Node node);

	R visitEdge(Edge edge);

	/**
	 * Visits a subgraph.
	 *
	 * @param subgraph the subgraph
	 * @param depth nesting depth, 1 for a top-level subgraph
	 * @return the result of visiting this subgraph
	 */
	R visitSubgraph(Subgraph subgraph, int depth);
}
