package org.javai.mermaid.batch;

import java.util.Collection;
import org.javai.mermaid.ast.DiagramVisitor;
import org.javai.mermaid.ast.Edge;
import org.javai.mermaid.ast.FlowchartDiagram;
import org.javai.mermaid.ast.Node;
import org.javai.mermaid.ast.Subgraph;

/**
 * Element counts of one or more flowcharts.
 *
 * @param nodes number of nodes
 * @param edges number of edges
 * @param subgraphs number of subgraphs at any depth
 * @param maxDepth deepest subgraph nesting seen
 */
public record DiagramStatistics(int nodes, int edges, int subgraphs, int maxDepth) {

	public static final DiagramStatistics EMPTY = new DiagramStatistics(0, 0, 0, 0);

	public static DiagramStatistics of(FlowchartDiagram diagram) {
		Counter counter = new Counter();
		diagram.accept(counter);
		return new DiagramStatistics(counter.nodes, counter.edges, counter.subgraphs, counter.maxDepth);
	}

	/**
	 * Sums the statistics of every diagram; {@code maxDepth} is the maximum.
	 */
	public static DiagramStatistics sum(Collection<FlowchartDiagram> diagrams) {
		DiagramStatistics total = EMPTY;
		for (FlowchartDiagram diagram : diagrams) {
			total = total.plus(of(diagram));
		}
		return total;
	}

	public DiagramStatistics plus(DiagramStatistics other) {
		return new DiagramStatistics(nodes + other.nodes, edges + other.edges, subgraphs + other.subgraphs,
				Math.max(maxDepth, other.maxDepth));
	}

	private static final class Counter implements DiagramVisitor<Void> {
		private int nodes;
		private int edges;
		private int subgraphs;
		private int maxDepth;

		@Override
		public Void visitNode(Node node) {
			nodes++;
			return null;
		}

		@Override
		public Void visitEdge(Edge edge) {
			edges++;
			return null;
		}

		@Override
		public Void visitSubgraph(Subgraph subgraph, int depth) {
			subgraphs++;
			maxDepth = Math.max(maxDepth, depth);
			return null;
		}
	}
}
