package org.javai.mermaid.ast;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SubgraphWalkerTest {

	private static Subgraph subgraph(String id, Subgraph... children) {
		return new Subgraph(id, null, null, List.of(), List.of(), List.of(children), null);
	}

	private final Subgraph tree = subgraph("root", subgraph("a", subgraph("a1")), subgraph("b"));

	private static final class Recorder implements DiagramVisitor<String> {
		private final List<String> visits = new ArrayList<>();

		@Override
		public String visitNode(Node node) {
			visits.add("node:" + node.id());
			return node.id();
		}

		@Override
		public String visitEdge(Edge edge) {
			visits.add("edge:" + edge.from() + "->" + edge.to());
			return edge.from();
		}

		@Override
		public String visitSubgraph(Subgraph subgraph, int depth) {
			visits.add(subgraph.id() + "@" + depth);
			return subgraph.id();
		}
	}

	@Test
	void preOrderVisitsParentFirst() {
		Recorder recorder = new Recorder();

		String result = SubgraphWalker.walkPreOrder(tree, recorder);

		assertThat(result).isEqualTo("root");
		assertThat(recorder.visits).containsExactly("root@1", "a@2", "a1@3", "b@2");
	}

	@Test
	void postOrderVisitsChildrenFirst() {
		Recorder recorder = new Recorder();

		SubgraphWalker.walkPostOrder(tree, recorder);

		assertThat(recorder.visits).containsExactly("a1@3", "a@2", "b@2", "root@1");
	}

	@Test
	void findsAndFlattensAcrossForest() {
		List<Subgraph> forest = List.of(tree, subgraph("other"));

		assertThat(SubgraphWalker.find(forest, "a1")).get().extracting(Subgraph::id).isEqualTo("a1");
		assertThat(SubgraphWalker.find(forest, "missing")).isEmpty();
		assertThat(SubgraphWalker.flatten(forest)).extracting(Subgraph::id)
				.containsExactly("root", "a", "a1", "b", "other");
		assertThat(tree.depth()).isEqualTo(3);
	}

	@Test
	void diagramAcceptVisitsNodesEdgesThenSubgraphs() {
		FlowchartDiagram diagram = new FlowchartDiagram(null, null, null,
				Map.of("A", Node.stub("A")),
				List.of(new Edge("A", "A", EdgeType.ARROW, null, null)),
				List.of(subgraph("s")), null, null);
		Recorder recorder = new Recorder();

		diagram.accept(recorder);

		assertThat(recorder.visits).containsExactly("node:A", "edge:A->A", "s@1");
		assertThat(diagram.direction()).isEqualTo(FlowDirection.TD);
	}
}
