package org.javai.mermaid.batch;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.javai.mermaid.ast.FlowchartDiagram;
import org.javai.mermaid.flowchart.FlowchartParser;
import org.javai.mermaid.testsupport.DiagramFixtures;
import org.junit.jupiter.api.Test;

class DiagramStatisticsTest {

	private final FlowchartParser parser = new FlowchartParser();

	@Test
	void countsElementsOfFixture() {
		FlowchartDiagram diagram = parser.parse(DiagramFixtures.load("order-flow.mmd")).orElseThrow();

		assertThat(DiagramStatistics.of(diagram)).isEqualTo(new DiagramStatistics(7, 6, 1, 1));
	}

	@Test
	void sumsCountsAndKeepsDeepestNesting() {
		FlowchartDiagram nested = parser.parse("""
				flowchart TD
				    subgraph a
				        subgraph b
				            x --> y
				        end
				    end
				""").orElseThrow();
		FlowchartDiagram flat = parser.parse("flowchart TD\nA --> B --> C").orElseThrow();

		DiagramStatistics total = DiagramStatistics.sum(List.of(nested, flat));

		assertThat(total).isEqualTo(new DiagramStatistics(5, 3, 2, 2));
	}

	@Test
	void emptyCollectionSumsToEmpty() {
		assertThat(DiagramStatistics.sum(List.of())).isEqualTo(DiagramStatistics.EMPTY);
	}
}
