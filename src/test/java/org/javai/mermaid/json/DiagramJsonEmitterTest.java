package org.javai.mermaid.json;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import org.javai.mermaid.ast.FlowchartDiagram;
import org.javai.mermaid.diagnostics.Diagnostic;
import org.javai.mermaid.diagnostics.DiagnosticKind;
import org.javai.mermaid.diagnostics.Location;
import org.javai.mermaid.flowchart.FlowchartParser;
import org.javai.mermaid.testsupport.DiagramFixtures;
import org.junit.jupiter.api.Test;

class DiagramJsonEmitterTest {

	private final FlowchartDiagram diagram =
			new FlowchartParser().parse(DiagramFixtures.load("order-flow.mmd")).orElseThrow();

	@Test
	void emitsDiagramHeader() {
		ObjectNode json = DiagramJsonEmitter.emit(diagram);

		assertThat(json.get("type").asText()).isEqualTo("flowchart");
		assertThat(json.get("title").asText()).isEqualTo("Order flow");
		assertThat(json.get("direction").asText()).isEqualTo("LR");
		assertThat(json.at("/accessibility/title").asText()).isEqualTo("Order processing");
	}

	@Test
	void emitsNodesWithLowerCaseShapesAndNoNullFields() {
		ObjectNode json = DiagramJsonEmitter.emit(diagram);

		JsonNode start = json.get("nodes").get(0);
		assertThat(start.get("id").asText()).isEqualTo("start");
		assertThat(start.get("shape").asText()).isEqualTo("stadium");
		assertThat(start.has("icon")).isFalse();
		assertThat(start.has("styles")).isFalse();

		JsonNode ship = json.get("nodes").get(6);
		assertThat(ship.get("classes").get(0).asText()).isEqualTo("done");
		assertThat(ship.at("/styles/fill").asText()).isEqualTo("#9f6");
	}

	@Test
	void emitsEdgesSubgraphsAndClicks() {
		ObjectNode json = DiagramJsonEmitter.emit(diagram);

		assertThat(json.get("edges")).hasSize(6);
		assertThat(json.at("/edges/0/type").asText()).isEqualTo("arrow");
		assertThat(json.at("/edges/0/styles/stroke").asText()).isEqualTo("#00f");
		assertThat(json.at("/edges/1/label").asText()).isEqualTo("yes");
		assertThat(json.at("/subgraphs/0/id").asText()).isEqualTo("fulfil");
		assertThat(json.at("/subgraphs/0/edgeCount").asInt()).isEqualTo(2);
		assertThat(json.at("/subgraphs/0/direction").asText()).isEqualTo("TB");
		assertThat(json.at("/classDefs/done/stroke").asText()).isEqualTo("#333");
		assertThat(json.at("/clicks/0/url").asText()).isEqualTo("https://example.com/payments");
		assertThat(json.at("/clicks/0/target").asText()).isEqualTo("_blank");
	}

	@Test
	void prettyJsonReadsBackToSameTree() throws Exception {
		String text = DiagramJsonEmitter.toJson(diagram);

		assertThat(text).contains("\n");
		assertThat(new ObjectMapper().readTree(text)).isEqualTo(DiagramJsonEmitter.emit(diagram));
	}

	@Test
	void emitsDiagnostic() {
		Diagnostic diagnostic = Diagnostic.of(DiagnosticKind.STRUCTURAL, "Subgraph 'outer' is never closed",
				List.of("end"), "<end of input>", new Location(2, 5));

		ObjectNode json = DiagramJsonEmitter.emit(diagnostic);

		assertThat(json.get("kind").asText()).isEqualTo("structural");
		assertThat(json.get("line").asInt()).isEqualTo(2);
		assertThat(json.get("column").asInt()).isEqualTo(5);
		assertThat(json.at("/expected/0").asText()).isEqualTo("end");
		assertThat(json.get("found").asText()).isEqualTo("<end of input>");
	}
}
