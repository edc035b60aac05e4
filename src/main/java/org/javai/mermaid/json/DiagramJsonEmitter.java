package org.javai.mermaid.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Locale;
import java.util.Map;
import org.javai.mermaid.ast.ClassStyle;
import org.javai.mermaid.ast.ClickBinding;
import org.javai.mermaid.ast.Edge;
import org.javai.mermaid.ast.FlowchartDiagram;
import org.javai.mermaid.ast.Node;
import org.javai.mermaid.ast.Subgraph;
import org.javai.mermaid.diagnostics.Diagnostic;

/**
 * Emits a JSON view of a parsed flowchart for tooling. Absent optional values
 * are left out rather than written as {@code null}; enum values are lower case.
 */
public final class DiagramJsonEmitter {

	private static final ObjectMapper mapper = new ObjectMapper();

	private DiagramJsonEmitter() {}

	public static ObjectNode emit(FlowchartDiagram diagram) {
		ObjectNode root = mapper.createObjectNode();
		root.put("type", "flowchart");
		putIfPresent(root, "title", diagram.title());
		root.put("direction", diagram.direction().name());
		if (!diagram.accessibility().isEmpty()) {
			ObjectNode acc = root.putObject("accessibility");
			putIfPresent(acc, "title", diagram.accessibility().title());
			putIfPresent(acc, "description", diagram.accessibility().description());
		}

		ArrayNode nodes = root.putArray("nodes");
		diagram.nodes().values().forEach(node -> emitNode(nodes.addObject(), node));

		ArrayNode edges = root.putArray("edges");
		diagram.edges().forEach(edge -> emitEdge(edges.addObject(), edge));

		ArrayNode subgraphs = root.putArray("subgraphs");
		diagram.subgraphs().forEach(subgraph -> emitSubgraph(subgraphs.addObject(), subgraph));

		ObjectNode classDefs = root.putObject("classDefs");
		for (ClassStyle classStyle : diagram.classDefs().values()) {
			putStyles(classDefs, classStyle.name(), classStyle.properties());
		}

		ArrayNode clicks = root.putArray("clicks");
		diagram.clicks().forEach(click -> emitClick(clicks.addObject(), click));
		return root;
	}

	public static ObjectNode emit(Diagnostic diagnostic) {
		ObjectNode root = mapper.createObjectNode();
		root.put("kind", diagnostic.kind().name().toLowerCase(Locale.ROOT));
		root.put("message", diagnostic.message());
		root.put("line", diagnostic.line());
		root.put("column", diagnostic.column());
		if (!diagnostic.expected().isEmpty()) {
			ArrayNode expected = root.putArray("expected");
			diagnostic.expected().forEach(expected::add);
		}
		if (!diagnostic.found().isEmpty()) {
			root.put("found", diagnostic.found());
		}
		return root;
	}

	/**
	 * Pretty-printed JSON text of the diagram.
	 */
	public static String toJson(FlowchartDiagram diagram) {
		try {
			return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(emit(diagram));
		} catch (JsonProcessingException e) {
			throw new IllegalStateException("Failed to write diagram as JSON", e);
		}
	}

	private static void emitNode(ObjectNode n, Node node) {
		n.put("id", node.id());
		putIfPresent(n, "text", node.text());
		n.put("shape", node.shape().name().toLowerCase(Locale.ROOT));
		putIfPresent(n, "icon", node.icon());
		if (!node.classes().isEmpty()) {
			ArrayNode classes = n.putArray("classes");
			node.classes().forEach(classes::add);
		}
		putStyles(n, "styles", node.styles());
	}

	private static void emitEdge(ObjectNode e, Edge edge) {
		e.put("from", edge.from());
		e.put("to", edge.to());
		e.put("type", edge.type().name().toLowerCase(Locale.ROOT));
		putIfPresent(e, "label", edge.label());
		if (edge.minLength() != null) {
			e.put("minLength", edge.minLength());
		}
		putStyles(e, "styles", edge.styles());
	}

	private static void emitSubgraph(ObjectNode s, Subgraph subgraph) {
		s.put("id", subgraph.id());
		putIfPresent(s, "title", subgraph.title());
		if (subgraph.direction() != null) {
			s.put("direction", subgraph.direction().name());
		}
		ArrayNode nodeIds = s.putArray("nodes");
		subgraph.nodeIds().forEach(nodeIds::add);
		s.put("edgeCount", subgraph.edges().size());
		putStyles(s, "styles", subgraph.styles());
		ArrayNode children = s.putArray("children");
		subgraph.children().forEach(child -> emitSubgraph(children.addObject(), child));
	}

	private static void emitClick(ObjectNode c, ClickBinding click) {
		c.put("node", click.nodeId());
		if (click.hasLink()) {
			c.put("url", click.link().url());
			putIfPresent(c, "target", click.link().target());
		}
		if (click.hasCallback()) {
			c.put("callback", click.callback().name());
			putIfPresent(c, "arguments", click.callback().arguments());
		}
		putIfPresent(c, "tooltip", click.tooltip());
	}

	private static void putStyles(ObjectNode parent, String field, Map<String, String> styles) {
		if (styles.isEmpty()) {
			return;
		}
		ObjectNode node = parent.putObject(field);
		styles.forEach(node::put);
	}

	private static void putIfPresent(ObjectNode node, String field, String value) {
		if (value != null) {
			node.put(field, value);
		}
	}
}
