package org.javai.mermaid.flowchart;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.javai.mermaid.ast.Accessibility;
import org.javai.mermaid.ast.Edge;
import org.javai.mermaid.ast.FlowDirection;
import org.javai.mermaid.ast.Node;
import org.javai.mermaid.diagnostics.Diagnostic;
import org.javai.mermaid.flowchart.directive.Directive;

/**
 * Everything the statement parser collects for the tree assembler: undecorated
 * nodes and edges, the subgraph arena, queued directives and warnings.
 */
public class ParseFragments {

	private final Map<String, Node> nodes = new LinkedHashMap<>();
	private final List<Edge> edges = new ArrayList<>();
	private final SubgraphArena arena = new SubgraphArena();
	private final List<Directive> directives = new ArrayList<>();
	private final List<Diagnostic> warnings = new ArrayList<>();
	private FlowDirection direction = FlowDirection.TD;
	private Accessibility accessibility = Accessibility.NONE;
	private String title;

	public Map<String, Node> nodes() {
		return nodes;
	}

	public List<Edge> edges() {
		return edges;
	}

	/**
	 * Appends an edge and returns its index in source order.
	 */
	public int addEdge(Edge edge) {
		edges.add(edge);
		return edges.size() - 1;
	}

	public SubgraphArena arena() {
		return arena;
	}

	public List<Directive> directives() {
		return directives;
	}

	public void addDirective(Directive directive) {
		directives.add(directive);
	}

	public List<Diagnostic> warnings() {
		return Collections.unmodifiableList(warnings);
	}

	public void warn(Diagnostic warning) {
		warnings.add(warning);
	}

	public FlowDirection direction() {
		return direction;
	}

	public void setDirection(FlowDirection direction) {
		this.direction = direction;
	}

	public Accessibility accessibility() {
		return accessibility;
	}

	public void setAccessibility(Accessibility accessibility) {
		this.accessibility = accessibility;
	}

	public String title() {
		return title;
	}

	public void setTitle(String title) {
		this.title = title;
	}
}
