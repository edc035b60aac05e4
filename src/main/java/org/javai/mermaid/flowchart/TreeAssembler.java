package org.javai.mermaid.flowchart;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.javai.mermaid.ParseOutcome;
import org.javai.mermaid.ast.ClassStyle;
import org.javai.mermaid.ast.ClickBinding;
import org.javai.mermaid.ast.Edge;
import org.javai.mermaid.ast.FlowchartDiagram;
import org.javai.mermaid.ast.Node;
import org.javai.mermaid.ast.Subgraph;
import org.javai.mermaid.config.ParserPolicy;
import org.javai.mermaid.diagnostics.Diagnostic;
import org.javai.mermaid.diagnostics.DiagnosticKind;
import org.javai.mermaid.diagnostics.Location;
import org.javai.mermaid.diagnostics.MermaidParseException;
import org.javai.mermaid.flowchart.directive.Directive;
import org.javai.mermaid.flowchart.directive.Directive.ClassDefDirective;
import org.javai.mermaid.flowchart.directive.Directive.ClassDirective;
import org.javai.mermaid.flowchart.directive.Directive.ClickDirective;
import org.javai.mermaid.flowchart.directive.Directive.LinkStyleDirective;
import org.javai.mermaid.flowchart.directive.Directive.StyleDirective;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns {@link ParseFragments} into an immutable {@link FlowchartDiagram}.
 * <p>
 * Directives are applied in a fixed order regardless of where they appear in
 * the source: class definitions, class assignments, style overrides, link
 * styles, click bindings. A node's effective style is the {@code default}
 * class, then its classes in assignment order, then its {@code style} lines,
 * each later write replacing earlier values of the same property.
 */
public class TreeAssembler {

	private static final Logger logger = LoggerFactory.getLogger(TreeAssembler.class);

	private final ParserPolicy policy;

	public TreeAssembler(ParserPolicy policy) {
		this.policy = policy != null ? policy : ParserPolicy.defaults();
	}

	/**
	 * Assembles the diagram.
	 *
	 * @param fragments what the statement parser collected
	 * @return the diagram with the parser's and the assembler's warnings
	 * @throws MermaidParseException on a subgraph cycle, or on an unknown reference under
	 *         {@link org.javai.mermaid.config.ReferencePolicy#FAIL}
	 */
	public ParseOutcome.Success<FlowchartDiagram> assemble(ParseFragments fragments) {
		List<Diagnostic> warnings = new ArrayList<>(fragments.warnings());
		checkForCycles(fragments.arena());

		Map<String, Node> declared = fragments.nodes();
		Map<String, ClassStyle> classDefs = applyClassDefs(fragments.directives());
		Map<String, Set<String>> classes = applyClasses(fragments.directives(), declared, warnings);

		Map<String, Map<String, String>> nodeStyles = new HashMap<>();
		Map<String, Map<String, String>> subgraphStyles = new HashMap<>();
		for (Directive directive : fragments.directives()) {
			if (directive instanceof StyleDirective style) {
				if (declared.containsKey(style.targetId())) {
					nodeStyles.computeIfAbsent(style.targetId(), k -> new LinkedHashMap<>()).putAll(style.properties());
				} else if (fragments.arena().contains(style.targetId())) {
					subgraphStyles.computeIfAbsent(style.targetId(), k -> new LinkedHashMap<>())
							.putAll(style.properties());
				} else {
					unknownReference("style targets unknown node or subgraph '" + style.targetId() + "'",
							style.location(), warnings);
				}
			}
		}

		Map<String, Node> nodes = new LinkedHashMap<>();
		ClassStyle defaults = classDefs.get(ClassStyle.DEFAULT_CLASS);
		for (Node node : declared.values()) {
			List<String> nodeClasses = new ArrayList<>(classes.getOrDefault(node.id(), Set.of()));
			Map<String, String> effective = new LinkedHashMap<>();
			if (defaults != null) {
				effective.putAll(defaults.properties());
			}
			for (String className : nodeClasses) {
				ClassStyle classStyle = classDefs.get(className);
				if (classStyle != null) {
					effective.putAll(classStyle.properties());
				} else {
					logger.debug("Node '{}' uses class '{}' which has no classDef", node.id(), className);
				}
			}
			effective.putAll(nodeStyles.getOrDefault(node.id(), Map.of()));
			nodes.put(node.id(), new Node(node.id(), node.text(), node.shape(), nodeClasses, node.icon(), effective));
		}

		List<Edge> edges = applyLinkStyles(fragments.directives(), fragments.edges(), warnings);
		List<ClickBinding> clicks = applyClicks(fragments.directives(), declared, warnings);
		List<Subgraph> subgraphs = buildSubgraphs(fragments.arena(), edges, subgraphStyles);

		FlowchartDiagram diagram = new FlowchartDiagram(fragments.title(), fragments.accessibility(),
				fragments.direction(), nodes, edges, subgraphs, classDefs, clicks);
		return new ParseOutcome.Success<>(diagram, warnings);
	}

	private void checkForCycles(SubgraphArena arena) {
		Optional<List<String>> cycle = arena.findCycle();
		if (cycle.isPresent()) {
			List<String> ids = cycle.get();
			throw new MermaidParseException(Diagnostic.of(DiagnosticKind.STRUCTURAL,
					"Subgraph nesting forms a cycle: " + String.join(" -> ", ids),
					arena.get(ids.get(0)).openedAt()));
		}
	}

	private static Map<String, ClassStyle> applyClassDefs(List<Directive> directives) {
		Map<String, Map<String, String>> merged = new LinkedHashMap<>();
		for (Directive directive : directives) {
			if (directive instanceof ClassDefDirective classDef) {
				for (String name : classDef.classNames()) {
					merged.computeIfAbsent(name, k -> new LinkedHashMap<>()).putAll(classDef.properties());
				}
			}
		}
		Map<String, ClassStyle> classDefs = new LinkedHashMap<>();
		merged.forEach((name, properties) -> classDefs.put(name, new ClassStyle(name, properties)));
		return classDefs;
	}

	private static Map<String, Set<String>> applyClasses(List<Directive> directives, Map<String, Node> declared,
			List<Diagnostic> warnings) {
		Map<String, Set<String>> classes = new HashMap<>();
		for (Directive directive : directives) {
			if (directive instanceof ClassDirective assignment) {
				for (String nodeId : assignment.nodeIds()) {
					if (declared.containsKey(nodeId)) {
						classes.computeIfAbsent(nodeId, k -> new LinkedHashSet<>()).add(assignment.className());
					} else {
						warnings.add(Diagnostic.of(DiagnosticKind.REFERENCE,
								"class '" + assignment.className() + "' applied to unknown node '" + nodeId + "'",
								assignment.location()));
					}
				}
			}
		}
		return classes;
	}

	private List<Edge> applyLinkStyles(List<Directive> directives, List<Edge> declared, List<Diagnostic> warnings) {
		List<Map<String, String>> styles = new ArrayList<>();
		for (int i = 0; i < declared.size(); i++) {
			styles.add(new LinkedHashMap<>(declared.get(i).styles()));
		}
		for (Directive directive : directives) {
			if (directive instanceof LinkStyleDirective linkStyle) {
				if (linkStyle.allEdges()) {
					styles.forEach(s -> s.putAll(linkStyle.properties()));
					continue;
				}
				for (int index : linkStyle.indices()) {
					if (index < 0 || index >= declared.size()) {
						unknownReference("linkStyle index " + index + " is out of range, the diagram has "
								+ declared.size() + " edges", linkStyle.location(), warnings);
					} else {
						styles.get(index).putAll(linkStyle.properties());
					}
				}
			}
		}
		List<Edge> edges = new ArrayList<>();
		for (int i = 0; i < declared.size(); i++) {
			Edge edge = declared.get(i);
			edges.add(styles.get(i).isEmpty() ? edge : edge.withStyles(styles.get(i)));
		}
		return edges;
	}

	private List<ClickBinding> applyClicks(List<Directive> directives, Map<String, Node> declared,
			List<Diagnostic> warnings) {
		Map<String, ClickBinding> clicks = new LinkedHashMap<>();
		for (Directive directive : directives) {
			if (directive instanceof ClickDirective click) {
				if (!declared.containsKey(click.nodeId())) {
					unknownReference("click targets unknown node '" + click.nodeId() + "'", click.location(), warnings);
					continue;
				}
				clicks.merge(click.nodeId(), click.toBinding(), ClickBinding::merge);
			}
		}
		return new ArrayList<>(clicks.values());
	}

	/**
	 * Builds the subgraph forest bottom-up without recursion: entries are listed in
	 * pre-order and then built in reverse, so every child exists before its parent.
	 */
	private static List<Subgraph> buildSubgraphs(SubgraphArena arena, List<Edge> edges,
			Map<String, Map<String, String>> styles) {
		List<SubgraphArena.Entry> preOrder = new ArrayList<>();
		Deque<SubgraphArena.Entry> pending = new ArrayDeque<>();
		List<SubgraphArena.Entry> roots = arena.roots();
		for (int i = roots.size() - 1; i >= 0; i--) {
			pending.push(roots.get(i));
		}
		while (!pending.isEmpty()) {
			SubgraphArena.Entry entry = pending.pop();
			preOrder.add(entry);
			List<String> childIds = new ArrayList<>(entry.childIds());
			for (int i = childIds.size() - 1; i >= 0; i--) {
				pending.push(arena.get(childIds.get(i)));
			}
		}

		Map<String, Subgraph> built = new HashMap<>();
		for (int i = preOrder.size() - 1; i >= 0; i--) {
			SubgraphArena.Entry entry = preOrder.get(i);
			List<Edge> ownEdges = new ArrayList<>();
			for (int index : entry.edgeIndices()) {
				ownEdges.add(edges.get(index));
			}
			List<Subgraph> children = new ArrayList<>();
			for (String childId : entry.childIds()) {
				children.add(built.get(childId));
			}
			built.put(entry.id(), new Subgraph(entry.id(), entry.title(), entry.direction(),
					new ArrayList<>(entry.nodeIds()), ownEdges, children, styles.get(entry.id())));
		}

		List<Subgraph> forest = new ArrayList<>();
		for (SubgraphArena.Entry root : roots) {
			forest.add(built.get(root.id()));
		}
		return forest;
	}

	private void unknownReference(String message, Location location, List<Diagnostic> warnings) {
		Diagnostic diagnostic = Diagnostic.of(DiagnosticKind.REFERENCE, message, location);
		if (policy.failOnUnknownReference()) {
			throw new MermaidParseException(diagnostic);
		}
		warnings.add(diagnostic);
	}
}
