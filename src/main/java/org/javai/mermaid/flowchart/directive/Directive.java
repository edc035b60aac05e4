package org.javai.mermaid.flowchart.directive;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.javai.mermaid.ast.ClickBinding;
import org.javai.mermaid.diagnostics.Location;

/**
 * A decoration line queued by the statement parser and applied by the tree
 * assembler once every node is known. Sealed so the assembler handles all kinds.
 * <ul>
 *   <li>{@link ClassDefDirective} - {@code classDef a,b fill:#f9f}</li>
 *   <li>{@link ClassDirective} - {@code class A,B a}, or {@code A:::a} on a node</li>
 *   <li>{@link StyleDirective} - {@code style A fill:#f9f}</li>
 *   <li>{@link LinkStyleDirective} - {@code linkStyle 0,2 stroke:red}</li>
 *   <li>{@link ClickDirective} - {@code click A callback "tip"}</li>
 * </ul>
 */
public sealed interface Directive {

	/**
	 * Where the directive starts in the source.
	 */
	Location location();

	/**
	 * @param classNames the classes being defined
	 * @param properties style properties in declaration order
	 * @param location where the line starts
	 */
	record ClassDefDirective(List<String> classNames, Map<String, String> properties, Location location)
			implements Directive {
		public ClassDefDirective {
			classNames = classNames != null ? List.copyOf(classNames) : List.of();
			properties = copy(properties);
		}
	}

	/**
	 * @param nodeIds the nodes receiving the class
	 * @param className the class applied
	 * @param location where the line (or the {@code :::} shorthand) starts
	 */
	record ClassDirective(List<String> nodeIds, String className, Location location) implements Directive {
		public ClassDirective {
			nodeIds = nodeIds != null ? List.copyOf(nodeIds) : List.of();
			Objects.requireNonNull(className, "className must not be null");
		}
	}

	/**
	 * @param targetId a node or subgraph id
	 * @param properties style properties in declaration order
	 * @param location where the target id appears
	 */
	record StyleDirective(String targetId, Map<String, String> properties, Location location) implements Directive {
		public StyleDirective {
			Objects.requireNonNull(targetId, "targetId must not be null");
			properties = copy(properties);
		}
	}

	/**
	 * @param indices zero-based edge indices in source order; empty when {@code allEdges}
	 * @param allEdges whether the line used {@code default}
	 * @param properties style properties in declaration order
	 * @param location where the line starts
	 */
	record LinkStyleDirective(List<Integer> indices, boolean allEdges, Map<String, String> properties,
			Location location) implements Directive {
		public LinkStyleDirective {
			indices = indices != null ? List.copyOf(indices) : List.of();
			properties = copy(properties);
		}
	}

	/**
	 * @param nodeId the node the interaction is bound to
	 * @param link external link, or {@code null}
	 * @param callback callback invocation, or {@code null}
	 * @param tooltip tooltip text, or {@code null}
	 * @param location where the node id appears
	 */
	record ClickDirective(String nodeId, ClickBinding.Link link, ClickBinding.Callback callback, String tooltip,
			Location location) implements Directive {
		public ClickDirective {
			Objects.requireNonNull(nodeId, "nodeId must not be null");
		}

		public ClickBinding toBinding() {
			return new ClickBinding(nodeId, link, callback, tooltip);
		}
	}

	private static Map<String, String> copy(Map<String, String> properties) {
		return properties != null ? Collections.unmodifiableMap(new LinkedHashMap<>(properties)) : Map.of();
	}
}
