package org.javai.mermaid.flowchart;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.javai.mermaid.ast.FlowDirection;
import org.javai.mermaid.diagnostics.Location;

/**
 * Flat store of subgraph records keyed by id. Nesting is expressed through parent
 * ids rather than object references, so a subgraph reopened under a different
 * parent is simply re-parented and the assembler can detect the resulting cycles
 * by walking ancestors.
 */
public class SubgraphArena {

	/**
	 * Mutable record for one subgraph while the parse is in progress.
	 */
	public static final class Entry {
		private final String id;
		private final Location openedAt;
		private String title;
		private FlowDirection direction;
		private String parentId;
		private final Set<String> nodeIds = new LinkedHashSet<>();
		private final List<Integer> edgeIndices = new ArrayList<>();
		private final Set<String> childIds = new LinkedHashSet<>();

		private Entry(String id, String title, Location openedAt) {
			this.id = id;
			this.title = title;
			this.openedAt = openedAt;
		}

		public String id() {
			return id;
		}

		public String title() {
			return title;
		}

		public FlowDirection direction() {
			return direction;
		}

		public void setDirection(FlowDirection direction) {
			this.direction = direction;
		}

		public String parentId() {
			return parentId;
		}

		public Location openedAt() {
			return openedAt;
		}

		public void addNode(String nodeId) {
			nodeIds.add(nodeId);
		}

		public void addEdge(int edgeIndex) {
			edgeIndices.add(edgeIndex);
		}

		public Set<String> nodeIds() {
			return Collections.unmodifiableSet(nodeIds);
		}

		public List<Integer> edgeIndices() {
			return Collections.unmodifiableList(edgeIndices);
		}

		public Set<String> childIds() {
			return Collections.unmodifiableSet(childIds);
		}
	}

	private final Map<String, Entry> entries = new LinkedHashMap<>();

	/**
	 * Opens a subgraph under {@code parentId} (or at top level when {@code null}).
	 * Reopening an existing id keeps its contents, updates the title when one is
	 * given, and moves it under the new parent.
	 */
	public Entry open(String id, String title, String parentId, Location location) {
		Entry entry = entries.get(id);
		if (entry == null) {
			entry = new Entry(id, title, location);
			entries.put(id, entry);
		} else {
			if (title != null) {
				entry.title = title;
			}
			Entry oldParent = entry.parentId != null ? entries.get(entry.parentId) : null;
			if (oldParent != null) {
				oldParent.childIds.remove(id);
			}
		}
		entry.parentId = parentId;
		if (parentId != null) {
			entries.get(parentId).childIds.add(id);
		}
		return entry;
	}

	public boolean contains(String id) {
		return entries.containsKey(id);
	}

	public Entry get(String id) {
		return entries.get(id);
	}

	public Collection<Entry> entries() {
		return Collections.unmodifiableCollection(entries.values());
	}

	/**
	 * Entries without a parent, in order of first opening.
	 */
	public List<Entry> roots() {
		List<Entry> roots = new ArrayList<>();
		for (Entry entry : entries.values()) {
			if (entry.parentId == null) {
				roots.add(entry);
			}
		}
		return roots;
	}

	/**
	 * Walks the ancestors of every entry and returns the first cycle found, as the
	 * list of ids along it with the repeated id at both ends.
	 */
	public Optional<List<String>> findCycle() {
		for (Entry entry : entries.values()) {
			List<String> path = new ArrayList<>();
			String current = entry.id;
			while (current != null) {
				int seen = path.indexOf(current);
				if (seen >= 0) {
					List<String> cycle = new ArrayList<>(path.subList(seen, path.size()));
					cycle.add(current);
					return Optional.of(cycle);
				}
				path.add(current);
				current = entries.get(current).parentId;
			}
		}
		return Optional.empty();
	}
}
