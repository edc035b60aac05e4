package org.javai.mermaid.ast;

import java.util.Objects;
import java.util.Optional;

/**
 * Interaction attached to a node by one or more {@code click} lines.
 * At least one of {@code link} and {@code callback} is present.
 *
 * @param nodeId the decorated node
 * @param link external link, or {@code null}
 * @param callback callback invocation, or {@code null}
 * @param tooltip tooltip text, or {@code null}
 */
public record ClickBinding(String nodeId, Link link, Callback callback, String tooltip) {

	public ClickBinding {
		Objects.requireNonNull(nodeId, "nodeId must not be null");
		if (link == null && callback == null) {
			throw new IllegalArgumentException("Click binding for '" + nodeId + "' needs a link or a callback");
		}
	}

	/**
	 * @param url the link target
	 * @param target browser window target such as {@code _blank}, or {@code null}
	 */
	public record Link(String url, String target) {
		public Link {
			Objects.requireNonNull(url, "url must not be null");
		}
	}

	/**
	 * @param name the callback function name
	 * @param arguments raw argument text from {@code call name(args)}, or {@code null}
	 */
	public record Callback(String name, String arguments) {
		public Callback {
			Objects.requireNonNull(name, "name must not be null");
		}
	}

	public boolean hasLink() {
		return link != null;
	}

	public boolean hasCallback() {
		return callback != null;
	}

	public Optional<String> tooltipOptional() {
		return Optional.ofNullable(tooltip);
	}

	/**
	 * Merges a later binding for the same node into this one. Parts present in
	 * {@code other} replace the corresponding parts here.
	 */
	public ClickBinding merge(ClickBinding other) {
		if (!nodeId.equals(other.nodeId)) {
			throw new IllegalArgumentException("Cannot merge click bindings of '" + nodeId + "' and '" + other.nodeId + "'");
		}
		return new ClickBinding(
				nodeId,
				other.link != null ? other.link : link,
				other.callback != null ? other.callback : callback,
				other.tooltip != null ? other.tooltip : tooltip);
	}
}
