package org.javai.mermaid.ast;

import java.util.Optional;

/**
 * Layout direction of a flowchart or subgraph.
 */
public enum FlowDirection {
	TB, // top to bottom
	TD, // top down, same as TB
	BT,
	RL,
	LR;

	/**
	 * Looks up a direction code, matching the exact upper-case spelling.
	 */
	public static Optional<FlowDirection> fromCode(String code) {
		if (code == null) {
			return Optional.empty();
		}
		for (FlowDirection direction : values()) {
			if (direction.name().equals(code)) {
				return Optional.of(direction);
			}
		}
		return Optional.empty();
	}
}
