package org.javai.mermaid.flowchart.grammar;

import org.javai.mermaid.ast.EdgeType;

/**
 * A recognized edge symbol with its optional label.
 *
 * @param type the edge type
 * @param label the label from {@code |label|} or {@code -- label -->}, or {@code null}
 * @param minLength length hint for lines drawn longer than their shortest form, or {@code null}
 * @param consumed number of tokens from the first line symbol through the end of the label
 */
public record EdgeMatch(EdgeType type, String label, Integer minLength, int consumed) {
}
