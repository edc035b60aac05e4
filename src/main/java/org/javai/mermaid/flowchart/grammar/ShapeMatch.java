package org.javai.mermaid.flowchart.grammar;

import org.javai.mermaid.ast.NodeShape;

/**
 * A recognized node shape.
 *
 * @param shape the shape denoted by the bracket pair
 * @param text display text between the brackets, or {@code null}
 * @param icon icon reference lifted out of the text, or {@code null}
 * @param consumed number of tokens from the opener through the closer
 */
public record ShapeMatch(NodeShape shape, String text, String icon, int consumed) {
}
