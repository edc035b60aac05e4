package org.javai.mermaid.ast;

/**
 * Node shapes and the bracket pairs that denote them.
 */
public enum NodeShape {
	RECTANGLE("[", "]"),
	ROUNDED_RECTANGLE("(", ")"),
	STADIUM("([", "])"),
	SUBROUTINE("[[", "]]"),
	CYLINDER("[(", ")]"),
	CIRCLE("((", "))"),
	DOUBLE_CIRCLE("(((", ")))"),
	ASYMMETRIC(">", "]"),
	RHOMBUS("{", "}"),
	HEXAGON("{{", "}}"),
	PARALLELOGRAM("[/", "/]"),
	PARALLELOGRAM_ALT("[\\", "\\]"),
	TRAPEZOID("[/", "\\]"),
	TRAPEZOID_ALT("[\\", "/]");

	private final String open;
	private final String close;

	NodeShape(String open, String close) {
		this.open = open;
		this.close = close;
	}

	public String open() {
		return open;
	}

	public String close() {
		return close;
	}
}
