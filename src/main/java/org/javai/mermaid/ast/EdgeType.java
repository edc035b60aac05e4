package org.javai.mermaid.ast;

/**
 * Kinds of connection between two nodes, named after their shortest symbol.
 */
public enum EdgeType {
	ARROW("-->"),
	DOTTED_ARROW("-.->"),
	THICK_ARROW("==>"),
	OPEN_LINK("---"),
	DOTTED_LINK("-.-"),
	THICK_LINK("==="),
	INVISIBLE("~~~"),
	CIRCLE("--o"),
	CROSS("--x"),
	BIDIRECTIONAL("<-->");

	private final String symbol;

	EdgeType(String symbol) {
		this.symbol = symbol;
	}

	public String symbol() {
		return symbol;
	}
}
