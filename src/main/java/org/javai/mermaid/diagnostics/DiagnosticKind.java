package org.javai.mermaid.diagnostics;

/**
 * Categories of problems reported while parsing a diagram.
 */
public enum DiagnosticKind {
	/** Input character sequence matched no token rule. Always fatal. */
	LEXICAL(true),
	/** Unmatched bracket or line symbol, unterminated or cyclic subgraph, missing header. Always fatal. */
	STRUCTURAL(true),
	/** A directive names an identifier that was never declared. Fatal unless the policy demotes it. */
	REFERENCE(true),
	/** A line that matches no statement form; parsing resumes on the next line. */
	UNKNOWN_STATEMENT(false),
	/** A node declared again with a different shape or text; the first declaration is kept. */
	DUPLICATE_DECLARATION(false);

	private final boolean fatalByDefault;

	DiagnosticKind(boolean fatalByDefault) {
		this.fatalByDefault = fatalByDefault;
	}

	public boolean isFatalByDefault() {
		return fatalByDefault;
	}
}
