package org.javai.mermaid.diagnostics;

/**
 * Thrown when diagram text cannot be parsed. Carries the {@link Diagnostic}
 * describing the first fatal problem.
 */
public class MermaidParseException extends RuntimeException {

	private final Diagnostic diagnostic;

	public MermaidParseException(Diagnostic diagnostic) {
		super(diagnostic.toString());
		this.diagnostic = diagnostic;
	}

	public MermaidParseException(Diagnostic diagnostic, Throwable cause) {
		super(diagnostic.toString(), cause);
		this.diagnostic = diagnostic;
	}

	public Diagnostic diagnostic() {
		return diagnostic;
	}
}
