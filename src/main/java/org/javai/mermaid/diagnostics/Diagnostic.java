package org.javai.mermaid.diagnostics;

import java.util.List;
import java.util.Objects;

/**
 * A single parse problem, shared by the tokenizer, the statement parser and the
 * tree assembler so that callers see the same shape whichever phase failed.
 *
 * @param kind the problem category
 * @param message human-readable description
 * @param expected the token kinds or keywords that would have been accepted (may be empty)
 * @param found the text actually found at the failure point (may be empty)
 * @param location where the problem starts
 */
public record Diagnostic(
		DiagnosticKind kind,
		String message,
		List<String> expected,
		String found,
		Location location
) {

	public Diagnostic {
		Objects.requireNonNull(kind, "kind must not be null");
		Objects.requireNonNull(message, "message must not be null");
		expected = expected != null ? List.copyOf(expected) : List.of();
		found = found != null ? found : "";
		location = location != null ? location : Location.START;
	}

	public static Diagnostic of(DiagnosticKind kind, String message, Location location) {
		return new Diagnostic(kind, message, List.of(), "", location);
	}

	public static Diagnostic of(DiagnosticKind kind, String message, List<String> expected, String found,
			Location location) {
		return new Diagnostic(kind, message, expected, found, location);
	}

	public int line() {
		return location.line();
	}

	public int column() {
		return location.column();
	}

	/**
	 * Renders the diagnostic with the offending source line and a caret under the
	 * reported column.
	 *
	 * <pre>
	 * Syntax error at line 2, column 7: ...
	 * 2 |     A =&gt; B
	 *   |       ^
	 * </pre>
	 */
	public String render(String source) {
		StringBuilder sb = new StringBuilder(toString());
		if (source == null) {
			return sb.toString();
		}
		String[] lines = source.split("\n", -1);
		int index = location.line() - 1;
		if (index >= lines.length) {
			return sb.toString();
		}
		String gutter = location.line() + " | ";
		sb.append('\n').append(gutter).append(lines[index].replace("\r", ""));
		sb.append('\n').append(" ".repeat(gutter.length() - 2)).append("| ");
		sb.append(" ".repeat(location.column() - 1));
		int span = Math.max(1, found.length());
		sb.append("^".repeat(span));
		return sb.toString();
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		sb.append(label()).append(" at ").append(location).append(": ").append(message);
		if (!expected.isEmpty()) {
			sb.append(". Expected one of: [").append(String.join(", ", expected)).append("]");
			sb.append(", but found: '").append(found).append("'");
		}
		return sb.toString();
	}

	private String label() {
		return switch (kind) {
			case LEXICAL -> "Lexical error";
			case STRUCTURAL -> "Syntax error";
			case REFERENCE -> "Reference error";
			case UNKNOWN_STATEMENT -> "Unknown statement";
			case DUPLICATE_DECLARATION -> "Duplicate declaration";
		};
	}
}
