package org.javai.mermaid;

import java.util.List;
import java.util.Objects;
import org.javai.mermaid.diagnostics.Diagnostic;
import org.javai.mermaid.diagnostics.MermaidParseException;

/**
 * Result of parsing one diagram: either the assembled diagram together with any
 * recoverable warnings, or the fatal diagnostic that stopped the parse.
 *
 * @param <D> the diagram type produced by the grammar
 */
public sealed interface ParseOutcome<D> {

	/**
	 * @param diagram the assembled diagram
	 * @param warnings recoverable problems collected along the way, in source order
	 */
	record Success<D>(D diagram, List<Diagnostic> warnings) implements ParseOutcome<D> {
		public Success {
			Objects.requireNonNull(diagram, "diagram must not be null");
			warnings = warnings != null ? List.copyOf(warnings) : List.of();
		}

		public boolean hasWarnings() {
			return !warnings.isEmpty();
		}
	}

	/**
	 * @param diagnostic the fatal problem
	 */
	record Failure<D>(Diagnostic diagnostic) implements ParseOutcome<D> {
		public Failure {
			Objects.requireNonNull(diagnostic, "diagnostic must not be null");
		}
	}

	default boolean isSuccess() {
		return this instanceof Success;
	}

	/**
	 * Returns the diagram or throws the failure as a {@link MermaidParseException}.
	 */
	default D orElseThrow() {
		if (this instanceof Success<D> success) {
			return success.diagram();
		}
		throw new MermaidParseException(((Failure<D>) this).diagnostic());
	}

	/**
	 * Warnings of a successful parse, or an empty list for a failure.
	 */
	default List<Diagnostic> warnings() {
		if (this instanceof Success<D> success) {
			return success.warnings();
		}
		return List.of();
	}
}
