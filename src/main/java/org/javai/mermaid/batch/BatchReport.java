package org.javai.mermaid.batch;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.javai.mermaid.ParseOutcome;
import org.javai.mermaid.diagnostics.Diagnostic;

/**
 * Outcomes of a batch parse, keyed by source name.
 *
 * @param outcomes outcome per source name, in submission order
 * @param <D> the diagram type
 */
public record BatchReport<D>(Map<String, ParseOutcome<D>> outcomes) {

	public BatchReport {
		outcomes = outcomes != null ? Collections.unmodifiableMap(new LinkedHashMap<>(outcomes)) : Map.of();
	}

	public int successCount() {
		return (int) outcomes.values().stream().filter(ParseOutcome::isSuccess).count();
	}

	public int failureCount() {
		return outcomes.size() - successCount();
	}

	/**
	 * Total number of warnings across all successful parses.
	 */
	public int warningCount() {
		return outcomes.values().stream().mapToInt(o -> o.warnings().size()).sum();
	}

	/**
	 * Parsed diagrams by source name; failed sources are left out.
	 */
	public Map<String, D> diagrams() {
		Map<String, D> diagrams = new LinkedHashMap<>();
		outcomes.forEach((name, outcome) -> {
			if (outcome instanceof ParseOutcome.Success<D> success) {
				diagrams.put(name, success.diagram());
			}
		});
		return diagrams;
	}

	/**
	 * Fatal diagnostics by source name.
	 */
	public Map<String, Diagnostic> failures() {
		Map<String, Diagnostic> failures = new LinkedHashMap<>();
		outcomes.forEach((name, outcome) -> {
			if (outcome instanceof ParseOutcome.Failure<D> failure) {
				failures.put(name, failure.diagnostic());
			}
		});
		return failures;
	}
}
