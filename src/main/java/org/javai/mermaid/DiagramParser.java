package org.javai.mermaid;

import java.util.Set;

/**
 * Parser for one diagram grammar. Each grammar supplies its own tokenizer, parser
 * and assembler behind this single entry point.
 *
 * @param <D> the diagram type produced by the grammar
 */
public interface DiagramParser<D> {

	/**
	 * Stable identifier of the grammar, e.g. {@code flowchart}.
	 */
	String grammarId();

	/**
	 * Header keywords (first word of the first non-comment line) this grammar accepts.
	 */
	Set<String> headerKeywords();

	/**
	 * Parses the full diagram text.
	 *
	 * @param text the diagram source
	 * @return the diagram with warnings, or the fatal diagnostic
	 */
	ParseOutcome<D> parse(String text);
}
