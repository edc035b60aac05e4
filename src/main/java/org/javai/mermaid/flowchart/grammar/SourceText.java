package org.javai.mermaid.flowchart.grammar;

import java.util.List;
import org.javai.mermaid.flowchart.FlowToken;
import org.javai.mermaid.flowchart.FlowToken.TokenType;

/**
 * Recovers free text (labels, titles, directive arguments) from the source span
 * covered by a run of tokens.
 */
public final class SourceText {

	private SourceText() {
		// Utility class - no instantiation
	}

	/**
	 * Text between the end of token {@code afterIndex} and the start of token
	 * {@code beforeIndex}, with whitespace runs collapsed to single spaces and
	 * trimmed. A span holding exactly one quoted string yields the string's value.
	 *
	 * @return the text, or {@code null} when the span is blank
	 */
	public static String between(String source, List<FlowToken> tokens, int afterIndex, int beforeIndex) {
		if (beforeIndex == afterIndex + 2 && tokens.get(afterIndex + 1).isType(TokenType.STRING)) {
			return tokens.get(afterIndex + 1).text();
		}
		int from = tokens.get(afterIndex).end();
		int to = tokens.get(beforeIndex).start();
		return collapse(source.substring(from, Math.max(from, to)));
	}

	/**
	 * Source text from the start of token {@code fromIndex} up to the start of token
	 * {@code toIndex}, collapsed.
	 *
	 * @return the text, or {@code null} when the span is blank
	 */
	public static String span(String source, List<FlowToken> tokens, int fromIndex, int toIndex) {
		if (toIndex == fromIndex + 1 && tokens.get(fromIndex).isType(TokenType.STRING)) {
			return tokens.get(fromIndex).text();
		}
		int from = tokens.get(fromIndex).start();
		int to = tokens.get(toIndex).start();
		return collapse(source.substring(from, Math.max(from, to)));
	}

	/**
	 * Collapses whitespace runs to single spaces and trims.
	 *
	 * @return the collapsed text, or {@code null} when blank
	 */
	public static String collapse(String raw) {
		if (raw == null) {
			return null;
		}
		String collapsed = raw.replaceAll("\\s+", " ").trim();
		return collapsed.isEmpty() ? null : collapsed;
	}

	/**
	 * Strips one pair of surrounding double quotes, if present.
	 */
	public static String unquote(String text) {
		if (text != null && text.length() >= 2 && text.startsWith("\"") && text.endsWith("\"")) {
			return text.substring(1, text.length() - 1);
		}
		return text;
	}
}
