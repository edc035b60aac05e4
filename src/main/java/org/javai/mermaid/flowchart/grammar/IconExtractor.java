package org.javai.mermaid.flowchart.grammar;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lifts Font Awesome references ({@code fa:fa-car}, {@code fab:fa-github}) out of node text.
 */
public final class IconExtractor {

	private static final Pattern ICON = Pattern.compile("\\bfa[bklrs]?:fa-[A-Za-z0-9-]+");

	/**
	 * @param icon the first icon reference, or {@code null}
	 * @param text the remaining text, or {@code null} when nothing is left
	 */
	public record Extraction(String icon, String text) {
	}

	private IconExtractor() {
		// Utility class - no instantiation
	}

	public static Extraction extract(String text) {
		if (text == null) {
			return new Extraction(null, null);
		}
		Matcher matcher = ICON.matcher(text);
		if (!matcher.find()) {
			return new Extraction(null, text);
		}
		String icon = matcher.group();
		String remaining = SourceText.collapse(ICON.matcher(text).replaceAll(" "));
		return new Extraction(icon, remaining);
	}
}
