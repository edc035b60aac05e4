package org.javai.mermaid.flowchart;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.javai.mermaid.diagnostics.Diagnostic;
import org.javai.mermaid.diagnostics.DiagnosticKind;
import org.javai.mermaid.diagnostics.Location;
import org.javai.mermaid.diagnostics.MermaidParseException;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.MarkedYAMLException;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads the optional YAML block delimited by {@code ---} lines at the top of a
 * diagram.
 *
 * <pre>
 * ---
 * title: Order flow
 * ---
 * flowchart LR
 * </pre>
 *
 * The block's lines are blanked rather than removed so that locations reported
 * for the diagram body still match the original text.
 */
public final class FrontMatter {

	private static final String DELIMITER = "---";

	/**
	 * @param title the {@code title} entry, or {@code null}
	 * @param body the diagram text with the front matter lines blanked
	 */
	public record Split(String title, String body) {
	}

	private FrontMatter() {
		// Utility class - no instantiation
	}

	/**
	 * Separates the front matter from the diagram body.
	 *
	 * @throws MermaidParseException with a {@link DiagnosticKind#STRUCTURAL} diagnostic when the block is
	 *         not closed or is not valid YAML
	 */
	public static Split split(String text) {
		String[] lines = text.split("\n", -1);
		if (!isDelimiter(lines[0])) {
			return new Split(null, text);
		}
		int closing = closingLine(lines);
		if (closing < 0) {
			throw new MermaidParseException(Diagnostic.of(DiagnosticKind.STRUCTURAL,
					"Front matter is not closed", List.of(DELIMITER), "<end of input>", Location.START));
		}

		String yaml = String.join("\n", Arrays.copyOfRange(lines, 1, closing));
		Object document;
		try {
			document = new Yaml().load(yaml);
		} catch (MarkedYAMLException e) {
			int line = e.getProblemMark() != null ? e.getProblemMark().getLine() + 2 : 2;
			throw new MermaidParseException(Diagnostic.of(DiagnosticKind.STRUCTURAL,
					"Invalid front matter: " + e.getProblem(), new Location(line, 1)), e);
		} catch (YAMLException e) {
			throw new MermaidParseException(Diagnostic.of(DiagnosticKind.STRUCTURAL,
					"Invalid front matter: " + e.getMessage(), new Location(2, 1)), e);
		}

		String title = null;
		if (document instanceof Map<?, ?> map && map.get("title") != null) {
			title = map.get("title").toString();
		}
		return new Split(title, blank(lines, closing));
	}

	/**
	 * The text with a well-formed front matter block blanked out, without reading
	 * the YAML. Text without a closed block is returned unchanged.
	 */
	public static String skip(String text) {
		String[] lines = text.split("\n", -1);
		if (!isDelimiter(lines[0])) {
			return text;
		}
		int closing = closingLine(lines);
		return closing < 0 ? text : blank(lines, closing);
	}

	private static int closingLine(String[] lines) {
		for (int i = 1; i < lines.length; i++) {
			if (isDelimiter(lines[i])) {
				return i;
			}
		}
		return -1;
	}

	private static String blank(String[] lines, int closing) {
		String[] body = lines.clone();
		for (int i = 0; i <= closing; i++) {
			body[i] = "";
		}
		return String.join("\n", body);
	}

	private static boolean isDelimiter(String line) {
		return line.strip().equals(DELIMITER);
	}
}
