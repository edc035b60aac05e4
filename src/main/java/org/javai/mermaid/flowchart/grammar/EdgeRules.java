package org.javai.mermaid.flowchart.grammar;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import org.javai.mermaid.ast.EdgeType;
import org.javai.mermaid.diagnostics.Diagnostic;
import org.javai.mermaid.diagnostics.DiagnosticKind;
import org.javai.mermaid.diagnostics.MermaidParseException;
import org.javai.mermaid.flowchart.FlowToken;
import org.javai.mermaid.flowchart.FlowToken.TokenType;

/**
 * Classifies line symbols and reads edge labels.
 * <p>
 * Two label forms are recognized: a pipe label after a complete link
 * ({@code -->|yes|}) and a text label between an opener and a closing link of
 * the same family ({@code -- yes -->}, {@code -. maybe .->}, {@code == sure ==>}).
 * Lines longer than their shortest form carry a length hint.
 */
public final class EdgeRules {

	private static final Pattern DOTTED = Pattern.compile("-\\.+-");

	private enum Family {
		SOLID, DOTTED, THICK
	}

	/**
	 * @param type the edge type
	 * @param minLength length hint, {@code null} for the shortest form
	 */
	public record LinkKind(EdgeType type, Integer minLength) {
	}

	private EdgeRules() {
		// Utility class - no instantiation
	}

	/**
	 * Matches an edge at {@code index}.
	 *
	 * @return the match, or empty when the token is not a link or its symbol is not a valid edge
	 * @throws MermaidParseException with a {@link DiagnosticKind#STRUCTURAL} diagnostic when a label is not closed
	 */
	public static Optional<EdgeMatch> match(List<FlowToken> tokens, int index, String source) {
		FlowToken link = tokens.get(index);
		if (!link.isType(TokenType.LINK)) {
			return Optional.empty();
		}

		Optional<LinkKind> complete = classify(link.text());
		if (complete.isPresent()) {
			return Optional.of(withPipeLabel(tokens, index, source, complete.get()));
		}

		Family family = labelOpenerFamily(link.text());
		if (family == null) {
			return Optional.empty();
		}
		return Optional.of(withTextLabel(tokens, index, source, family));
	}

	/**
	 * Classifies a complete line symbol such as {@code -->}, {@code -.->}, {@code <==>} or {@code ----x}.
	 */
	public static Optional<LinkKind> classify(String symbol) {
		if (symbol == null || symbol.isEmpty()) {
			return Optional.empty();
		}
		boolean bidirectional = symbol.charAt(0) == '<';
		String body = bidirectional ? symbol.substring(1) : symbol;
		char head = 0;
		if (!body.isEmpty()) {
			char last = body.charAt(body.length() - 1);
			if (last == '>' || last == 'o' || last == 'x') {
				head = last;
				body = body.substring(0, body.length() - 1);
			}
		}
		if (body.isEmpty()) {
			return Optional.empty();
		}
		if (bidirectional && head != '>') {
			return Optional.empty();
		}

		if (consistsOf(body, '-')) {
			return classifyPlain(body.length(), head, bidirectional, EdgeType.ARROW, EdgeType.OPEN_LINK, true);
		}
		if (consistsOf(body, '=')) {
			return classifyPlain(body.length(), head, bidirectional, EdgeType.THICK_ARROW, EdgeType.THICK_LINK, false);
		}
		if (DOTTED.matcher(body).matches()) {
			if (head == 'o' || head == 'x') {
				return Optional.empty();
			}
			int dots = body.length() - 2;
			EdgeType type = head == '>' ? (bidirectional ? EdgeType.BIDIRECTIONAL : EdgeType.DOTTED_ARROW) : EdgeType.DOTTED_LINK;
			return Optional.of(new LinkKind(type, hint(dots)));
		}
		if (consistsOf(body, '~') && head == 0 && body.length() >= 3) {
			return Optional.of(new LinkKind(EdgeType.INVISIBLE, hint(body.length() - 2)));
		}
		return Optional.empty();
	}

	private static Optional<LinkKind> classifyPlain(int length, char head, boolean bidirectional, EdgeType arrow,
			EdgeType open, boolean allowsMarkers) {
		if (head == 0) {
			if (length < 3) {
				return Optional.empty();
			}
			return Optional.of(new LinkKind(open, hint(length - 2)));
		}
		if (length < 2) {
			return Optional.empty();
		}
		EdgeType type;
		if (head == '>') {
			type = bidirectional ? EdgeType.BIDIRECTIONAL : arrow;
		} else if (!allowsMarkers) {
			return Optional.empty();
		} else {
			type = head == 'o' ? EdgeType.CIRCLE : EdgeType.CROSS;
		}
		return Optional.of(new LinkKind(type, hint(length - 1)));
	}

	private static EdgeMatch withPipeLabel(List<FlowToken> tokens, int index, String source, LinkKind kind) {
		FlowToken next = tokens.get(index + 1);
		if (!next.isType(TokenType.PIPE)) {
			return new EdgeMatch(kind.type(), null, kind.minLength(), 1);
		}
		int j = index + 2;
		while (!endOfLine(tokens.get(j))) {
			if (tokens.get(j).isType(TokenType.PIPE)) {
				String label = SourceText.between(source, tokens, index + 1, j);
				return new EdgeMatch(kind.type(), label, kind.minLength(), j - index + 1);
			}
			j++;
		}
		FlowToken found = tokens.get(j);
		throw new MermaidParseException(Diagnostic.of(DiagnosticKind.STRUCTURAL,
				"Missing '|' to close edge label opened at " + next.location(),
				List.of("|"), found.display(), found.location()));
	}

	private static EdgeMatch withTextLabel(List<FlowToken> tokens, int index, String source, Family family) {
		FlowToken opener = tokens.get(index);
		boolean bidirectional = opener.text().startsWith("<");
		int j = index + 1;
		while (!endOfLine(tokens.get(j))) {
			FlowToken candidate = tokens.get(j);
			if (candidate.isType(TokenType.LINK)) {
				Optional<LinkKind> closed = closeLabel(candidate.text(), family, bidirectional);
				if (closed.isPresent()) {
					String label = SourceText.between(source, tokens, index, j);
					LinkKind kind = closed.get();
					return new EdgeMatch(kind.type(), label, kind.minLength(), j - index + 1);
				}
			}
			j++;
		}
		FlowToken found = tokens.get(j);
		throw new MermaidParseException(Diagnostic.of(DiagnosticKind.STRUCTURAL,
				"Missing link to close the label opened by '" + opener.text() + "' at " + opener.location(),
				expectedClosers(family), found.display(), found.location()));
	}

	private static Optional<LinkKind> closeLabel(String closer, Family family, boolean bidirectional) {
		if (closer.startsWith("<")) {
			return Optional.empty();
		}
		String prefix = bidirectional ? "<" : "";
		return switch (family) {
			case SOLID -> closer.startsWith("-") && !closer.contains(".")
					? classify(prefix + closer) : Optional.empty();
			case THICK -> closer.startsWith("=") ? classify(prefix + closer) : Optional.empty();
			case DOTTED -> closer.startsWith(".") ? classify(prefix + "-" + closer) : Optional.empty();
		};
	}

	private static Family labelOpenerFamily(String symbol) {
		String body = symbol.startsWith("<") ? symbol.substring(1) : symbol;
		return switch (body) {
			case "--" -> Family.SOLID;
			case "-." -> Family.DOTTED;
			case "==" -> Family.THICK;
			default -> null;
		};
	}

	private static List<String> expectedClosers(Family family) {
		return switch (family) {
			case SOLID -> List.of("-->", "---", "--o", "--x");
			case DOTTED -> List.of(".->", ".-");
			case THICK -> List.of("==>", "===");
		};
	}

	// Only lines longer than the shortest form carry a hint.
	private static Integer hint(int length) {
		return length > 1 ? length : null;
	}

	private static boolean consistsOf(String text, char c) {
		for (int i = 0; i < text.length(); i++) {
			if (text.charAt(i) != c) {
				return false;
			}
		}
		return true;
	}

	private static boolean endOfLine(FlowToken token) {
		return token.isType(TokenType.NEWLINE) || token.isType(TokenType.EOF);
	}
}
