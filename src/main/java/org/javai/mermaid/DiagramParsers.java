package org.javai.mermaid;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.javai.mermaid.config.ParserPolicy;
import org.javai.mermaid.config.ParserPolicyLoader;
import org.javai.mermaid.diagnostics.Diagnostic;
import org.javai.mermaid.diagnostics.DiagnosticKind;
import org.javai.mermaid.diagnostics.Location;
import org.javai.mermaid.flowchart.FlowchartParser;
import org.javai.mermaid.flowchart.FrontMatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registry of diagram parsers keyed by header keyword.
 * <p>
 * The keyword is the first word of the first line that is neither blank nor a
 * {@code %%} comment, after any front matter. Keywords are matched without regard
 * to case. The first parser registered for a keyword wins; later registrations
 * for the same keyword are ignored. Populate the registry before sharing it
 * between threads.
 */
public final class DiagramParsers {

	private static final Logger logger = LoggerFactory.getLogger(DiagramParsers.class);

	private final Map<String, DiagramParser<?>> parsers = new LinkedHashMap<>();

	private record Header(String keyword, Location location) {
	}

	private DiagramParsers() {
	}

	/**
	 * An empty registry.
	 */
	public static DiagramParsers create() {
		return new DiagramParsers();
	}

	/**
	 * A registry holding the built-in grammars configured with {@code policy}.
	 */
	public static DiagramParsers withDefaults(ParserPolicy policy) {
		return create().register(new FlowchartParser(policy));
	}

	/**
	 * A registry holding the built-in grammars configured from
	 * {@link ParserPolicyLoader#DEFAULT_RESOURCE} on the given class loader.
	 */
	public static DiagramParsers fromClasspath(ClassLoader loader) {
		Objects.requireNonNull(loader, "loader must not be null");
		return withDefaults(new ParserPolicyLoader().loadDefault(loader));
	}

	/**
	 * Registers a parser under each of its header keywords.
	 */
	public DiagramParsers register(DiagramParser<?> parser) {
		Objects.requireNonNull(parser, "parser must not be null");
		if (parser.headerKeywords() == null || parser.headerKeywords().isEmpty()) {
			throw new IllegalArgumentException("Parser '" + parser.grammarId() + "' declares no header keywords");
		}
		for (String keyword : parser.headerKeywords()) {
			String key = keyword.toLowerCase(Locale.ROOT);
			DiagramParser<?> existing = parsers.get(key);
			if (existing != null) {
				logger.debug("Keyword '{}' already registered to grammar '{}'; skipping '{}'",
						key, existing.grammarId(), parser.grammarId());
				continue;
			}
			parsers.put(key, parser);
		}
		return this;
	}

	public Optional<DiagramParser<?>> parserFor(String keyword) {
		if (keyword == null) {
			return Optional.empty();
		}
		return Optional.ofNullable(parsers.get(keyword.toLowerCase(Locale.ROOT)));
	}

	/**
	 * Registered keywords in registration order.
	 */
	public List<String> keywords() {
		return new ArrayList<>(parsers.keySet());
	}

	/**
	 * Detects the diagram type of {@code text}.
	 *
	 * @return the lower-cased header keyword, or empty when the text has no content line
	 */
	public static Optional<String> detect(String text) {
		return header(text).map(Header::keyword);
	}

	/**
	 * Parses {@code text} with the parser registered for its header keyword.
	 *
	 * @return the parser's outcome, or a structural failure when the text is empty
	 *         or its keyword is not registered
	 */
	public ParseOutcome<?> parse(String text) {
		Optional<Header> header = header(text);
		if (header.isEmpty()) {
			return new ParseOutcome.Failure<>(Diagnostic.of(DiagnosticKind.STRUCTURAL,
					"Empty diagram", keywords(), "<end of input>", Location.START));
		}
		DiagramParser<?> parser = parsers.get(header.get().keyword());
		if (parser == null) {
			logger.debug("No parser registered for '{}'", header.get().keyword());
			return new ParseOutcome.Failure<>(Diagnostic.of(DiagnosticKind.STRUCTURAL,
					"Unknown diagram type '" + header.get().keyword() + "'",
					keywords(), header.get().keyword(), header.get().location()));
		}
		return parser.parse(text);
	}

	private static Optional<Header> header(String text) {
		if (text == null) {
			return Optional.empty();
		}
		String[] lines = FrontMatter.skip(text).split("\n", -1);
		for (int i = 0; i < lines.length; i++) {
			String line = lines[i];
			String trimmed = line.strip();
			if (trimmed.isEmpty() || trimmed.startsWith("%%")) {
				continue;
			}
			String word = trimmed.split("\\s+", 2)[0];
			while (word.endsWith(";") || word.endsWith(":")) {
				word = word.substring(0, word.length() - 1);
			}
			int column = line.indexOf(trimmed.charAt(0)) + 1;
			return Optional.of(new Header(word.toLowerCase(Locale.ROOT), new Location(i + 1, column)));
		}
		return Optional.empty();
	}
}
