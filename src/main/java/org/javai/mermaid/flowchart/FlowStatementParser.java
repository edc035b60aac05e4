package org.javai.mermaid.flowchart;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.javai.mermaid.ast.ClickBinding;
import org.javai.mermaid.ast.Edge;
import org.javai.mermaid.ast.FlowDirection;
import org.javai.mermaid.ast.Node;
import org.javai.mermaid.config.ParserPolicy;
import org.javai.mermaid.diagnostics.Diagnostic;
import org.javai.mermaid.diagnostics.DiagnosticKind;
import org.javai.mermaid.diagnostics.Location;
import org.javai.mermaid.diagnostics.MermaidParseException;
import org.javai.mermaid.flowchart.FlowToken.TokenType;
import org.javai.mermaid.flowchart.directive.Directive;
import org.javai.mermaid.flowchart.grammar.EdgeMatch;
import org.javai.mermaid.flowchart.grammar.EdgeRules;
import org.javai.mermaid.flowchart.grammar.ShapeMatch;
import org.javai.mermaid.flowchart.grammar.ShapeRules;
import org.javai.mermaid.flowchart.grammar.SourceText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Statement parser for flowcharts.
 * <p>
 * Reads one statement per line (or per {@code ;}) with an explicit stack of open
 * subgraph frames, so nesting depth is bounded only by the heap. Node and edge
 * statements are read completely before anything is recorded; a statement that
 * goes off the rails is reported as a warning and skipped without leaving
 * partial nodes behind. Style, class and click lines are queued as
 * {@link Directive}s for the {@link TreeAssembler}.
 * <p>
 * Lexical and bracket errors abort the parse with a {@link MermaidParseException}.
 */
public class FlowStatementParser {

	private static final Logger logger = LoggerFactory.getLogger(FlowStatementParser.class);

	static final Set<String> HEADER_KEYWORDS = Set.of("flowchart", "graph");

	static final Set<String> KEYWORDS = Set.of(
			"subgraph", "end", "direction", "style", "classDef", "class", "click", "linkStyle", "accTitle", "accDescr");

	private static final List<String> DIRECTION_CODES = Arrays.stream(FlowDirection.values()).map(Enum::name).toList();

	private static final List<String> EDGE_SYMBOLS = List.of(
			"-->", "---", "-.->", "-.-", "==>", "===", "~~~", "--o", "--x", "<-->");

	/**
	 * A recoverable problem inside one statement. Caught by the statement loop,
	 * recorded as a warning, and the rest of the line is skipped.
	 */
	private static final class StatementDeviation extends RuntimeException {
		private final Diagnostic diagnostic;

		StatementDeviation(Diagnostic diagnostic) {
			super(diagnostic.message(), null, false, false);
			this.diagnostic = diagnostic;
		}
	}

	private record NodeRef(String id, ShapeMatch shape, String className, Location location) {
	}

	private final String source;
	private final List<FlowToken> tokens;
	private final ParserPolicy policy;
	private final ParseFragments fragments = new ParseFragments();
	private final Deque<String> frames = new ArrayDeque<>();
	private final Map<String, Location> explicitDeclarations = new HashMap<>();
	private int current = 0;

	public FlowStatementParser(String source, List<FlowToken> tokens, ParserPolicy policy) {
		this.source = source != null ? source : "";
		this.tokens = tokens != null ? tokens : List.of();
		this.policy = policy != null ? policy : ParserPolicy.defaults();
		if (this.tokens.isEmpty() || !this.tokens.get(this.tokens.size() - 1).isType(TokenType.EOF)) {
			throw new IllegalArgumentException("Token list must end with EOF");
		}
	}

	/**
	 * Parses the header and every statement.
	 *
	 * @return the collected fragments, ready for assembly
	 * @throws MermaidParseException on a missing header, a bracket mismatch or an unclosed subgraph
	 */
	public ParseFragments parse() {
		skipTerminators();
		parseHeader();

		while (!isAtEnd()) {
			if (peek().isTerminator()) {
				advance();
				continue;
			}
			parseStatement();
		}

		if (!frames.isEmpty()) {
			SubgraphArena.Entry outermost = fragments.arena().get(frames.peekLast());
			throw new MermaidParseException(Diagnostic.of(DiagnosticKind.STRUCTURAL,
					"Subgraph '" + outermost.id() + "' is never closed",
					List.of("end"), peek().display(), outermost.openedAt()));
		}

		logger.debug("Parsed flowchart: {} nodes, {} edges, {} subgraphs, {} directives, {} warnings",
				fragments.nodes().size(), fragments.edges().size(), fragments.arena().entries().size(),
				fragments.directives().size(), fragments.warnings().size());
		return fragments;
	}

	private void parseHeader() {
		FlowToken header = peek();
		if (header.isType(TokenType.EOF)) {
			throw new MermaidParseException(Diagnostic.of(DiagnosticKind.STRUCTURAL,
					"Empty diagram", sorted(HEADER_KEYWORDS), header.display(), header.location()));
		}
		if (!header.isType(TokenType.IDENTIFIER) || !HEADER_KEYWORDS.contains(header.text())) {
			throw new MermaidParseException(Diagnostic.of(DiagnosticKind.STRUCTURAL,
					"Diagram must start with a flowchart header",
					sorted(HEADER_KEYWORDS), header.display(), header.location()));
		}
		advance();

		if (check(TokenType.IDENTIFIER)) {
			FlowToken code = advance();
			fragments.setDirection(FlowDirection.fromCode(code.text())
					.orElseThrow(() -> new MermaidParseException(Diagnostic.of(DiagnosticKind.STRUCTURAL,
							"Unknown direction '" + code.text() + "'", DIRECTION_CODES, code.display(),
							code.location()))));
		}
		if (!peek().isTerminator()) {
			FlowToken unexpected = peek();
			throw new MermaidParseException(Diagnostic.of(DiagnosticKind.STRUCTURAL,
					"Unexpected '" + unexpected.display() + "' after the diagram header",
					List.of("<newline>", ";"), unexpected.display(), unexpected.location()));
		}
	}

	private void parseStatement() {
		FlowToken first = peek();
		try {
			if (first.isType(TokenType.IDENTIFIER) && isKeywordPosition()) {
				parseKeywordStatement(first);
			} else if (first.isType(TokenType.IDENTIFIER)) {
				parseNodeStatement();
			} else {
				throw deviation(DiagnosticKind.UNKNOWN_STATEMENT, "Unrecognized statement", List.of(), first);
			}
		} catch (StatementDeviation e) {
			logger.debug("Skipping statement at {}: {}", first.location(), e.getMessage());
			fragments.warn(e.diagnostic);
			skipToTerminator();
		}
	}

	/**
	 * A keyword only acts as one at the start of a statement and when it is not
	 * being used as a node id, that is, not followed by a shape, a link, {@code &} or {@code :::}.
	 */
	private boolean isKeywordPosition() {
		FlowToken word = peek();
		if (!KEYWORDS.contains(word.text())) {
			return false;
		}
		FlowToken next = peekAt(1);
		if (word.isIdentifier("accDescr") && next.isType(TokenType.LEFT_BRACE)) {
			return true;
		}
		return !(ShapeRules.isOpener(next)
				|| next.isType(TokenType.LINK)
				|| next.isType(TokenType.AMPERSAND)
				|| next.isType(TokenType.TRIPLE_COLON));
	}

	private void parseKeywordStatement(FlowToken keyword) {
		switch (keyword.text()) {
			case "subgraph" -> parseSubgraph();
			case "end" -> parseEnd();
			case "direction" -> parseDirection();
			case "style" -> parseStyle();
			case "classDef" -> parseClassDef();
			case "class" -> parseClass();
			case "click" -> parseClick();
			case "linkStyle" -> parseLinkStyle();
			case "accTitle" -> parseAccTitle();
			case "accDescr" -> parseAccDescr();
			default -> throw new IllegalStateException("Unhandled keyword: " + keyword.text());
		}
	}

	// ---------------------------------------------------------------------
	// Nodes and edges
	// ---------------------------------------------------------------------

	private void parseNodeStatement() {
		List<List<NodeRef>> groups = new ArrayList<>();
		List<EdgeMatch> links = new ArrayList<>();

		groups.add(parseGroup());
		while (check(TokenType.LINK)) {
			FlowToken link = peek();
			EdgeMatch edge = EdgeRules.match(tokens, current, source)
					.orElseThrow(() -> deviation(DiagnosticKind.UNKNOWN_STATEMENT,
							"Unknown link '" + link.text() + "'", EDGE_SYMBOLS, link));
			current += edge.consumed();
			links.add(edge);
			groups.add(parseGroup());
		}
		expectTerminator("the node statement");

		for (List<NodeRef> group : groups) {
			for (NodeRef ref : group) {
				declareNode(ref);
			}
		}
		for (int i = 0; i < links.size(); i++) {
			EdgeMatch link = links.get(i);
			for (NodeRef from : groups.get(i)) {
				for (NodeRef to : groups.get(i + 1)) {
					addEdge(new Edge(from.id(), to.id(), link.type(), link.label(), link.minLength()));
				}
			}
		}
	}

	private List<NodeRef> parseGroup() {
		List<NodeRef> group = new ArrayList<>();
		group.add(parseNodeRef());
		while (check(TokenType.AMPERSAND)) {
			advance();
			group.add(parseNodeRef());
		}
		return group;
	}

	private NodeRef parseNodeRef() {
		FlowToken idToken = peek();
		if (!idToken.isType(TokenType.IDENTIFIER)) {
			throw deviation(DiagnosticKind.UNKNOWN_STATEMENT, "Expected a node id", List.of("node id"), idToken);
		}
		advance();

		ShapeMatch shape = null;
		Optional<ShapeMatch> match = ShapeRules.match(tokens, current, source, policy.extractIcons());
		if (match.isPresent()) {
			shape = match.get();
			current += shape.consumed();
		}

		String className = null;
		if (check(TokenType.TRIPLE_COLON)) {
			advance();
			FlowToken cls = peek();
			if (!cls.isType(TokenType.IDENTIFIER)) {
				throw deviation(DiagnosticKind.UNKNOWN_STATEMENT, "Expected a class name after ':::'",
						List.of("class name"), cls);
			}
			advance();
			className = cls.text();
		}
		return new NodeRef(idToken.text(), shape, className, idToken.location());
	}

	private void declareNode(NodeRef ref) {
		String id = ref.id();
		boolean subgraphId = fragments.arena().contains(id);
		Map<String, Node> nodes = fragments.nodes();

		if (ref.shape() != null) {
			ShapeMatch shape = ref.shape();
			Node declared = new Node(id, shape.text(), shape.shape(), List.of(), shape.icon(), Map.of());
			Location first = explicitDeclarations.get(id);
			if (first == null) {
				nodes.put(id, declared);
				explicitDeclarations.put(id, ref.location());
			} else if (!nodes.get(id).equals(declared)) {
				fragments.warn(Diagnostic.of(DiagnosticKind.DUPLICATE_DECLARATION,
						"Node '" + id + "' was already declared at " + first + "; keeping the first declaration",
						ref.location()));
			}
		} else if (!nodes.containsKey(id) && !subgraphId) {
			nodes.put(id, Node.stub(id));
		}

		if (ref.className() != null) {
			fragments.addDirective(new Directive.ClassDirective(List.of(id), ref.className(), ref.location()));
		}
		if (!frames.isEmpty() && !subgraphId) {
			fragments.arena().get(frames.peek()).addNode(id);
		}
	}

	private void addEdge(Edge edge) {
		int index = fragments.addEdge(edge);
		if (!frames.isEmpty()) {
			fragments.arena().get(frames.peek()).addEdge(index);
		}
	}

	// ---------------------------------------------------------------------
	// Subgraphs
	// ---------------------------------------------------------------------

	private void parseSubgraph() {
		FlowToken keyword = advance();
		FlowToken first = peek();
		String id;
		String title;

		if (first.isTerminator()) {
			throw deviation(DiagnosticKind.UNKNOWN_STATEMENT, "Subgraph needs an id or a title",
					List.of("subgraph id", "title"), first);
		}
		if (first.isType(TokenType.STRING) && peekAt(1).isTerminator()) {
			advance();
			id = first.text();
			title = first.text();
		} else if (first.isType(TokenType.IDENTIFIER) && peekAt(1).isTerminator()) {
			advance();
			id = first.text();
			title = null;
		} else if (first.isType(TokenType.IDENTIFIER) && ShapeRules.isOpener(peekAt(1))) {
			advance();
			id = first.text();
			ShapeMatch bracket = ShapeRules.match(tokens, current, source, false).orElseThrow();
			current += bracket.consumed();
			title = bracket.text();
			expectTerminator("a subgraph title");
		} else {
			int start = current;
			skipToTerminator();
			title = SourceText.collapse(rawSpan(start, current));
			id = title;
		}

		String parent = frames.peek();
		fragments.arena().open(id, title, parent, keyword.location());
		frames.push(id);
	}

	private void parseEnd() {
		FlowToken keyword = advance();
		expectTerminator("'end'");
		if (frames.isEmpty()) {
			throw deviation(DiagnosticKind.UNKNOWN_STATEMENT, "'end' without an open subgraph", List.of(), keyword);
		}
		frames.pop();
	}

	private void parseDirection() {
		advance();
		FlowToken code = peek();
		Optional<FlowDirection> direction = code.isType(TokenType.IDENTIFIER)
				? FlowDirection.fromCode(code.text())
				: Optional.empty();
		if (direction.isEmpty()) {
			throw deviation(DiagnosticKind.UNKNOWN_STATEMENT, "Unknown direction", DIRECTION_CODES, code);
		}
		advance();
		expectTerminator("a direction");
		if (frames.isEmpty()) {
			fragments.setDirection(direction.get());
		} else {
			fragments.arena().get(frames.peek()).setDirection(direction.get());
		}
	}

	// ---------------------------------------------------------------------
	// Directives
	// ---------------------------------------------------------------------

	private void parseStyle() {
		FlowToken keyword = advance();
		FlowToken target = expectIdentifier("node or subgraph id", keyword);
		Map<String, String> properties = parseProperties(keyword);
		fragments.addDirective(new Directive.StyleDirective(target.text(), properties, target.location()));
	}

	private void parseClassDef() {
		FlowToken keyword = advance();
		List<String> names = parseIdList("class name", keyword);
		Map<String, String> properties = parseProperties(keyword);
		fragments.addDirective(new Directive.ClassDefDirective(names, properties, keyword.location()));
	}

	private void parseClass() {
		FlowToken keyword = advance();
		List<String> nodeIds = parseIdList("node id", keyword);
		FlowToken className = expectIdentifier("class name", keyword);
		expectTerminator("a class name");
		fragments.addDirective(new Directive.ClassDirective(nodeIds, className.text(), keyword.location()));
	}

	private void parseLinkStyle() {
		FlowToken keyword = advance();
		List<Integer> indices = new ArrayList<>();
		boolean allEdges = false;
		if (peek().isIdentifier("default")) {
			advance();
			allEdges = true;
		} else {
			for (String index : parseIdList("edge index", keyword)) {
				try {
					indices.add(Integer.parseInt(index));
				} catch (NumberFormatException e) {
					throw deviation(DiagnosticKind.UNKNOWN_STATEMENT, "Edge index '" + index + "' is not a number",
							List.of("edge index", "default"), keyword);
				}
			}
		}
		Map<String, String> properties = parseProperties(keyword);
		fragments.addDirective(new Directive.LinkStyleDirective(indices, allEdges, properties, keyword.location()));
	}

	private void parseClick() {
		FlowToken keyword = advance();
		FlowToken node = expectIdentifier("node id", keyword);
		ClickBinding.Link link = null;
		ClickBinding.Callback callback = null;
		String tooltip;

		FlowToken action = peek();
		if (action.isType(TokenType.STRING)) {
			advance();
			tooltip = optionalString();
			link = new ClickBinding.Link(action.text(), optionalTarget());
		} else if (action.isIdentifier("href")) {
			advance();
			FlowToken url = peek();
			if (!url.isType(TokenType.STRING)) {
				throw deviation(DiagnosticKind.UNKNOWN_STATEMENT, "Expected a quoted url after 'href'",
						List.of("\"url\""), url);
			}
			advance();
			tooltip = optionalString();
			link = new ClickBinding.Link(url.text(), optionalTarget());
		} else if (action.isIdentifier("call")) {
			advance();
			FlowToken name = expectIdentifier("callback name", keyword);
			callback = new ClickBinding.Callback(name.text(), callArguments());
			tooltip = optionalString();
		} else if (action.isType(TokenType.IDENTIFIER)) {
			advance();
			callback = new ClickBinding.Callback(action.text(), null);
			tooltip = optionalString();
		} else {
			throw deviation(DiagnosticKind.UNKNOWN_STATEMENT, "Expected a callback or a link",
					List.of("callback", "call", "href", "\"url\""), action);
		}
		expectTerminator("a click binding");
		fragments.addDirective(new Directive.ClickDirective(node.text(), link, callback, tooltip, node.location()));
	}

	private String callArguments() {
		if (!check(TokenType.LEFT_PAREN)) {
			return null;
		}
		int open = current;
		advance();
		while (!check(TokenType.RIGHT_PAREN)) {
			if (peek().isTerminator()) {
				throw deviation(DiagnosticKind.UNKNOWN_STATEMENT, "Missing ')' after callback arguments",
						List.of(")"), peek());
			}
			advance();
		}
		String arguments = SourceText.between(source, tokens, open, current);
		advance();
		return arguments;
	}

	private String optionalString() {
		if (check(TokenType.STRING)) {
			return advance().text();
		}
		return null;
	}

	private String optionalTarget() {
		if (check(TokenType.IDENTIFIER) && peek().text().startsWith("_")) {
			return advance().text();
		}
		return null;
	}

	private void parseAccTitle() {
		FlowToken keyword = advance();
		if (!check(TokenType.COLON)) {
			throw deviation(DiagnosticKind.UNKNOWN_STATEMENT, "Expected ':' after 'accTitle'", List.of(":"), peek());
		}
		advance();
		String title = restOfLine(keyword);
		fragments.setAccessibility(fragments.accessibility().withTitle(title));
	}

	private void parseAccDescr() {
		FlowToken keyword = advance();
		if (check(TokenType.COLON)) {
			advance();
			String description = restOfLine(keyword);
			fragments.setAccessibility(fragments.accessibility().withDescription(description));
			return;
		}
		if (!check(TokenType.LEFT_BRACE)) {
			throw deviation(DiagnosticKind.UNKNOWN_STATEMENT, "Expected ':' or '{' after 'accDescr'",
					List.of(":", "{"), peek());
		}
		FlowToken open = advance();
		while (!check(TokenType.RIGHT_BRACE)) {
			if (isAtEnd()) {
				throw new MermaidParseException(Diagnostic.of(DiagnosticKind.STRUCTURAL,
						"Missing '}' to close the description opened at " + open.location(),
						List.of("}"), peek().display(), peek().location()));
			}
			advance();
		}
		FlowToken close = advance();
		String description = blockText(source.substring(open.end(), close.start()));
		expectTerminator("'}'");
		fragments.setAccessibility(fragments.accessibility().withDescription(description));
	}

	/**
	 * Identifiers separated by commas, e.g. {@code A,B,C}.
	 */
	private List<String> parseIdList(String what, FlowToken keyword) {
		List<String> ids = new ArrayList<>();
		ids.add(expectIdentifier(what, keyword).text());
		while (check(TokenType.COMMA)) {
			advance();
			ids.add(expectIdentifier(what, keyword).text());
		}
		return ids;
	}

	/**
	 * Reads {@code key:value,key:value} up to the end of the statement. Commas
	 * inside parentheses, as in {@code rgb(1,2,3)}, do not split.
	 */
	private Map<String, String> parseProperties(FlowToken keyword) {
		int start = current;
		skipToTerminator();
		if (start == current) {
			throw deviation(DiagnosticKind.UNKNOWN_STATEMENT,
					"'" + keyword.text() + "' needs style properties", List.of("property:value"), peek());
		}
		String raw = rawSpan(start, current);
		Map<String, String> properties = new LinkedHashMap<>();
		for (String item : splitTopLevel(raw)) {
			String trimmed = item.trim();
			if (trimmed.isEmpty()) {
				continue;
			}
			int colon = trimmed.indexOf(':');
			if (colon <= 0) {
				throw deviation(DiagnosticKind.UNKNOWN_STATEMENT, "Malformed style property '" + trimmed + "'",
						List.of("property:value"), tokens.get(start));
			}
			properties.put(trimmed.substring(0, colon).trim(), trimmed.substring(colon + 1).trim());
		}
		return properties;
	}

	private static List<String> splitTopLevel(String raw) {
		List<String> items = new ArrayList<>();
		int depth = 0;
		int from = 0;
		for (int i = 0; i < raw.length(); i++) {
			char c = raw.charAt(i);
			if (c == '(') {
				depth++;
			} else if (c == ')') {
				depth = Math.max(0, depth - 1);
			} else if (c == ',' && depth == 0) {
				items.add(raw.substring(from, i));
				from = i + 1;
			}
		}
		items.add(raw.substring(from));
		return items;
	}

	private String restOfLine(FlowToken keyword) {
		int start = current;
		skipToTerminator();
		if (start == current) {
			throw deviation(DiagnosticKind.UNKNOWN_STATEMENT, "'" + keyword.text() + "' needs text",
					List.of("text"), peek());
		}
		if (current == start + 1 && tokens.get(start).isType(TokenType.STRING)) {
			return tokens.get(start).text();
		}
		return SourceText.collapse(rawSpan(start, current));
	}

	private static String blockText(String raw) {
		List<String> lines = new ArrayList<>();
		for (String line : raw.split("\n")) {
			String trimmed = line.trim();
			if (!trimmed.isEmpty()) {
				lines.add(trimmed);
			}
		}
		return lines.isEmpty() ? null : String.join("\n", lines);
	}

	// ---------------------------------------------------------------------
	// Token helpers
	// ---------------------------------------------------------------------

	/**
	 * Source text from the start of token {@code from} to the end of token {@code toExclusive - 1},
	 * so trailing comments are not included.
	 */
	private String rawSpan(int from, int toExclusive) {
		return source.substring(tokens.get(from).start(), tokens.get(toExclusive - 1).end());
	}

	private FlowToken expectIdentifier(String what, FlowToken keyword) {
		FlowToken token = peek();
		if (!token.isType(TokenType.IDENTIFIER)) {
			throw deviation(DiagnosticKind.UNKNOWN_STATEMENT,
					"Expected " + what + " in '" + keyword.text() + "' statement", List.of(what), token);
		}
		return advance();
	}

	private void expectTerminator(String after) {
		FlowToken token = peek();
		if (!token.isTerminator()) {
			throw deviation(DiagnosticKind.UNKNOWN_STATEMENT, "Unexpected '" + token.display() + "' after " + after,
					List.of("<newline>", ";"), token);
		}
	}

	private static StatementDeviation deviation(DiagnosticKind kind, String message, List<String> expected,
			FlowToken found) {
		return new StatementDeviation(Diagnostic.of(kind, message, expected, found.display(), found.location()));
	}

	private static List<String> sorted(Set<String> values) {
		return values.stream().sorted().toList();
	}

	private void skipTerminators() {
		while (!isAtEnd() && peek().isTerminator()) {
			advance();
		}
	}

	private void skipToTerminator() {
		while (!peek().isTerminator()) {
			advance();
		}
	}

	private FlowToken peek() {
		return tokens.get(current);
	}

	private FlowToken peekAt(int offset) {
		int index = Math.min(current + offset, tokens.size() - 1);
		return tokens.get(index);
	}

	private FlowToken advance() {
		if (!isAtEnd()) {
			current++;
		}
		return tokens.get(current - 1);
	}

	private boolean check(TokenType type) {
		return peek().type() == type;
	}

	private boolean isAtEnd() {
		return peek().isType(TokenType.EOF);
	}
}
