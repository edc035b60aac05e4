package org.javai.mermaid.flowchart;

import java.util.ArrayList;
import java.util.List;
import org.javai.mermaid.diagnostics.Diagnostic;
import org.javai.mermaid.diagnostics.DiagnosticKind;
import org.javai.mermaid.diagnostics.Location;
import org.javai.mermaid.diagnostics.MermaidParseException;
import org.javai.mermaid.flowchart.FlowToken.TokenType;

/**
 * Tokenizer for the flowchart grammar.
 * <p>
 * Fixed symbols are matched longest first from {@link #SYMBOLS} so that {@code (((}
 * is never read as {@code ((} followed by {@code (}. Line symbols are munched as a
 * whole run of {@code - = ~ .} characters with an optional {@code <} prefix and an
 * optional {@code > o x} head; the edge rules classify them later. Spaces and tabs
 * are dropped, newlines are kept as statement terminators and {@code %%} comments
 * are discarded. Keywords are plain identifiers here; the parser decides by position.
 */
public class FlowTokenizer {

	private record FixedSymbol(String text, TokenType type) {
	}

	// Longest first; the first match at a position wins.
	private static final List<FixedSymbol> SYMBOLS = List.of(
			new FixedSymbol(":::", TokenType.TRIPLE_COLON),
			new FixedSymbol("(((", TokenType.TRIPLE_LEFT_PAREN),
			new FixedSymbol(")))", TokenType.TRIPLE_RIGHT_PAREN),
			new FixedSymbol("((", TokenType.DOUBLE_LEFT_PAREN),
			new FixedSymbol("))", TokenType.DOUBLE_RIGHT_PAREN),
			new FixedSymbol("[[", TokenType.DOUBLE_LEFT_SQUARE),
			new FixedSymbol("]]", TokenType.DOUBLE_RIGHT_SQUARE),
			new FixedSymbol("{{", TokenType.DOUBLE_LEFT_BRACE),
			new FixedSymbol("}}", TokenType.DOUBLE_RIGHT_BRACE),
			new FixedSymbol("(", TokenType.LEFT_PAREN),
			new FixedSymbol(")", TokenType.RIGHT_PAREN),
			new FixedSymbol("[", TokenType.LEFT_SQUARE),
			new FixedSymbol("]", TokenType.RIGHT_SQUARE),
			new FixedSymbol("{", TokenType.LEFT_BRACE),
			new FixedSymbol("}", TokenType.RIGHT_BRACE),
			new FixedSymbol(">", TokenType.RIGHT_ANGLE),
			new FixedSymbol("/", TokenType.SLASH),
			new FixedSymbol("\\", TokenType.BACKSLASH),
			new FixedSymbol("|", TokenType.PIPE),
			new FixedSymbol("&", TokenType.AMPERSAND),
			new FixedSymbol(":", TokenType.COLON),
			new FixedSymbol(",", TokenType.COMMA),
			new FixedSymbol(";", TokenType.SEMICOLON));

	private final String input;
	private int pos = 0;
	private int line = 1;
	private int column = 1;

	public FlowTokenizer(String input) {
		this.input = input != null ? input : "";
	}

	/**
	 * Tokenizes the entire input.
	 *
	 * @return the tokens, always ending with an {@link TokenType#EOF} token
	 * @throws MermaidParseException with a {@link DiagnosticKind#LEXICAL} diagnostic on a dead-end character
	 *         or an unterminated string
	 */
	public List<FlowToken> tokenize() {
		List<FlowToken> tokens = new ArrayList<>();

		while (!isAtEnd()) {
			skipBlanksAndComments();
			if (isAtEnd()) break;

			tokens.add(nextToken());
		}

		tokens.add(new FlowToken(TokenType.EOF, "", pos, pos, line, column));
		return tokens;
	}

	private FlowToken nextToken() {
		char c = peek();

		if (c == '\n') {
			return emit(TokenType.NEWLINE, 1);
		}
		if (c == '"') {
			return scanString();
		}
		if (isLinkStart()) {
			return scanLink();
		}
		if (isIdentifierChar(c)) {
			return scanIdentifier();
		}
		for (FixedSymbol symbol : SYMBOLS) {
			if (input.startsWith(symbol.text(), pos)) {
				return emit(symbol.type(), symbol.text().length());
			}
		}
		if (Character.isISOControl(c)) {
			throw new MermaidParseException(Diagnostic.of(DiagnosticKind.LEXICAL,
					String.format("Unexpected control character U+%04X", (int) c),
					List.of(), String.format("\\u%04x", (int) c), currentLocation()));
		}
		return emit(TokenType.SYMBOL, Character.charCount(input.codePointAt(pos)));
	}

	private FlowToken scanString() {
		int start = pos;
		int startLine = line;
		int startColumn = column;
		advance(); // consume opening "

		while (!isAtEnd() && peek() != '"') {
			advance();
		}

		if (isAtEnd()) {
			throw new MermaidParseException(Diagnostic.of(DiagnosticKind.LEXICAL,
					"Unterminated string", List.of("\""), "<end of input>",
					new Location(startLine, startColumn)));
		}

		advance(); // consume closing "
		String value = input.substring(start + 1, pos - 1);
		return new FlowToken(TokenType.STRING, value, start, pos, startLine, startColumn);
	}

	private FlowToken scanLink() {
		int start = pos;
		int startColumn = column;

		if (peek() == '<') {
			advance();
		}
		while (!isAtEnd() && isLineChar(peek())) {
			advance();
		}
		if (!isAtEnd()) {
			char head = peek();
			if (head == '>') {
				advance();
			} else if ((head == 'o' || head == 'x') && pos - start >= 2 && !isIdentifierChar(peekAt(pos + 1))) {
				advance();
			}
		}

		return new FlowToken(TokenType.LINK, input.substring(start, pos), start, pos, line, startColumn);
	}

	private FlowToken scanIdentifier() {
		int start = pos;
		int startColumn = column;

		while (!isAtEnd() && isIdentifierChar(peek())) {
			advance();
		}

		return new FlowToken(TokenType.IDENTIFIER, input.substring(start, pos), start, pos, line, startColumn);
	}

	private FlowToken emit(TokenType type, int length) {
		int start = pos;
		int startLine = line;
		int startColumn = column;
		for (int i = 0; i < length; i++) {
			advance();
		}
		return new FlowToken(type, input.substring(start, pos), start, pos, startLine, startColumn);
	}

	private void skipBlanksAndComments() {
		while (!isAtEnd()) {
			char c = peek();
			if (c == ' ' || c == '\t' || c == '\r') {
				advance();
			} else if (c == '%' && peekAt(pos + 1) == '%') {
				while (!isAtEnd() && peek() != '\n') {
					advance();
				}
			} else {
				return;
			}
		}
	}

	private boolean isLinkStart() {
		char c = peek();
		char next = peekAt(pos + 1);
		return switch (c) {
			case '-', '=', '~' -> true;
			case '<' -> next == '-' || next == '=';
			case '.' -> next == '-';
			default -> false;
		};
	}

	private char peek() {
		return isAtEnd() ? '\0' : input.charAt(pos);
	}

	private char peekAt(int index) {
		return index < input.length() ? input.charAt(index) : '\0';
	}

	private void advance() {
		char c = input.charAt(pos++);
		if (c == '\n') {
			line++;
			column = 1;
		} else {
			column++;
		}
	}

	private boolean isAtEnd() {
		return pos >= input.length();
	}

	private Location currentLocation() {
		return new Location(line, column);
	}

	private static boolean isLineChar(char c) {
		return c == '-' || c == '=' || c == '~' || c == '.';
	}

	private static boolean isIdentifierChar(char c) {
		return Character.isLetterOrDigit(c) || c == '_';
	}
}
