package org.javai.mermaid.flowchart;

import org.javai.mermaid.diagnostics.Location;

/**
 * A token of the flowchart grammar.
 *
 * @param type the token type
 * @param text the token text; for {@link TokenType#STRING} the value without quotes
 * @param start offset of the first character in the source (inclusive)
 * @param end offset after the last character in the source (exclusive)
 * @param line 1-based line of the first character
 * @param column 1-based column of the first character
 */
public record FlowToken(TokenType type, String text, int start, int end, int line, int column) {

	public enum TokenType {
		IDENTIFIER,         // node ids and keywords
		STRING,             // "quoted text"
		LINK,               // line symbols: -->, ---, -.->, ==>, ~~~, --o, <-->, --, -. ...
		LEFT_SQUARE,        // [
		RIGHT_SQUARE,       // ]
		DOUBLE_LEFT_SQUARE, // [[
		DOUBLE_RIGHT_SQUARE,// ]]
		LEFT_PAREN,         // (
		RIGHT_PAREN,        // )
		DOUBLE_LEFT_PAREN,  // ((
		DOUBLE_RIGHT_PAREN, // ))
		TRIPLE_LEFT_PAREN,  // (((
		TRIPLE_RIGHT_PAREN, // )))
		LEFT_BRACE,         // {
		RIGHT_BRACE,        // }
		DOUBLE_LEFT_BRACE,  // {{
		DOUBLE_RIGHT_BRACE, // }}
		RIGHT_ANGLE,        // >
		SLASH,              // /
		BACKSLASH,          // \
		PIPE,               // |
		AMPERSAND,          // &
		COLON,              // :
		TRIPLE_COLON,       // :::
		COMMA,              // ,
		SEMICOLON,          // ;
		SYMBOL,             // any other printable character
		NEWLINE,
		EOF
	}

	public boolean isType(TokenType expectedType) {
		return type == expectedType;
	}

	public boolean isIdentifier(String expected) {
		return type == TokenType.IDENTIFIER && text.equals(expected);
	}

	/**
	 * Whether this token ends a statement.
	 */
	public boolean isTerminator() {
		return type == TokenType.NEWLINE || type == TokenType.SEMICOLON || type == TokenType.EOF;
	}

	/**
	 * Whether {@code next} starts exactly where this token ends.
	 */
	public boolean isAdjacentTo(FlowToken next) {
		return next != null && end == next.start;
	}

	public Location location() {
		return new Location(line, column);
	}

	/**
	 * Text used when reporting this token in a diagnostic.
	 */
	public String display() {
		return switch (type) {
			case NEWLINE -> "<newline>";
			case EOF -> "<end of input>";
			case STRING -> "\"" + text + "\"";
			default -> text;
		};
	}

	@Override
	public String toString() {
		return switch (type) {
			case STRING -> "STRING(\"" + text + "\")";
			case IDENTIFIER, LINK, SYMBOL -> type + "(" + text + ")";
			default -> type.toString();
		};
	}
}
