package org.javai.mermaid.flowchart.grammar;

import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.javai.mermaid.ast.NodeShape;
import org.javai.mermaid.diagnostics.Diagnostic;
import org.javai.mermaid.diagnostics.DiagnosticKind;
import org.javai.mermaid.diagnostics.MermaidParseException;
import org.javai.mermaid.flowchart.FlowToken;
import org.javai.mermaid.flowchart.FlowToken.TokenType;

/**
 * Recognizes node shapes from their bracket pairs.
 * <p>
 * Compound openers are resolved with one token of lookahead: {@code (} directly
 * followed by {@code [} opens a stadium, {@code [} directly followed by {@code (}
 * a cylinder, {@code [} followed by {@code /} or {@code \} a parallelogram or
 * trapezoid whose variant is fixed by the closing slash. The closer has to be on
 * the same line. Text between opener and closer is kept verbatim with whitespace
 * collapsed; the rule never consumes past its own closer.
 */
public final class ShapeRules {

	private static final Set<TokenType> OPENERS = EnumSet.of(
			TokenType.LEFT_SQUARE,
			TokenType.DOUBLE_LEFT_SQUARE,
			TokenType.LEFT_PAREN,
			TokenType.DOUBLE_LEFT_PAREN,
			TokenType.TRIPLE_LEFT_PAREN,
			TokenType.LEFT_BRACE,
			TokenType.DOUBLE_LEFT_BRACE,
			TokenType.RIGHT_ANGLE);

	private ShapeRules() {
		// Utility class - no instantiation
	}

	public static boolean isOpener(FlowToken token) {
		return OPENERS.contains(token.type());
	}

	/**
	 * Matches a node shape starting at {@code index}.
	 *
	 * @param tokens the token sequence (ends with EOF)
	 * @param index position of the candidate opening bracket
	 * @param source the text the tokens were produced from
	 * @param extractIcons whether icon references are lifted out of the text
	 * @return the match, or empty when the token at {@code index} opens no shape
	 * @throws MermaidParseException with a {@link DiagnosticKind#STRUCTURAL} diagnostic when the closer is missing
	 */
	public static Optional<ShapeMatch> match(List<FlowToken> tokens, int index, String source, boolean extractIcons) {
		FlowToken open = tokens.get(index);
		if (!isOpener(open)) {
			return Optional.empty();
		}
		FlowToken next = tokens.get(index + 1);
		boolean compound = open.isAdjacentTo(next);

		ShapeMatch match = switch (open.type()) {
			case LEFT_SQUARE -> {
				if (compound && next.isType(TokenType.LEFT_PAREN)) {
					yield closePair(tokens, index, 2, NodeShape.CYLINDER, TokenType.RIGHT_PAREN, TokenType.RIGHT_SQUARE,
							source, extractIcons);
				}
				if (compound && (next.isType(TokenType.SLASH) || next.isType(TokenType.BACKSLASH))) {
					yield closeSlanted(tokens, index, next.isType(TokenType.SLASH), source, extractIcons);
				}
				yield closeSingle(tokens, index, NodeShape.RECTANGLE, TokenType.RIGHT_SQUARE, source, extractIcons);
			}
			case LEFT_PAREN -> {
				if (compound && next.isType(TokenType.LEFT_SQUARE)) {
					yield closePair(tokens, index, 2, NodeShape.STADIUM, TokenType.RIGHT_SQUARE, TokenType.RIGHT_PAREN,
							source, extractIcons);
				}
				yield closeSingle(tokens, index, NodeShape.ROUNDED_RECTANGLE, TokenType.RIGHT_PAREN, source, extractIcons);
			}
			case DOUBLE_LEFT_SQUARE ->
					closeSingle(tokens, index, NodeShape.SUBROUTINE, TokenType.DOUBLE_RIGHT_SQUARE, source, extractIcons);
			case DOUBLE_LEFT_PAREN ->
					closeSingle(tokens, index, NodeShape.CIRCLE, TokenType.DOUBLE_RIGHT_PAREN, source, extractIcons);
			case TRIPLE_LEFT_PAREN ->
					closeSingle(tokens, index, NodeShape.DOUBLE_CIRCLE, TokenType.TRIPLE_RIGHT_PAREN, source, extractIcons);
			case LEFT_BRACE ->
					closeSingle(tokens, index, NodeShape.RHOMBUS, TokenType.RIGHT_BRACE, source, extractIcons);
			case DOUBLE_LEFT_BRACE ->
					closeSingle(tokens, index, NodeShape.HEXAGON, TokenType.DOUBLE_RIGHT_BRACE, source, extractIcons);
			case RIGHT_ANGLE ->
					closeSingle(tokens, index, NodeShape.ASYMMETRIC, TokenType.RIGHT_SQUARE, source, extractIcons);
			default -> null;
		};
		return Optional.ofNullable(match);
	}

	private static ShapeMatch closeSingle(List<FlowToken> tokens, int index, NodeShape shape, TokenType closer,
			String source, boolean extractIcons) {
		int j = index + 1;
		while (!endOfLine(tokens.get(j))) {
			if (tokens.get(j).isType(closer)) {
				return build(shape, tokens, index, index, j, j + 1, source, extractIcons);
			}
			j++;
		}
		throw missingCloser(tokens, index, j, shape.close());
	}

	private static ShapeMatch closePair(List<FlowToken> tokens, int index, int openerLength, NodeShape shape,
			TokenType first, TokenType second, String source, boolean extractIcons) {
		int j = index + openerLength;
		while (!endOfLine(tokens.get(j))) {
			FlowToken candidate = tokens.get(j);
			FlowToken following = tokens.get(j + 1);
			if (candidate.isType(first) && following.isType(second) && candidate.isAdjacentTo(following)) {
				return build(shape, tokens, index, index + openerLength - 1, j, j + 2, source, extractIcons);
			}
			j++;
		}
		throw missingCloser(tokens, index, j, shape.close());
	}

	private static ShapeMatch closeSlanted(List<FlowToken> tokens, int index, boolean openedWithSlash, String source,
			boolean extractIcons) {
		int j = index + 2;
		while (!endOfLine(tokens.get(j))) {
			FlowToken candidate = tokens.get(j);
			FlowToken following = tokens.get(j + 1);
			boolean slant = candidate.isType(TokenType.SLASH) || candidate.isType(TokenType.BACKSLASH);
			if (slant && following.isType(TokenType.RIGHT_SQUARE) && candidate.isAdjacentTo(following)) {
				boolean closedWithSlash = candidate.isType(TokenType.SLASH);
				NodeShape shape;
				if (openedWithSlash) {
					shape = closedWithSlash ? NodeShape.PARALLELOGRAM : NodeShape.TRAPEZOID;
				} else {
					shape = closedWithSlash ? NodeShape.TRAPEZOID_ALT : NodeShape.PARALLELOGRAM_ALT;
				}
				return build(shape, tokens, index, index + 1, j, j + 2, source, extractIcons);
			}
			j++;
		}
		throw missingCloser(tokens, index, j, openedWithSlash ? "/] or \\]" : "\\] or /]");
	}

	private static ShapeMatch build(NodeShape shape, List<FlowToken> tokens, int index, int lastOpener,
			int firstCloser, int afterCloser, String source, boolean extractIcons) {
		String text = SourceText.between(source, tokens, lastOpener, firstCloser);
		String icon = null;
		if (extractIcons) {
			IconExtractor.Extraction extraction = IconExtractor.extract(text);
			icon = extraction.icon();
			text = extraction.text();
		}
		return new ShapeMatch(shape, text, icon, afterCloser - index);
	}

	private static MermaidParseException missingCloser(List<FlowToken> tokens, int index, int stop, String closer) {
		FlowToken open = tokens.get(index);
		FlowToken found = tokens.get(stop);
		return new MermaidParseException(Diagnostic.of(DiagnosticKind.STRUCTURAL,
				"Missing '" + closer + "' to close '" + open.text() + "' opened at " + open.location(),
				List.of(closer), found.display(), found.location()));
	}

	private static boolean endOfLine(FlowToken token) {
		return token.isType(TokenType.NEWLINE) || token.isType(TokenType.EOF);
	}
}
