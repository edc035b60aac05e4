package org.javai.mermaid.flowchart.grammar;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;
import org.javai.mermaid.ast.NodeShape;
import org.javai.mermaid.diagnostics.Diagnostic;
import org.javai.mermaid.diagnostics.DiagnosticKind;
import org.javai.mermaid.diagnostics.MermaidParseException;
import org.javai.mermaid.flowchart.FlowToken;
import org.javai.mermaid.flowchart.FlowTokenizer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

class ShapeRulesTest {

	private static Optional<ShapeMatch> matchAfterId(String source, boolean extractIcons) {
		List<FlowToken> tokens = new FlowTokenizer(source).tokenize();
		return ShapeRules.match(tokens, 1, source, extractIcons);
	}

	static Stream<Arguments> shapes() {
		return Stream.of(
				Arguments.of("A[text]", NodeShape.RECTANGLE),
				Arguments.of("A(text)", NodeShape.ROUNDED_RECTANGLE),
				Arguments.of("A([text])", NodeShape.STADIUM),
				Arguments.of("A[[text]]", NodeShape.SUBROUTINE),
				Arguments.of("A[(text)]", NodeShape.CYLINDER),
				Arguments.of("A((text))", NodeShape.CIRCLE),
				Arguments.of("A(((text)))", NodeShape.DOUBLE_CIRCLE),
				Arguments.of("A>text]", NodeShape.ASYMMETRIC),
				Arguments.of("A{text}", NodeShape.RHOMBUS),
				Arguments.of("A{{text}}", NodeShape.HEXAGON),
				Arguments.of("A[/text/]", NodeShape.PARALLELOGRAM),
				Arguments.of("A[\\text\\]", NodeShape.PARALLELOGRAM_ALT),
				Arguments.of("A[/text\\]", NodeShape.TRAPEZOID),
				Arguments.of("A[\\text/]", NodeShape.TRAPEZOID_ALT));
	}

	@ParameterizedTest(name = "{0} -> {1}")
	@MethodSource("shapes")
	void recognizesEveryShape(String source, NodeShape expected) {
		List<FlowToken> tokens = new FlowTokenizer(source).tokenize();

		ShapeMatch match = ShapeRules.match(tokens, 1, source, true).orElseThrow();

		assertThat(match.shape()).isEqualTo(expected);
		assertThat(match.text()).isEqualTo("text");
		assertThat(match.icon()).isNull();
		// everything between the id and EOF
		assertThat(match.consumed()).isEqualTo(tokens.size() - 2);
	}

	@Test
	void collapsesWhitespaceInText() {
		assertThat(matchAfterId("A[  many   spaces ]", true).orElseThrow().text()).isEqualTo("many spaces");
	}

	@Test
	void quotedTextMayContainBrackets() {
		ShapeMatch match = matchAfterId("A(\"close ) early\")", true).orElseThrow();

		assertThat(match.shape()).isEqualTo(NodeShape.ROUNDED_RECTANGLE);
		assertThat(match.text()).isEqualTo("close ) early");
	}

	@Test
	void emptyBracketsHaveNoText() {
		assertThat(matchAfterId("A[]", true).orElseThrow().text()).isNull();
	}

	@Test
	void extractsIconFromText() {
		ShapeMatch match = matchAfterId("A[fa:fa-car Car]", true).orElseThrow();

		assertThat(match.icon()).isEqualTo("fa:fa-car");
		assertThat(match.text()).isEqualTo("Car");
	}

	@Test
	void keepsIconInTextWhenExtractionIsOff() {
		ShapeMatch match = matchAfterId("A[fa:fa-car Car]", false).orElseThrow();

		assertThat(match.icon()).isNull();
		assertThat(match.text()).isEqualTo("fa:fa-car Car");
	}

	@Test
	void braceInsideParenIsPlainText() {
		ShapeMatch match = matchAfterId("A({x})", true).orElseThrow();

		assertThat(match.shape()).isEqualTo(NodeShape.ROUNDED_RECTANGLE);
		assertThat(match.text()).isEqualTo("{x}");
	}

	@Test
	void nonOpenerMatchesNothing() {
		assertThat(matchAfterId("A-->B", true)).isEmpty();
	}

	@Test
	void missingCloserIsStructuralError() {
		assertThatThrownBy(() -> matchAfterId("A[text", true))
				.isInstanceOf(MermaidParseException.class)
				.satisfies(e -> {
					Diagnostic diagnostic = ((MermaidParseException) e).diagnostic();
					assertThat(diagnostic.kind()).isEqualTo(DiagnosticKind.STRUCTURAL);
					assertThat(diagnostic.expected()).containsExactly("]");
					assertThat(diagnostic.found()).isEqualTo("<end of input>");
				});
	}

	@Test
	void closerMustBeOnTheSameLine() {
		assertThatThrownBy(() -> matchAfterId("A((text\n))", true))
				.isInstanceOf(MermaidParseException.class)
				.satisfies(e -> {
					Diagnostic diagnostic = ((MermaidParseException) e).diagnostic();
					assertThat(diagnostic.expected()).containsExactly("))");
					assertThat(diagnostic.found()).isEqualTo("<newline>");
					assertThat(diagnostic.line()).isEqualTo(1);
				});
	}
}
