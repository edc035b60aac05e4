package org.javai.mermaid.flowchart;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

import org.javai.mermaid.ast.Edge;
import org.javai.mermaid.ast.EdgeType;
import org.javai.mermaid.ast.FlowDirection;
import org.javai.mermaid.ast.NodeShape;
import org.javai.mermaid.config.ParserPolicy;
import org.javai.mermaid.diagnostics.Diagnostic;
import org.javai.mermaid.diagnostics.DiagnosticKind;
import org.javai.mermaid.diagnostics.Location;
import org.javai.mermaid.diagnostics.MermaidParseException;
import org.javai.mermaid.flowchart.directive.Directive;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("FlowStatementParser")
class FlowStatementParserTest {

	private static ParseFragments parse(String source) {
		return new FlowStatementParser(source, new FlowTokenizer(source).tokenize(), ParserPolicy.defaults()).parse();
	}

	private static Diagnostic failure(String source) {
		try {
			parse(source);
		} catch (MermaidParseException e) {
			return e.diagnostic();
		}
		throw new AssertionError("Expected the parse to fail");
	}

	@Nested
	@DisplayName("Header")
	class Header {

		@Test
		void defaultsToTopDown() {
			assertThat(parse("flowchart\nA").direction()).isEqualTo(FlowDirection.TD);
		}

		@Test
		void readsDirection() {
			assertThat(parse("graph LR\nA").direction()).isEqualTo(FlowDirection.LR);
		}

		@Test
		void skipsLeadingBlankLinesAndComments() {
			assertThat(parse("\n%% a comment\n\nflowchart BT\nA").direction()).isEqualTo(FlowDirection.BT);
		}

		@Test
		void emptyInputFails() {
			Diagnostic diagnostic = failure("   \n\n");

			assertThat(diagnostic.kind()).isEqualTo(DiagnosticKind.STRUCTURAL);
			assertThat(diagnostic.expected()).containsExactly("flowchart", "graph");
		}

		@Test
		void otherDiagramKeywordFails() {
			Diagnostic diagnostic = failure("sequenceDiagram\nA->>B: hi");

			assertThat(diagnostic.kind()).isEqualTo(DiagnosticKind.STRUCTURAL);
			assertThat(diagnostic.found()).isEqualTo("sequenceDiagram");
			assertThat(diagnostic.location()).isEqualTo(new Location(1, 1));
		}

		@Test
		void unknownDirectionFails() {
			Diagnostic diagnostic = failure("flowchart XY\nA");

			assertThat(diagnostic.expected()).contains("TB", "TD", "BT", "RL", "LR");
			assertThat(diagnostic.found()).isEqualTo("XY");
		}
	}

	@Nested
	@DisplayName("Nodes and edges")
	class NodesAndEdges {

		@Test
		void unknownEndpointsBecomeStubs() {
			ParseFragments fragments = parse("flowchart TD\nA --> B");

			assertThat(fragments.nodes()).containsOnlyKeys("A", "B");
			assertThat(fragments.nodes().get("A").shape()).isEqualTo(NodeShape.RECTANGLE);
			assertThat(fragments.nodes().get("A").text()).isNull();
		}

		@Test
		void laterShapeUpgradesStub() {
			ParseFragments fragments = parse("flowchart TD\nA --> B\nB{Ok?}");

			assertThat(fragments.nodes().keySet()).containsExactly("A", "B");
			assertThat(fragments.nodes().get("B").shape()).isEqualTo(NodeShape.RHOMBUS);
			assertThat(fragments.nodes().get("B").text()).isEqualTo("Ok?");
			assertThat(fragments.warnings()).isEmpty();
		}

		@Test
		void chainsProduceOneEdgePerLink() {
			ParseFragments fragments = parse("flowchart TD\nA --> B -.-> C");

			assertThat(fragments.edges()).containsExactly(
					new Edge("A", "B", EdgeType.ARROW, null, null),
					new Edge("B", "C", EdgeType.DOTTED_ARROW, null, null));
		}

		@Test
		void ampersandGroupsExpandToCrossProduct() {
			ParseFragments fragments = parse("flowchart TD\nA & B --> C & D");

			assertThat(fragments.edges()).extracting(e -> e.from() + e.to())
					.containsExactly("AC", "AD", "BC", "BD");
		}

		@Test
		void semicolonsSeparateStatements() {
			ParseFragments fragments = parse("graph TD; A-->B; B-->C");

			assertThat(fragments.edges()).hasSize(2);
		}

		@Test
		void keywordsCanBeNodeIds() {
			ParseFragments fragments = parse("flowchart TD\nend[End] --> subgraph\nstyle --> class\nclick & direction --> X");

			assertThat(fragments.nodes().keySet())
					.containsExactly("end", "subgraph", "style", "class", "click", "direction", "X");
			assertThat(fragments.nodes().get("end").text()).isEqualTo("End");
			assertThat(fragments.warnings()).isEmpty();
		}

		@Test
		void classShorthandQueuesClassDirective() {
			ParseFragments fragments = parse("flowchart TD\nA:::hot --> B");

			assertThat(fragments.directives()).singleElement()
					.isInstanceOfSatisfying(Directive.ClassDirective.class, d -> {
						assertThat(d.nodeIds()).containsExactly("A");
						assertThat(d.className()).isEqualTo("hot");
					});
		}

		@Test
		void differingRedeclarationKeepsFirstAndWarns() {
			ParseFragments fragments = parse("flowchart TD\nA[One]\nA(Two)");

			assertThat(fragments.nodes().get("A").text()).isEqualTo("One");
			assertThat(fragments.warnings()).singleElement()
					.satisfies(w -> {
						assertThat(w.kind()).isEqualTo(DiagnosticKind.DUPLICATE_DECLARATION);
						assertThat(w.line()).isEqualTo(3);
					});
		}

		@Test
		void identicalRedeclarationIsSilent() {
			assertThat(parse("flowchart TD\nA[One]\nA[One] --> B").warnings()).isEmpty();
		}
	}

	@Nested
	@DisplayName("Recovery")
	class Recovery {

		@Test
		void unknownLineIsSkippedWithOneWarning() {
			ParseFragments fragments = parse("""
					flowchart TD
					    A --> B
					    this is ??? nonsense
					    B --> C
					""");

			assertThat(fragments.nodes().keySet()).containsExactly("A", "B", "C");
			assertThat(fragments.edges()).hasSize(2);
			assertThat(fragments.warnings()).singleElement()
					.satisfies(w -> {
						assertThat(w.kind()).isEqualTo(DiagnosticKind.UNKNOWN_STATEMENT);
						assertThat(w.line()).isEqualTo(3);
					});
		}

		@Test
		void invalidLinkLeavesNoPartialNodes() {
			ParseFragments fragments = parse("flowchart TD\nX ~~> Y\nA --> B");

			assertThat(fragments.nodes()).containsOnlyKeys("A", "B");
			assertThat(fragments.warnings()).singleElement()
					.satisfies(w -> assertThat(w.found()).isEqualTo("~~>"));
		}

		@Test
		void strayEndIsAWarning() {
			ParseFragments fragments = parse("flowchart TD\nA\nend");

			assertThat(fragments.warnings()).singleElement()
					.satisfies(w -> assertThat(w.kind()).isEqualTo(DiagnosticKind.UNKNOWN_STATEMENT));
		}

		@Test
		void bracketMismatchIsFatal() {
			Diagnostic diagnostic = failure("flowchart TD\nA --> B[oops\nC");

			assertThat(diagnostic.kind()).isEqualTo(DiagnosticKind.STRUCTURAL);
			assertThat(diagnostic.expected()).containsExactly("]");
		}
	}

	@Nested
	@DisplayName("Subgraphs")
	class Subgraphs {

		@Test
		void recordsMembershipInInnermostFrame() {
			ParseFragments fragments = parse("""
					flowchart TD
					    subgraph outer
					        a --> b
					        subgraph inner
					            c
					        end
					    end
					    b --> c
					""");

			SubgraphArena arena = fragments.arena();
			assertThat(arena.get("outer").nodeIds()).containsExactly("a", "b");
			assertThat(arena.get("outer").edgeIndices()).containsExactly(0);
			assertThat(arena.get("outer").childIds()).containsExactly("inner");
			assertThat(arena.get("inner").parentId()).isEqualTo("outer");
			assertThat(arena.get("inner").nodeIds()).containsExactly("c");
			assertThat(fragments.edges()).hasSize(2);
		}

		@Test
		void readsEveryTitleForm() {
			ParseFragments fragments = parse("""
					flowchart TD
					    subgraph one [First group]
					    end
					    subgraph "Quoted Title"
					    end
					    subgraph Some title words
					    end
					    subgraph plain
					    end
					""");

			SubgraphArena arena = fragments.arena();
			assertThat(arena.get("one").title()).isEqualTo("First group");
			assertThat(arena.get("Quoted Title").title()).isEqualTo("Quoted Title");
			assertThat(arena.get("Some title words").title()).isEqualTo("Some title words");
			assertThat(arena.get("plain").title()).isNull();
		}

		@Test
		void directionInsideSubgraphAppliesToSubgraph() {
			ParseFragments fragments = parse("flowchart TD\nsubgraph s\ndirection LR\nx\nend");

			assertThat(fragments.arena().get("s").direction()).isEqualTo(FlowDirection.LR);
			assertThat(fragments.direction()).isEqualTo(FlowDirection.TD);
		}

		@Test
		void subgraphIdAsEndpointCreatesNoStub() {
			ParseFragments fragments = parse("flowchart TD\nsubgraph S\nx\nend\nS --> y");

			assertThat(fragments.nodes()).containsOnlyKeys("x", "y");
			assertThat(fragments.edges()).singleElement()
					.satisfies(e -> assertThat(e.from()).isEqualTo("S"));
		}

		@Test
		void unclosedSubgraphNamesOutermostFrame() {
			Diagnostic diagnostic = failure("""
					flowchart TD
					    A --> B
					    subgraph first
					        subgraph second
					        end
					""");

			assertThat(diagnostic.kind()).isEqualTo(DiagnosticKind.STRUCTURAL);
			assertThat(diagnostic.message()).contains("first");
			assertThat(diagnostic.line()).isEqualTo(3);
			assertThat(diagnostic.expected()).containsExactly("end");
		}
	}

	@Nested
	@DisplayName("Directives")
	class Directives {

		@Test
		void styleKeepsPropertyOrderAndNestedCommas() {
			ParseFragments fragments = parse("flowchart TD\nA\nstyle A fill:rgb(1,2,3),stroke-width:4px");

			assertThat(fragments.directives()).singleElement()
					.isInstanceOfSatisfying(Directive.StyleDirective.class, d -> {
						assertThat(d.targetId()).isEqualTo("A");
						assertThat(d.properties()).containsExactly(
								entry("fill", "rgb(1,2,3)"),
								entry("stroke-width", "4px"));
					});
		}

		@Test
		void classDefAcceptsSeveralNames() {
			ParseFragments fragments = parse("flowchart TD\nclassDef hot,warm fill:#f96");

			assertThat(fragments.directives()).singleElement()
					.isInstanceOfSatisfying(Directive.ClassDefDirective.class, d -> {
						assertThat(d.classNames()).containsExactly("hot", "warm");
						assertThat(d.properties()).containsEntry("fill", "#f96");
					});
		}

		@Test
		void classAssignsToSeveralNodes() {
			ParseFragments fragments = parse("flowchart TD\nA --> B\nclass A,B hot");

			assertThat(fragments.directives()).singleElement()
					.isInstanceOfSatisfying(Directive.ClassDirective.class, d ->
							assertThat(d.nodeIds()).containsExactly("A", "B"));
		}

		@Test
		void linkStyleReadsIndicesOrDefault() {
			ParseFragments fragments = parse("flowchart TD\nlinkStyle 0,2 stroke:red\nlinkStyle default color:blue");

			assertThat(fragments.directives()).hasSize(2);
			assertThat(fragments.directives().get(0))
					.isInstanceOfSatisfying(Directive.LinkStyleDirective.class, d -> {
						assertThat(d.indices()).containsExactly(0, 2);
						assertThat(d.allEdges()).isFalse();
					});
			assertThat(fragments.directives().get(1))
					.isInstanceOfSatisfying(Directive.LinkStyleDirective.class, d ->
							assertThat(d.allEdges()).isTrue());
		}

		@Test
		void readsEveryClickForm() {
			ParseFragments fragments = parse("""
					flowchart TD
					    click A onClick "Tip"
					    click B call doIt(1, 2)
					    click C href "https://example.com" "Docs" _blank
					    click D "https://example.org"
					""");

			assertThat(fragments.directives()).hasSize(4)
					.allSatisfy(d -> assertThat(d).isInstanceOf(Directive.ClickDirective.class));
			Directive.ClickDirective a = (Directive.ClickDirective) fragments.directives().get(0);
			Directive.ClickDirective b = (Directive.ClickDirective) fragments.directives().get(1);
			Directive.ClickDirective c = (Directive.ClickDirective) fragments.directives().get(2);
			Directive.ClickDirective d = (Directive.ClickDirective) fragments.directives().get(3);

			assertThat(a.callback().name()).isEqualTo("onClick");
			assertThat(a.tooltip()).isEqualTo("Tip");
			assertThat(b.callback().name()).isEqualTo("doIt");
			assertThat(b.callback().arguments()).isEqualTo("1, 2");
			assertThat(c.link().url()).isEqualTo("https://example.com");
			assertThat(c.link().target()).isEqualTo("_blank");
			assertThat(c.tooltip()).isEqualTo("Docs");
			assertThat(d.link().url()).isEqualTo("https://example.org");
			assertThat(d.tooltip()).isNull();
		}

		@Test
		void styleWithoutPropertiesIsAWarning() {
			ParseFragments fragments = parse("flowchart TD\nA\nstyle A");

			assertThat(fragments.directives()).isEmpty();
			assertThat(fragments.warnings()).hasSize(1);
		}

		@Test
		void readsAccessibility() {
			ParseFragments fragments = parse("""
					flowchart TD
					    accTitle: Order flow
					    accDescr {
					        Shows how an order
					        moves through the system
					    }
					    A --> B
					""");

			assertThat(fragments.accessibility().title()).isEqualTo("Order flow");
			assertThat(fragments.accessibility().description())
					.isEqualTo("Shows how an order\nmoves through the system");
			assertThat(fragments.edges()).hasSize(1);
		}

		@Test
		void unclosedDescriptionBlockIsFatal() {
			assertThatThrownBy(() -> parse("flowchart TD\naccDescr {\nnever closed"))
					.isInstanceOf(MermaidParseException.class);
		}
	}
}
