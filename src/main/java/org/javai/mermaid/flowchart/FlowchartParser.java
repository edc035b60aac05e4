package org.javai.mermaid.flowchart;

import java.util.List;
import java.util.Set;
import org.javai.mermaid.DiagramParser;
import org.javai.mermaid.ParseOutcome;
import org.javai.mermaid.ast.FlowchartDiagram;
import org.javai.mermaid.config.ParserPolicy;
import org.javai.mermaid.diagnostics.MermaidParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for flowchart text: front matter, tokenizer, statement parser and
 * tree assembler in sequence.
 * <p>
 * Every call owns its own state; an instance holds nothing but its policy and
 * can be shared between threads.
 *
 * <pre>
 * ParseOutcome&lt;FlowchartDiagram&gt; outcome = new FlowchartParser().parse("""
 *     flowchart LR
 *       A[Start] --&gt; B{Ok?}
 *     """);
 * FlowchartDiagram diagram = outcome.orElseThrow();
 * </pre>
 */
public class FlowchartParser implements DiagramParser<FlowchartDiagram> {

	private static final Logger logger = LoggerFactory.getLogger(FlowchartParser.class);

	public static final String GRAMMAR_ID = "flowchart";

	private final ParserPolicy policy;

	public FlowchartParser() {
		this(ParserPolicy.defaults());
	}

	public FlowchartParser(ParserPolicy policy) {
		this.policy = policy != null ? policy : ParserPolicy.defaults();
	}

	public ParserPolicy policy() {
		return policy;
	}

	@Override
	public String grammarId() {
		return GRAMMAR_ID;
	}

	@Override
	public Set<String> headerKeywords() {
		return FlowStatementParser.HEADER_KEYWORDS;
	}

	@Override
	public ParseOutcome<FlowchartDiagram> parse(String text) {
		String source = text != null ? text : "";
		try {
			String title = null;
			if (policy.frontMatter()) {
				FrontMatter.Split split = FrontMatter.split(source);
				title = split.title();
				source = split.body();
			}

			List<FlowToken> tokens = new FlowTokenizer(source).tokenize();
			ParseFragments fragments = new FlowStatementParser(source, tokens, policy).parse();
			fragments.setTitle(title);
			return new TreeAssembler(policy).assemble(fragments);
		} catch (MermaidParseException e) {
			logger.debug("Flowchart parse failed: {}", e.getMessage());
			return new ParseOutcome.Failure<>(e.diagnostic());
		}
	}
}
