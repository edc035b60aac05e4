package org.javai.mermaid.config;

import java.util.Objects;

/**
 * Tunables for the flowchart parser.
 *
 * @param referencePolicy treatment of directives naming undeclared nodes
 * @param extractIcons whether {@code fa:fa-xxx} references are lifted out of node text
 * @param frontMatter whether a leading {@code ---} YAML block is read for the title
 */
public record ParserPolicy(ReferencePolicy referencePolicy, boolean extractIcons, boolean frontMatter) {

	public ParserPolicy {
		Objects.requireNonNull(referencePolicy, "referencePolicy must not be null");
	}

	/**
	 * Strict references, icon extraction and front matter enabled.
	 */
	public static ParserPolicy defaults() {
		return new ParserPolicy(ReferencePolicy.FAIL, true, true);
	}

	/**
	 * Same as {@link #defaults()} but unknown references only produce warnings.
	 */
	public static ParserPolicy lenient() {
		return new ParserPolicy(ReferencePolicy.WARN, true, true);
	}

	public ParserPolicy withReferencePolicy(ReferencePolicy policy) {
		return new ParserPolicy(policy, extractIcons, frontMatter);
	}

	public boolean failOnUnknownReference() {
		return referencePolicy == ReferencePolicy.FAIL;
	}
}
