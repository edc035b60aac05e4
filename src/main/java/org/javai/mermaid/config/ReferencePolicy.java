package org.javai.mermaid.config;

/**
 * How the tree assembler treats {@code style} and {@code click} directives that
 * name an identifier never declared as a node.
 */
public enum ReferencePolicy {
	/** Abort the parse with a reference diagnostic. */
	FAIL,
	/** Collect a warning and drop the directive. */
	WARN
}
