package org.javai.mermaid.ast;

/**
 * Accessibility metadata from {@code accTitle} and {@code accDescr}.
 *
 * @param title the accessible title, or {@code null}
 * @param description the accessible description, or {@code null}
 */
public record Accessibility(String title, String description) {

	public static final Accessibility NONE = new Accessibility(null, null);

	public Accessibility withTitle(String newTitle) {
		return new Accessibility(newTitle, description);
	}

	public Accessibility withDescription(String newDescription) {
		return new Accessibility(title, newDescription);
	}

	public boolean isEmpty() {
		return title == null && description == null;
	}
}
