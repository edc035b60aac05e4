package org.javai.mermaid.diagnostics;

/**
 * A 1-based line/column position in diagram source text.
 *
 * @param line the line number, starting at 1
 * @param column the column number, starting at 1
 */
public record Location(int line, int column) {

	public static final Location START = new Location(1, 1);

	public Location {
		if (line < 1 || column < 1) {
			throw new IllegalArgumentException("Location is 1-based, got " + line + ":" + column);
		}
	}

	/**
	 * Computes the location of a character offset in the given source.
	 */
	public static Location ofOffset(String source, int offset) {
		int line = 1;
		int column = 1;
		int end = Math.min(offset, source.length());
		for (int i = 0; i < end; i++) {
			if (source.charAt(i) == '\n') {
				line++;
				column = 1;
			} else {
				column++;
			}
		}
		return new Location(line, column);
	}

	@Override
	public String toString() {
		return "line " + line + ", column " + column;
	}
}
