package io.evitadb.marginalia.ast;

/**
 * A point in a source text.
 *
 * The offset is a UTF-16 code unit index into the text the owning node was parsed from. For top-level nodes this
 * is the original document; for nodes nested in a list item or block quote it is the stripped sub-text of that
 * container (see {@link ContentMapping}).
 *
 * @param line   1-based line number
 * @param column 1-based column (code units)
 * @param offset 0-based offset (code units)
 */
public record Position(int line, int column, int offset) {

	/**
	 * The position of the very first character of a text.
	 */
	public static final Position START = new Position(1, 1, 0);

	/**
	 * Creates a Position with validation.
	 */
	public Position {
		if (line < 1) {
			throw new IllegalArgumentException("line must be >= 1");
		}
		if (column < 1) {
			throw new IllegalArgumentException("column must be >= 1");
		}
		if (offset < 0) {
			throw new IllegalArgumentException("offset must be non-negative");
		}
	}
}
