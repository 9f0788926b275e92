package io.evitadb.marginalia.parser;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * One logical line of an input text.
 *
 * @param raw        line content without the trailing `\n`
 * @param lineNumber 1-based line number
 * @param offset     offset of the first character of the line in the scanned text
 * @param terminated true when the line was followed by `\n`
 */
public record Line(
	@Nonnull String raw,
	int lineNumber,
	int offset,
	boolean terminated
) {

	public Line {
		Objects.requireNonNull(raw, "raw must not be null");
		if (lineNumber < 1) {
			throw new IllegalArgumentException("lineNumber must be >= 1");
		}
		if (offset < 0) {
			throw new IllegalArgumentException("offset must be non-negative");
		}
	}

	/**
	 * Returns the offset just after the last character of the line (excluding the newline).
	 *
	 * @return end offset
	 */
	public int endOffset() {
		return this.offset + this.raw.length();
	}
}
