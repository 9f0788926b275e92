package io.evitadb.marginalia.ast;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Half-open span `[start, end)` of a node in its source text.
 *
 * @param start position of the first character
 * @param end   position just after the last character
 */
public record SourceLocation(
	@Nonnull Position start,
	@Nonnull Position end
) {

	/**
	 * Creates a SourceLocation with validation.
	 */
	public SourceLocation {
		Objects.requireNonNull(start, "start must not be null");
		Objects.requireNonNull(end, "end must not be null");
		if (start.offset() > end.offset()) {
			throw new IllegalArgumentException(
				"start offset " + start.offset() + " must not be after end offset " + end.offset()
			);
		}
	}

	/**
	 * Returns the number of code units covered by this span.
	 *
	 * @return end offset minus start offset
	 */
	public int length() {
		return this.end.offset() - this.start.offset();
	}
}
