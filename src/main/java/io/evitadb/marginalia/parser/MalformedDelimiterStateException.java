package io.evitadb.marginalia.parser;

import javax.annotation.Nonnull;

/**
 * Thrown when emphasis resolution violates its own invariants. This indicates a parser defect, not bad input.
 */
public final class MalformedDelimiterStateException extends MarkdownParseException {

	private final int iterationBound;

	/**
	 * Creates a new MalformedDelimiterStateException.
	 *
	 * @param message        description of the violated invariant
	 * @param iterationBound the iteration bound of the matching loop
	 */
	public MalformedDelimiterStateException(@Nonnull String message, int iterationBound) {
		super(message + " (iteration bound " + iterationBound + ")");
		this.iterationBound = iterationBound;
	}

	/**
	 * Returns the iteration bound the matching loop was given.
	 *
	 * @return maximum number of loop iterations
	 */
	public int getIterationBound() {
		return this.iterationBound;
	}
}
