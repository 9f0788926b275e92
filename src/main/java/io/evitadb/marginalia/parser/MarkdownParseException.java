package io.evitadb.marginalia.parser;

import javax.annotation.Nonnull;

/**
 * Base of the fatal failures a parse may end with.
 *
 * Malformed markdown never raises this exception, it degrades to literal text instead. Only the safety limits of the
 * parser do, and no partial tree is returned when they trip.
 */
public abstract class MarkdownParseException extends Exception {

	/**
	 * Creates a new MarkdownParseException.
	 *
	 * @param message the error message describing the failure
	 */
	protected MarkdownParseException(@Nonnull String message) {
		super(message);
	}
}
