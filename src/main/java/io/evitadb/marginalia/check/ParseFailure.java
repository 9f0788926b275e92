package io.evitadb.marginalia.check;

import javax.annotation.Nonnull;
import java.nio.file.Path;
import java.util.Objects;

/**
 * A markdown file the parser refused to parse.
 *
 * @param file       the file
 * @param type       why parsing stopped
 * @param message    the parser's message
 * @param lineNumber line of the offending construct within its container, 0 if unknown
 */
public record ParseFailure(
	@Nonnull Path file,
	@Nonnull ParseFailureType type,
	@Nonnull String message,
	int lineNumber
) {

	/**
	 * Creates a new ParseFailure with validation.
	 */
	public ParseFailure {
		Objects.requireNonNull(file, "file must not be null");
		Objects.requireNonNull(type, "type must not be null");
		Objects.requireNonNull(message, "message must not be null");
	}

	/**
	 * Kinds of fatal parse failures.
	 */
	public enum ParseFailureType {
		/**
		 * Containers or link texts are nested deeper than the configured limit.
		 */
		TOO_DEEPLY_NESTED,

		/**
		 * Emphasis resolution broke its invariants; this points at a parser defect.
		 */
		MALFORMED_DELIMITER_STATE
	}
}
