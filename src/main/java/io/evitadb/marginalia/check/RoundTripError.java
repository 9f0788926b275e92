package io.evitadb.marginalia.check;

import javax.annotation.Nonnull;
import java.nio.file.Path;
import java.util.Objects;

/**
 * A file whose canonical re-serialization parses into a different structure.
 *
 * @param file         the file
 * @param outlineLine  1-based line of the first difference between the two outlines
 * @param expected     that outline line for the original parse
 * @param actual       that outline line for the re-parsed canonical form
 */
public record RoundTripError(
	@Nonnull Path file,
	int outlineLine,
	@Nonnull String expected,
	@Nonnull String actual
) {

	/**
	 * Creates a new RoundTripError with validation.
	 */
	public RoundTripError {
		Objects.requireNonNull(file, "file must not be null");
		Objects.requireNonNull(expected, "expected must not be null");
		Objects.requireNonNull(actual, "actual must not be null");
		if (outlineLine < 1) {
			throw new IllegalArgumentException("outlineLine must be >= 1");
		}
	}
}
