package io.evitadb.marginalia.parser;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Result of matching a link reference definition.
 *
 * @param label         label as written
 * @param destination   destination with escapes resolved
 * @param title         title, or null
 * @param linesConsumed 1, or 2 when the title sits on the following line
 */
public record LinkReferenceMatch(
	@Nonnull String label,
	@Nonnull String destination,
	@Nullable String title,
	int linesConsumed
) {

	public LinkReferenceMatch {
		Objects.requireNonNull(label, "label must not be null");
		Objects.requireNonNull(destination, "destination must not be null");
		if (linesConsumed < 1 || linesConsumed > 2) {
			throw new IllegalArgumentException("linesConsumed must be 1 or 2");
		}
	}
}
