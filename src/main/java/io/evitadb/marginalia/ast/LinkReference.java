package io.evitadb.marginalia.ast;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Link reference definition (`[label]: /destination "title"`) collected while parsing blocks.
 *
 * @param label       the label as written, original case
 * @param destination the destination with backslash escapes resolved
 * @param title       the title, or null when absent
 */
public record LinkReference(
	@Nonnull String label,
	@Nonnull String destination,
	@Nullable String title
) {

	public LinkReference {
		Objects.requireNonNull(label, "label must not be null");
		Objects.requireNonNull(destination, "destination must not be null");
	}
}
