package io.evitadb.marginalia.parser;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Result of matching an ATX heading line.
 *
 * @param level        number of opening hashes, 1-6
 * @param contentStart index of the first content character in the line
 * @param content      heading text without opening/closing hash runs and surrounding whitespace
 */
public record AtxHeadingMatch(int level, int contentStart, @Nonnull String content) {

	public AtxHeadingMatch {
		Objects.requireNonNull(content, "content must not be null");
	}
}
