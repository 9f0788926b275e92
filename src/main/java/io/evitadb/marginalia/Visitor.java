package io.evitadb.marginalia;

import javax.annotation.Nonnull;
import java.nio.file.Path;

/**
 * Callback receiving the contents of every markdown file a {@link Traverser} matched.
 */
@FunctionalInterface
public interface Visitor {
	/**
	 * Called for each file that matches the configured pattern.
	 *
	 * @param file    path to the file that matched
	 * @param content full textual contents of the file
	 */
	void visit(@Nonnull Path file, @Nonnull String content);
}
