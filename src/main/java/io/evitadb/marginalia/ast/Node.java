package io.evitadb.marginalia.ast;

import javax.annotation.Nonnull;

/**
 * Common supertype of every node in a parsed markdown tree.
 */
public interface Node {

	/**
	 * Returns the span of this node in the text it was parsed from.
	 *
	 * @return source location, never null
	 */
	@Nonnull
	SourceLocation sourceLocation();
}
