package io.evitadb.marginalia.parser;

import javax.annotation.Nonnull;

/**
 * Limits applied by {@link MarkdownParser}.
 *
 * @param maxNestingDepth maximum number of nested containers (list items, block quotes) and nested link texts
 */
public record ParserOptions(int maxNestingDepth) {

	public static final int DEFAULT_MAX_NESTING_DEPTH = 64;

	/**
	 * Creates ParserOptions with validation.
	 */
	public ParserOptions {
		if (maxNestingDepth < 1) {
			throw new IllegalArgumentException("maxNestingDepth must be >= 1");
		}
	}

	/**
	 * Returns the default options.
	 *
	 * @return options with the default nesting limit
	 */
	@Nonnull
	public static ParserOptions defaults() {
		return new ParserOptions(DEFAULT_MAX_NESTING_DEPTH);
	}
}
