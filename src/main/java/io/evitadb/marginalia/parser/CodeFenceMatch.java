package io.evitadb.marginalia.parser;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Result of matching an opening code fence.
 *
 * @param indent      spaces before the fence, removed from content lines as well
 * @param fenceChar   backtick or tilde
 * @param fenceLength number of fence characters; a closing fence must be at least as long
 * @param info        trimmed info string
 */
public record CodeFenceMatch(int indent, char fenceChar, int fenceLength, @Nonnull String info) {

	public CodeFenceMatch {
		Objects.requireNonNull(info, "info must not be null");
	}
}
