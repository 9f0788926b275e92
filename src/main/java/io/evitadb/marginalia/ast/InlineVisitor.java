package io.evitadb.marginalia.ast;

import javax.annotation.Nonnull;

/**
 * Visitor over the closed set of inline nodes.
 *
 * @param <R> result type
 */
public interface InlineVisitor<R> {

	R visitText(@Nonnull Text text);

	R visitEmphasis(@Nonnull Emphasis emphasis);

	R visitStrong(@Nonnull Strong strong);

	R visitLink(@Nonnull Link link);

	R visitSoftBreak(@Nonnull SoftBreak softBreak);

	R visitHardBreak(@Nonnull HardBreak hardBreak);

	R visitCodeSpan(@Nonnull CodeSpan codeSpan);
}
