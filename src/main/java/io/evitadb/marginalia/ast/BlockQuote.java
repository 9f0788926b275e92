package io.evitadb.marginalia.ast;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;

/**
 * Block quote (`> ...`).
 *
 * The children were parsed from the quote content with every `>` marker removed, so their positions are relative to
 * that stripped text; {@link #contentMapping()} translates them back.
 *
 * @param children       blocks parsed from the stripped quote content
 * @param sourceLocation span of the quote lines, in the parent's space
 * @param contentMapping stripping transform applied to build the quote content
 */
public record BlockQuote(
	@Nonnull List<BlockNode> children,
	@Nonnull SourceLocation sourceLocation,
	@Nonnull ContentMapping contentMapping
) implements BlockNode {

	/**
	 * Creates a BlockQuote with validation and defensive copying.
	 */
	public BlockQuote {
		Objects.requireNonNull(children, "children must not be null");
		Objects.requireNonNull(sourceLocation, "sourceLocation must not be null");
		Objects.requireNonNull(contentMapping, "contentMapping must not be null");
		children = List.copyOf(children);
	}

	/**
	 * Returns a copy of this quote with different children.
	 *
	 * @param blocks the new children
	 * @return new block quote instance
	 */
	@Nonnull
	public BlockQuote withChildren(@Nonnull List<BlockNode> blocks) {
		return new BlockQuote(blocks, this.sourceLocation, this.contentMapping);
	}

	@Override
	public <R> R accept(@Nonnull BlockVisitor<R> visitor) {
		return visitor.visitBlockQuote(this);
	}
}
