package io.evitadb.marginalia.ast;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;

/**
 * One item of a {@link ListBlock}.
 *
 * The children were parsed from the item's content with the marker and the continuation indentation removed, so
 * their positions are relative to that stripped text. {@link #contentMapping()} translates them back into the space
 * this item itself lives in.
 *
 * @param marker         bullet character (`-`, `+`, `*`) or ordered marker with its delimiter (`3.`, `1)`)
 * @param children       blocks parsed from the stripped item content
 * @param sourceLocation span of the item lines, in the parent's space
 * @param contentMapping stripping transform applied to build the item content
 */
public record ListItem(
	@Nonnull String marker,
	@Nonnull List<BlockNode> children,
	@Nonnull SourceLocation sourceLocation,
	@Nonnull ContentMapping contentMapping
) implements BlockNode {

	/**
	 * Creates a ListItem with validation and defensive copying.
	 */
	public ListItem {
		Objects.requireNonNull(marker, "marker must not be null");
		Objects.requireNonNull(children, "children must not be null");
		Objects.requireNonNull(sourceLocation, "sourceLocation must not be null");
		Objects.requireNonNull(contentMapping, "contentMapping must not be null");
		children = List.copyOf(children);
	}

	/**
	 * Returns a copy of this item with different children.
	 *
	 * @param blocks the new children
	 * @return new list item instance
	 */
	@Nonnull
	public ListItem withChildren(@Nonnull List<BlockNode> blocks) {
		return new ListItem(this.marker, blocks, this.sourceLocation, this.contentMapping);
	}

	@Override
	public <R> R accept(@Nonnull BlockVisitor<R> visitor) {
		return visitor.visitListItem(this);
	}
}
