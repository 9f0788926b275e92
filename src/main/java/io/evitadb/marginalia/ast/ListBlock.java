package io.evitadb.marginalia.ast;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;

/**
 * Bullet or ordered list. All items share one marker family: the same bullet character, or the same ordered
 * delimiter (`.` or `)`).
 *
 * @param ordered        true for `1.` / `1)` lists
 * @param start          number of the first item for ordered lists, 1 for bullet lists
 * @param tight          false when a blank line separates two items or sits directly inside an item
 * @param children       the items, never empty
 * @param sourceLocation span from the first item's first line to the last item's last line
 */
public record ListBlock(
	boolean ordered,
	int start,
	boolean tight,
	@Nonnull List<ListItem> children,
	@Nonnull SourceLocation sourceLocation
) implements BlockNode {

	/**
	 * Creates a ListBlock with validation and defensive copying.
	 */
	public ListBlock {
		Objects.requireNonNull(children, "children must not be null");
		Objects.requireNonNull(sourceLocation, "sourceLocation must not be null");
		if (children.isEmpty()) {
			throw new IllegalArgumentException("list must have at least one item");
		}
		if (start < 0) {
			throw new IllegalArgumentException("start must be non-negative");
		}
		children = List.copyOf(children);
	}

	@Override
	public <R> R accept(@Nonnull BlockVisitor<R> visitor) {
		return visitor.visitList(this);
	}
}
