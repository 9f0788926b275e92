package io.evitadb.marginalia.ast;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;

/**
 * ATX heading (`# Title`).
 *
 * @param level          number of opening `#` characters, 1-6
 * @param rawContent     inline source with the opening and closing hash runs and surrounding spaces removed
 * @param contentStart   position of the first character of {@code rawContent}
 * @param children       parsed inline content, empty until inline parsing ran
 * @param sourceLocation span of the heading line
 */
public record Heading(
	int level,
	@Nonnull String rawContent,
	@Nonnull Position contentStart,
	@Nonnull List<InlineNode> children,
	@Nonnull SourceLocation sourceLocation
) implements BlockNode {

	/**
	 * Creates a Heading with validation and defensive copying.
	 */
	public Heading {
		if (level < 1 || level > 6) {
			throw new IllegalArgumentException("level must be 1-6");
		}
		Objects.requireNonNull(rawContent, "rawContent must not be null");
		Objects.requireNonNull(contentStart, "contentStart must not be null");
		Objects.requireNonNull(children, "children must not be null");
		Objects.requireNonNull(sourceLocation, "sourceLocation must not be null");
		children = List.copyOf(children);
	}

	/**
	 * Returns a copy of this heading with the given inline children.
	 *
	 * @param inlines the parsed inline content
	 * @return new heading instance
	 */
	@Nonnull
	public Heading withChildren(@Nonnull List<InlineNode> inlines) {
		return new Heading(this.level, this.rawContent, this.contentStart, inlines, this.sourceLocation);
	}

	@Override
	public <R> R accept(@Nonnull BlockVisitor<R> visitor) {
		return visitor.visitHeading(this);
	}
}
