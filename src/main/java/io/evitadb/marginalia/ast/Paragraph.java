package io.evitadb.marginalia.ast;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;

/**
 * Run of consecutive text lines not claimed by any other block construct.
 *
 * @param rawContent     the paragraph lines joined with `\n`, exactly as they appear in the source
 * @param contentStart   position of the first character of {@code rawContent}
 * @param children       parsed inline content, empty until inline parsing ran
 * @param sourceLocation span of the paragraph lines
 */
public record Paragraph(
	@Nonnull String rawContent,
	@Nonnull Position contentStart,
	@Nonnull List<InlineNode> children,
	@Nonnull SourceLocation sourceLocation
) implements BlockNode {

	/**
	 * Creates a Paragraph with validation and defensive copying.
	 */
	public Paragraph {
		Objects.requireNonNull(rawContent, "rawContent must not be null");
		Objects.requireNonNull(contentStart, "contentStart must not be null");
		Objects.requireNonNull(children, "children must not be null");
		Objects.requireNonNull(sourceLocation, "sourceLocation must not be null");
		children = List.copyOf(children);
	}

	/**
	 * Returns a copy of this paragraph with the given inline children.
	 *
	 * @param inlines the parsed inline content
	 * @return new paragraph instance
	 */
	@Nonnull
	public Paragraph withChildren(@Nonnull List<InlineNode> inlines) {
		return new Paragraph(this.rawContent, this.contentStart, inlines, this.sourceLocation);
	}

	@Override
	public <R> R accept(@Nonnull BlockVisitor<R> visitor) {
		return visitor.visitParagraph(this);
	}
}
