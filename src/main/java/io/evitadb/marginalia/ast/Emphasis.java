package io.evitadb.marginalia.ast;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;

/**
 * Emphasis (`*text*` or `_text_`).
 *
 * @param children       the wrapped inline content
 * @param sourceLocation span including the delimiter characters on both sides
 */
public record Emphasis(
	@Nonnull List<InlineNode> children,
	@Nonnull SourceLocation sourceLocation
) implements InlineNode {

	public Emphasis {
		Objects.requireNonNull(children, "children must not be null");
		Objects.requireNonNull(sourceLocation, "sourceLocation must not be null");
		children = List.copyOf(children);
	}

	@Override
	public <R> R accept(@Nonnull InlineVisitor<R> visitor) {
		return visitor.visitEmphasis(this);
	}
}
