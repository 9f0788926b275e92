package io.evitadb.marginalia.ast;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;

/**
 * Inline or reference link. Reference links are resolved during parsing, so both forms look the same here.
 *
 * @param destination    link target with backslash escapes resolved
 * @param title          link title, or null when absent
 * @param children       parsed link text
 * @param sourceLocation span from the opening bracket to the closing parenthesis or bracket
 */
public record Link(
	@Nonnull String destination,
	@Nullable String title,
	@Nonnull List<InlineNode> children,
	@Nonnull SourceLocation sourceLocation
) implements InlineNode {

	public Link {
		Objects.requireNonNull(destination, "destination must not be null");
		Objects.requireNonNull(children, "children must not be null");
		Objects.requireNonNull(sourceLocation, "sourceLocation must not be null");
		children = List.copyOf(children);
	}

	@Override
	public <R> R accept(@Nonnull InlineVisitor<R> visitor) {
		return visitor.visitLink(this);
	}
}
