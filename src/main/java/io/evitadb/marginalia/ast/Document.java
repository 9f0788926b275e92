package io.evitadb.marginalia.ast;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;

/**
 * Root of a parsed markdown tree.
 *
 * The document keeps the text it was parsed from, so that the span of every top-level node can be sliced from it
 * directly. Nested nodes need their container's {@link ContentMapping} first.
 *
 * @param children       top-level blocks in line order
 * @param sourceLocation span of the whole input
 * @param source         the input text
 */
public record Document(
	@Nonnull List<BlockNode> children,
	@Nonnull SourceLocation sourceLocation,
	@Nonnull String source
) implements Node {

	/**
	 * Creates a Document with validation and defensive copying.
	 */
	public Document {
		Objects.requireNonNull(children, "children must not be null");
		Objects.requireNonNull(sourceLocation, "sourceLocation must not be null");
		Objects.requireNonNull(source, "source must not be null");
		children = List.copyOf(children);
	}
}
