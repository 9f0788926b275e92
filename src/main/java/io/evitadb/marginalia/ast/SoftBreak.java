package io.evitadb.marginalia.ast;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Line ending inside a paragraph that is not a hard break.
 *
 * @param sourceLocation span of the line ending character
 */
public record SoftBreak(@Nonnull SourceLocation sourceLocation) implements InlineNode {

	public SoftBreak {
		Objects.requireNonNull(sourceLocation, "sourceLocation must not be null");
	}

	@Override
	public <R> R accept(@Nonnull InlineVisitor<R> visitor) {
		return visitor.visitSoftBreak(this);
	}
}
