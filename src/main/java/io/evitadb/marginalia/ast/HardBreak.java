package io.evitadb.marginalia.ast;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Line break forced by two trailing spaces or a trailing backslash.
 *
 * @param sourceLocation span of the line ending character
 */
public record HardBreak(@Nonnull SourceLocation sourceLocation) implements InlineNode {

	public HardBreak {
		Objects.requireNonNull(sourceLocation, "sourceLocation must not be null");
	}

	@Override
	public <R> R accept(@Nonnull InlineVisitor<R> visitor) {
		return visitor.visitHardBreak(this);
	}
}
