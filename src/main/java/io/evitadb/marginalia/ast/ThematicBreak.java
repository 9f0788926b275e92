package io.evitadb.marginalia.ast;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Horizontal rule (`---`, `***`, `___`).
 *
 * @param sourceLocation span of the line
 */
public record ThematicBreak(@Nonnull SourceLocation sourceLocation) implements BlockNode {

	public ThematicBreak {
		Objects.requireNonNull(sourceLocation, "sourceLocation must not be null");
	}

	@Override
	public <R> R accept(@Nonnull BlockVisitor<R> visitor) {
		return visitor.visitThematicBreak(this);
	}
}
