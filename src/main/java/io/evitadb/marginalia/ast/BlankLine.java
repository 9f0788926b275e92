package io.evitadb.marginalia.ast;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * A line containing only spaces and tabs.
 *
 * @param sourceLocation span of the line
 */
public record BlankLine(@Nonnull SourceLocation sourceLocation) implements BlockNode {

	public BlankLine {
		Objects.requireNonNull(sourceLocation, "sourceLocation must not be null");
	}

	@Override
	public <R> R accept(@Nonnull BlockVisitor<R> visitor) {
		return visitor.visitBlankLine(this);
	}
}
