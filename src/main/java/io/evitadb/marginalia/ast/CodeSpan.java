package io.evitadb.marginalia.ast;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Inline code (`` `code` ``).
 *
 * @param value          content with line endings turned into spaces and one padding space stripped on each side
 * @param sourceLocation span including the backtick fences
 */
public record CodeSpan(
	@Nonnull String value,
	@Nonnull SourceLocation sourceLocation
) implements InlineNode {

	public CodeSpan {
		Objects.requireNonNull(value, "value must not be null");
		Objects.requireNonNull(sourceLocation, "sourceLocation must not be null");
	}

	@Override
	public <R> R accept(@Nonnull InlineVisitor<R> visitor) {
		return visitor.visitCodeSpan(this);
	}
}
