package io.evitadb.marginalia.ast;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Literal text run. Escapes are already resolved, so the value may be shorter than its span.
 *
 * @param value          the literal characters
 * @param sourceLocation span of the characters in the source
 */
public record Text(
	@Nonnull String value,
	@Nonnull SourceLocation sourceLocation
) implements InlineNode {

	public Text {
		Objects.requireNonNull(value, "value must not be null");
		Objects.requireNonNull(sourceLocation, "sourceLocation must not be null");
	}

	@Override
	public <R> R accept(@Nonnull InlineVisitor<R> visitor) {
		return visitor.visitText(this);
	}
}
