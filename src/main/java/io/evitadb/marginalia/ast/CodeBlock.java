package io.evitadb.marginalia.ast;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Fenced code block.
 *
 * @param info           trimmed info string following the opening fence, empty when absent
 * @param value          content lines, each terminated by `\n`; empty when the block has no lines
 * @param sourceLocation span from the opening fence to the closing fence (or the last line of an unclosed block)
 */
public record CodeBlock(
	@Nonnull String info,
	@Nonnull String value,
	@Nonnull SourceLocation sourceLocation
) implements BlockNode {

	public CodeBlock {
		Objects.requireNonNull(info, "info must not be null");
		Objects.requireNonNull(value, "value must not be null");
		Objects.requireNonNull(sourceLocation, "sourceLocation must not be null");
	}

	@Override
	public <R> R accept(@Nonnull BlockVisitor<R> visitor) {
		return visitor.visitCodeBlock(this);
	}
}
