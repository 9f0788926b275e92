package io.evitadb.marginalia.ast;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;

/**
 * Stripping transform of a container block.
 *
 * A list item or block quote builds its content by taking a suffix of each of its lines (the marker, the
 * continuation indentation or the lazy-continuation indentation is dropped) and joining those suffixes with `\n`.
 * This record remembers, for every line of that stripped text, where it came from in the container's own space, so
 * positions of nested nodes can be composed back up to the document.
 *
 * @param lines one entry per line of the stripped text, in order
 */
public record ContentMapping(@Nonnull List<StrippedLine> lines) {

	/**
	 * Creates a ContentMapping with validation and defensive copying.
	 */
	public ContentMapping {
		Objects.requireNonNull(lines, "lines must not be null");
		if (lines.isEmpty()) {
			throw new IllegalArgumentException("mapping must cover at least one line");
		}
		lines = List.copyOf(lines);
	}

	/**
	 * Translates a position of the stripped text into the parent space.
	 *
	 * @param position position relative to the stripped text
	 * @return the same character's position in the parent space
	 */
	@Nonnull
	public Position toParent(@Nonnull Position position) {
		Objects.requireNonNull(position, "position must not be null");
		final int index = position.line() - 1;
		if (index >= this.lines.size()) {
			throw new IllegalArgumentException(
				"line " + position.line() + " is outside the mapped content of " + this.lines.size() + " lines"
			);
		}
		final StrippedLine line = this.lines.get(index);
		return new Position(
			line.parentLine(),
			line.removedPrefix() + position.column(),
			line.parentOffset() + line.removedPrefix() + (position.column() - 1)
		);
	}

	/**
	 * Translates a location of the stripped text into the parent space.
	 *
	 * @param location location relative to the stripped text
	 * @return the location in the parent space
	 */
	@Nonnull
	public SourceLocation toParent(@Nonnull SourceLocation location) {
		return new SourceLocation(toParent(location.start()), toParent(location.end()));
	}

	/**
	 * Translates a bare offset of the stripped text into the parent space.
	 *
	 * @param offset offset relative to the stripped text
	 * @return the offset in the parent space
	 */
	public int toParentOffset(int offset) {
		if (offset < 0) {
			throw new IllegalArgumentException("offset must be non-negative");
		}
		int low = 0;
		int high = this.lines.size() - 1;
		while (low < high) {
			final int mid = (low + high + 1) >>> 1;
			if (this.lines.get(mid).subOffset() <= offset) {
				low = mid;
			} else {
				high = mid - 1;
			}
		}
		final StrippedLine line = this.lines.get(low);
		return line.parentOffset() + line.removedPrefix() + (offset - line.subOffset());
	}

	/**
	 * One line of stripped content.
	 *
	 * @param subOffset     offset of the line start within the stripped text
	 * @param parentOffset  offset of the original line start in the parent space
	 * @param parentLine    line number of the original line in the parent space
	 * @param removedPrefix number of characters dropped from the front of the original line
	 */
	public record StrippedLine(int subOffset, int parentOffset, int parentLine, int removedPrefix) {

		public StrippedLine {
			if (subOffset < 0 || parentOffset < 0 || removedPrefix < 0) {
				throw new IllegalArgumentException("offsets must be non-negative");
			}
			if (parentLine < 1) {
				throw new IllegalArgumentException("parentLine must be >= 1");
			}
		}
	}
}
