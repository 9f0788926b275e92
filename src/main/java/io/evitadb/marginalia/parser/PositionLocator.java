package io.evitadb.marginalia.parser;

import io.evitadb.marginalia.ast.Position;
import io.evitadb.marginalia.ast.SourceLocation;

import javax.annotation.Nonnull;
import java.util.Arrays;

/**
 * Translates indices of an inline source text into positions of the block's own space.
 *
 * The first character of the text sits at the base position; every line after the first starts at column 1.
 */
final class PositionLocator {

	@Nonnull
	private final Position base;
	@Nonnull
	private final int[] newlines;

	PositionLocator(@Nonnull String text, @Nonnull Position base) {
		this.base = base;
		this.newlines = indexNewlines(text);
	}

	@Nonnull
	private static int[] indexNewlines(@Nonnull String text) {
		int[] found = new int[8];
		int count = 0;
		for (int i = 0; i < text.length(); i++) {
			if (text.charAt(i) == '\n') {
				if (count == found.length) {
					found = Arrays.copyOf(found, count * 2);
				}
				found[count++] = i;
			}
		}
		return Arrays.copyOf(found, count);
	}

	/**
	 * Returns the position of the character at the given index.
	 *
	 * @param index index into the text, may equal its length
	 * @return position in the block's space
	 */
	@Nonnull
	Position at(int index) {
		final int search = Arrays.binarySearch(this.newlines, index);
		// number of newlines strictly before index
		final int before = search >= 0 ? search : -search - 1;
		if (before == 0) {
			return new Position(this.base.line(), this.base.column() + index, this.base.offset() + index);
		}
		final int newline = this.newlines[before - 1];
		return new Position(this.base.line() + before, index - newline, this.base.offset() + index);
	}

	/**
	 * Returns the location spanning the given index range.
	 *
	 * @param start first index
	 * @param end   index just after the last character
	 * @return location in the block's space
	 */
	@Nonnull
	SourceLocation span(int start, int end) {
		return new SourceLocation(at(start), at(end));
	}
}
