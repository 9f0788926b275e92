package io.evitadb.marginalia.parser;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Result of matching a list item marker line.
 *
 * @param indent        spaces before the marker
 * @param ordered       true for numbered markers
 * @param delimiter     bullet character for bullet items, `.` or `)` for ordered items
 * @param number        item number for ordered items, 0 for bullets
 * @param marker        the marker as written without indentation (`-`, `12.`)
 * @param contentColumn 0-based column where item content starts; continuation lines need this much indentation
 * @param contentStart  index in the line where the first line's content starts
 * @param empty         true when the marker line carries no content
 */
public record ListItemMatch(
	int indent,
	boolean ordered,
	char delimiter,
	int number,
	@Nonnull String marker,
	int contentColumn,
	int contentStart,
	boolean empty
) {

	public ListItemMatch {
		Objects.requireNonNull(marker, "marker must not be null");
	}

	/**
	 * Returns true when the other item can continue the same list as this one.
	 *
	 * @param other another item marker
	 * @return true if both are bullets with the same character, or both ordered with the same delimiter
	 */
	public boolean sameFamily(@Nonnull ListItemMatch other) {
		return this.ordered == other.ordered && this.delimiter == other.delimiter;
	}
}
