package io.evitadb.marginalia.parser;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Splits text into {@link Line lines} on `\n`.
 *
 * The scanner does not classify anything. A text that ends with a newline produces a final empty, unterminated
 * line; the empty text produces a single empty line.
 */
public final class LineScanner {

	private LineScanner() {
	}

	/**
	 * Splits the given text into lines.
	 *
	 * @param text the text to split
	 * @return lines in order, never empty
	 */
	@Nonnull
	public static List<Line> scan(@Nonnull String text) {
		Objects.requireNonNull(text, "text must not be null");

		final List<Line> lines = new ArrayList<>();
		int offset = 0;
		int lineNumber = 1;
		while (true) {
			final int newline = text.indexOf('\n', offset);
			if (newline < 0) {
				lines.add(new Line(text.substring(offset), lineNumber, offset, false));
				return lines;
			}
			lines.add(new Line(text.substring(offset, newline), lineNumber, offset, true));
			offset = newline + 1;
			lineNumber++;
		}
	}
}
