package io.evitadb.marginalia.parser;

import javax.annotation.Nonnull;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Normalization of link labels used as keys of the reference map.
 */
public final class LinkLabels {

	private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

	private LinkLabels() {
	}

	/**
	 * Normalizes a link label: trims it, collapses every internal whitespace run to a single space and case-folds
	 * the result. Two labels match when their normalized forms are equal.
	 *
	 * Case folding goes through upper case first so that characters like `ß` fold to `ss`.
	 *
	 * @param label the label as written
	 * @return normalized lookup key, empty for a blank label
	 */
	@Nonnull
	public static String normalize(@Nonnull String label) {
		Objects.requireNonNull(label, "label must not be null");
		final String collapsed = WHITESPACE_RUN.matcher(label.strip()).replaceAll(" ");
		return collapsed.toUpperCase(Locale.ROOT).toLowerCase(Locale.ROOT);
	}
}
