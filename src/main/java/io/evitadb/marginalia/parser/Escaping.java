package io.evitadb.marginalia.parser;

import javax.annotation.Nonnull;

/**
 * Character class helpers shared by the block and inline parsers.
 */
final class Escaping {

	private static final String ASCII_PUNCTUATION = "!\"#$%&'()*+,-./:;<=>?@[\\]^_`{|}~";

	private Escaping() {
	}

	/**
	 * Returns true for the ASCII punctuation characters that a backslash may escape.
	 *
	 * @param ch character to test
	 * @return true if escapable
	 */
	static boolean isAsciiPunctuation(char ch) {
		return ASCII_PUNCTUATION.indexOf(ch) >= 0;
	}

	static boolean isSpaceOrTab(char ch) {
		return ch == ' ' || ch == '\t';
	}

	/**
	 * Resolves backslash escapes; a backslash before anything but ASCII punctuation stays literal.
	 *
	 * @param text text to unescape
	 * @return unescaped text
	 */
	@Nonnull
	static String unescape(@Nonnull String text) {
		if (text.indexOf('\\') < 0) {
			return text;
		}
		final StringBuilder sb = new StringBuilder(text.length());
		for (int i = 0; i < text.length(); i++) {
			final char ch = text.charAt(i);
			if (ch == '\\' && i + 1 < text.length() && isAsciiPunctuation(text.charAt(i + 1))) {
				sb.append(text.charAt(i + 1));
				i++;
			} else {
				sb.append(ch);
			}
		}
		return sb.toString();
	}

	/**
	 * Counts leading space characters (tabs are not counted).
	 *
	 * @param line the line
	 * @return number of leading spaces
	 */
	static int leadingSpaces(@Nonnull String line) {
		int count = 0;
		while (count < line.length() && line.charAt(count) == ' ') {
			count++;
		}
		return count;
	}

	/**
	 * Returns true if every character from {@code from} on is a space or a tab.
	 *
	 * @param line the line
	 * @param from first index to inspect
	 * @return true if the rest of the line is blank
	 */
	static boolean isBlankFrom(@Nonnull String line, int from) {
		for (int i = from; i < line.length(); i++) {
			if (!isSpaceOrTab(line.charAt(i))) {
				return false;
			}
		}
		return true;
	}
}
