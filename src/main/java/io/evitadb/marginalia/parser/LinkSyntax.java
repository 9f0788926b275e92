package io.evitadb.marginalia.parser;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Link destination and title grammar shared by inline links and reference definitions.
 */
final class LinkSyntax {

	private LinkSyntax() {
	}

	/**
	 * Parses a link destination starting at {@code from}: either `<...>` or a run of non-whitespace characters with
	 * balanced parentheses.
	 *
	 * @param text the text
	 * @param from index of the first destination character
	 * @return parsed destination and the index after it, or null when there is no valid destination
	 */
	@Nullable
	static Parsed parseDestination(@Nonnull String text, int from) {
		if (from >= text.length()) {
			return null;
		}
		final StringBuilder destination = new StringBuilder();
		if (text.charAt(from) == '<') {
			int i = from + 1;
			while (i < text.length()) {
				final char ch = text.charAt(i);
				if (ch == '>') {
					return new Parsed(destination.toString(), i + 1);
				}
				if (ch == '<' || ch == '\n') {
					return null;
				}
				if (ch == '\\' && i + 1 < text.length() && Escaping.isAsciiPunctuation(text.charAt(i + 1))) {
					destination.append(text.charAt(i + 1));
					i += 2;
					continue;
				}
				destination.append(ch);
				i++;
			}
			return null;
		}

		int i = from;
		int parenDepth = 0;
		while (i < text.length()) {
			final char ch = text.charAt(i);
			if (ch == ' ' || ch == '\t' || ch == '\n' || Character.isISOControl(ch)) {
				break;
			}
			if (ch == '\\' && i + 1 < text.length() && Escaping.isAsciiPunctuation(text.charAt(i + 1))) {
				destination.append(text.charAt(i + 1));
				i += 2;
				continue;
			}
			if (ch == '(') {
				parenDepth++;
			} else if (ch == ')') {
				if (parenDepth == 0) {
					break;
				}
				parenDepth--;
			}
			destination.append(ch);
			i++;
		}
		if (i == from || parenDepth != 0) {
			return null;
		}
		return new Parsed(destination.toString(), i);
	}

	/**
	 * Parses a link title in double quotes, single quotes or parentheses starting at {@code from}.
	 *
	 * @param text the text
	 * @param from index of the opening quote
	 * @return parsed title and the index after the closing quote, or null
	 */
	@Nullable
	static Parsed parseTitle(@Nonnull String text, int from) {
		if (from >= text.length()) {
			return null;
		}
		final char open = text.charAt(from);
		final char close;
		if (open == '"' || open == '\'') {
			close = open;
		} else if (open == '(') {
			close = ')';
		} else {
			return null;
		}

		final StringBuilder title = new StringBuilder();
		int i = from + 1;
		while (i < text.length()) {
			final char ch = text.charAt(i);
			if (ch == '\\' && i + 1 < text.length() && Escaping.isAsciiPunctuation(text.charAt(i + 1))) {
				title.append(text.charAt(i + 1));
				i += 2;
				continue;
			}
			if (ch == close) {
				return new Parsed(title.toString(), i + 1);
			}
			if (open == '(' && ch == '(') {
				return null;
			}
			title.append(ch);
			i++;
		}
		return null;
	}

	/**
	 * Parses the `(destination "title")` tail of an inline link.
	 *
	 * @param text the text
	 * @param open index of the opening parenthesis
	 * @return destination, optional title and the index after the closing parenthesis, or null
	 */
	@Nullable
	static InlineLinkTail parseInlineLinkTail(@Nonnull String text, int open) {
		if (open >= text.length() || text.charAt(open) != '(') {
			return null;
		}
		int i = skipWhitespace(text, open + 1);
		if (i >= text.length()) {
			return null;
		}
		if (text.charAt(i) == ')') {
			return new InlineLinkTail("", null, i + 1);
		}

		final Parsed destination = parseDestination(text, i);
		if (destination == null) {
			return null;
		}
		i = destination.end();

		String title = null;
		final int afterWhitespace = skipWhitespace(text, i);
		if (afterWhitespace > i) {
			final Parsed parsedTitle = parseTitle(text, afterWhitespace);
			if (parsedTitle != null) {
				title = parsedTitle.value();
				i = skipWhitespace(text, parsedTitle.end());
			} else {
				i = afterWhitespace;
			}
		}

		if (i >= text.length() || text.charAt(i) != ')') {
			return null;
		}
		return new InlineLinkTail(destination.value(), title, i + 1);
	}

	private static int skipWhitespace(@Nonnull String text, int from) {
		int i = from;
		while (i < text.length() && (Escaping.isSpaceOrTab(text.charAt(i)) || text.charAt(i) == '\n')) {
			i++;
		}
		return i;
	}

	/**
	 * A parsed piece of link syntax.
	 *
	 * @param value unescaped value
	 * @param end   index just after the parsed syntax
	 */
	record Parsed(@Nonnull String value, int end) {
	}

	/**
	 * Parsed inline link tail.
	 *
	 * @param destination link destination
	 * @param title       link title or null
	 * @param end         index just after the closing parenthesis
	 */
	record InlineLinkTail(@Nonnull String destination, @Nullable String title, int end) {
	}
}
