package io.evitadb.marginalia.parser;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Pure, stateless matchers testing a single line against the grammar of each block construct.
 *
 * Every matcher returns a match record describing what the line contains, or null when the line does not introduce
 * that construct. None of them tracks positions; the {@link BlockParser} does that.
 */
public final class BlockClassifiers {

	private static final int MAX_INDENT = 3;
	private static final int MAX_LABEL_LENGTH = 999;

	private BlockClassifiers() {
	}

	/**
	 * Classifies the line by the first single-line construct it introduces. Link reference definitions are not
	 * covered, use {@link #matchLinkReferenceDefinition(String, String)} before calling this method.
	 *
	 * @param line the line without its newline
	 * @return kind of the block the line introduces
	 */
	@Nonnull
	public static BlockKind classify(@Nonnull String line) {
		if (isBlank(line)) {
			return BlockKind.BLANK;
		} else if (matchAtxHeading(line) != null) {
			return BlockKind.ATX_HEADING;
		} else if (matchThematicBreak(line) != null) {
			return BlockKind.THEMATIC_BREAK;
		} else if (matchCodeFence(line) != null) {
			return BlockKind.CODE_FENCE;
		} else if (matchBlockQuote(line) != null) {
			return BlockKind.BLOCK_QUOTE;
		} else if (matchListItem(line) != null) {
			return BlockKind.LIST_ITEM;
		} else {
			return BlockKind.PARAGRAPH;
		}
	}

	/**
	 * Returns true when the line contains only spaces and tabs.
	 *
	 * @param line the line
	 * @return true for a blank line
	 */
	public static boolean isBlank(@Nonnull String line) {
		return Escaping.isBlankFrom(line, 0);
	}

	/**
	 * Matches an ATX heading: up to three spaces of indentation, one to six `#` and then a space, a tab or the end of
	 * the line.
	 *
	 * @param line the line
	 * @return heading match or null
	 */
	@Nullable
	public static AtxHeadingMatch matchAtxHeading(@Nonnull String line) {
		final int indent = Escaping.leadingSpaces(line);
		if (indent > MAX_INDENT) {
			return null;
		}
		int i = indent;
		while (i < line.length() && line.charAt(i) == '#') {
			i++;
		}
		final int level = i - indent;
		if (level < 1 || level > 6) {
			return null;
		}
		if (i < line.length() && !Escaping.isSpaceOrTab(line.charAt(i))) {
			return null;
		}

		int start = i;
		while (start < line.length() && Escaping.isSpaceOrTab(line.charAt(start))) {
			start++;
		}
		int end = line.length();
		while (end > start && Escaping.isSpaceOrTab(line.charAt(end - 1))) {
			end--;
		}

		// optional closing sequence
		int hashStart = end;
		while (hashStart > start && line.charAt(hashStart - 1) == '#') {
			hashStart--;
		}
		if (hashStart < end && (hashStart == start || Escaping.isSpaceOrTab(line.charAt(hashStart - 1)))) {
			end = hashStart;
			while (end > start && Escaping.isSpaceOrTab(line.charAt(end - 1))) {
				end--;
			}
		}
		if (end == start) {
			// empty heading, content start points at the end of the opening run
			return new AtxHeadingMatch(level, i, "");
		}
		return new AtxHeadingMatch(level, start, line.substring(start, end));
	}

	/**
	 * Matches a thematic break: up to three spaces and at least three of one of `-`, `*` or `_`, optionally separated
	 * by spaces or tabs, and nothing else.
	 *
	 * @param line the line
	 * @return thematic break match or null
	 */
	@Nullable
	public static ThematicBreakMatch matchThematicBreak(@Nonnull String line) {
		final int indent = Escaping.leadingSpaces(line);
		if (indent > MAX_INDENT || indent >= line.length()) {
			return null;
		}
		final char ch = line.charAt(indent);
		if (ch != '-' && ch != '*' && ch != '_') {
			return null;
		}
		int count = 0;
		for (int i = indent; i < line.length(); i++) {
			final char current = line.charAt(i);
			if (current == ch) {
				count++;
			} else if (!Escaping.isSpaceOrTab(current)) {
				return null;
			}
		}
		return count >= 3 ? new ThematicBreakMatch(ch, count) : null;
	}

	/**
	 * Matches an opening code fence: up to three spaces and at least three backticks or tildes followed by an optional
	 * info string. A backtick fence rejects info strings containing a backtick.
	 *
	 * @param line the line
	 * @return fence match or null
	 */
	@Nullable
	public static CodeFenceMatch matchCodeFence(@Nonnull String line) {
		final int indent = Escaping.leadingSpaces(line);
		if (indent > MAX_INDENT || indent >= line.length()) {
			return null;
		}
		final char ch = line.charAt(indent);
		if (ch != '`' && ch != '~') {
			return null;
		}
		int i = indent;
		while (i < line.length() && line.charAt(i) == ch) {
			i++;
		}
		final int length = i - indent;
		if (length < 3) {
			return null;
		}
		final String info = line.substring(i).strip();
		if (ch == '`' && info.indexOf('`') >= 0) {
			return null;
		}
		return new CodeFenceMatch(indent, ch, length, Escaping.unescape(info));
	}

	/**
	 * Returns true when the line closes a fence opened with the given character and length: up to three spaces, at
	 * least {@code minLength} fence characters and trailing whitespace only.
	 *
	 * @param line      the line
	 * @param fenceChar backtick or tilde
	 * @param minLength length of the opening fence
	 * @return true for a closing fence
	 */
	public static boolean isClosingFence(@Nonnull String line, char fenceChar, int minLength) {
		final int indent = Escaping.leadingSpaces(line);
		if (indent > MAX_INDENT) {
			return false;
		}
		int i = indent;
		while (i < line.length() && line.charAt(i) == fenceChar) {
			i++;
		}
		return i - indent >= minLength && Escaping.isBlankFrom(line, i);
	}

	/**
	 * Matches a block quote marker: up to three spaces, `>` and one optional space.
	 *
	 * @param line the line
	 * @return match carrying the marker length or null
	 */
	@Nullable
	public static BlockQuoteMatch matchBlockQuote(@Nonnull String line) {
		final int indent = Escaping.leadingSpaces(line);
		if (indent > MAX_INDENT || indent >= line.length() || line.charAt(indent) != '>') {
			return null;
		}
		int markerLength = indent + 1;
		if (markerLength < line.length() && line.charAt(markerLength) == ' ') {
			markerLength++;
		}
		return new BlockQuoteMatch(markerLength);
	}

	/**
	 * Matches a list item marker: a bullet `-`, `+`, `*` or one to nine digits followed by `.` or `)`, then either the
	 * end of the line (an empty item) or at least one space.
	 *
	 * One to four spaces after the marker belong to the marker and define the content column. Five or more mean the
	 * content is indented code-like text and only one space counts.
	 *
	 * @param line the line
	 * @return list item match or null
	 */
	@Nullable
	public static ListItemMatch matchListItem(@Nonnull String line) {
		final int indent = Escaping.leadingSpaces(line);
		if (indent > MAX_INDENT || indent >= line.length()) {
			return null;
		}

		final char first = line.charAt(indent);
		final boolean ordered;
		final char delimiter;
		final int number;
		final int markerEnd;
		if (first == '-' || first == '+' || first == '*') {
			ordered = false;
			delimiter = first;
			number = 0;
			markerEnd = indent + 1;
		} else if (first >= '0' && first <= '9') {
			int i = indent;
			while (i < line.length() && i - indent < 10 && line.charAt(i) >= '0' && line.charAt(i) <= '9') {
				i++;
			}
			final int digits = i - indent;
			if (digits > 9 || i >= line.length() || (line.charAt(i) != '.' && line.charAt(i) != ')')) {
				return null;
			}
			ordered = true;
			delimiter = line.charAt(i);
			number = Integer.parseInt(line.substring(indent, i));
			markerEnd = i + 1;
		} else {
			return null;
		}

		final String marker = line.substring(indent, markerEnd);
		if (Escaping.isBlankFrom(line, markerEnd)) {
			return new ListItemMatch(indent, ordered, delimiter, number, marker, markerEnd + 1, line.length(), true);
		}
		final int spaces = Escaping.leadingSpaces(line.substring(markerEnd));
		if (spaces == 0) {
			return null;
		}
		final int contentColumn = spaces <= 4 ? markerEnd + spaces : markerEnd + 1;
		return new ListItemMatch(indent, ordered, delimiter, number, marker, contentColumn, contentColumn, false);
	}

	/**
	 * Matches a link reference definition `[label]: destination "title"`. The title may sit alone on the following
	 * line, in which case the match consumes two lines.
	 *
	 * @param line     the line
	 * @param nextLine the following line or null at the end of input
	 * @return definition match or null
	 */
	@Nullable
	public static LinkReferenceMatch matchLinkReferenceDefinition(@Nonnull String line, @Nullable String nextLine) {
		final int indent = Escaping.leadingSpaces(line);
		if (indent > MAX_INDENT || indent >= line.length() || line.charAt(indent) != '[') {
			return null;
		}

		int i = indent + 1;
		final int labelStart = i;
		while (i < line.length() && line.charAt(i) != ']') {
			final char ch = line.charAt(i);
			if (ch == '[') {
				return null;
			}
			if (ch == '\\' && i + 1 < line.length()) {
				i++;
			}
			i++;
		}
		if (i >= line.length()) {
			return null;
		}
		final String label = line.substring(labelStart, i);
		if (label.isEmpty() || label.length() > MAX_LABEL_LENGTH || isBlank(label)) {
			return null;
		}
		i++;
		if (i >= line.length() || line.charAt(i) != ':') {
			return null;
		}
		i++;

		final int destinationStart = skipSpaceOrTab(line, i);
		if (destinationStart == i) {
			return null;
		}
		final LinkSyntax.Parsed destination = LinkSyntax.parseDestination(line, destinationStart);
		if (destination == null) {
			return null;
		}

		final int titleStart = skipSpaceOrTab(line, destination.end());
		if (titleStart >= line.length()) {
			// no title on this line; it may follow on the next one
			if (nextLine != null) {
				final LinkSyntax.Parsed title = parseStandaloneTitle(nextLine);
				if (title != null) {
					return new LinkReferenceMatch(label, destination.value(), title.value(), 2);
				}
			}
			return new LinkReferenceMatch(label, destination.value(), null, 1);
		}
		if (titleStart == destination.end()) {
			return null;
		}
		final LinkSyntax.Parsed title = LinkSyntax.parseTitle(line, titleStart);
		if (title == null || !Escaping.isBlankFrom(line, title.end())) {
			return null;
		}
		return new LinkReferenceMatch(label, destination.value(), title.value(), 1);
	}

	@Nullable
	private static LinkSyntax.Parsed parseStandaloneTitle(@Nonnull String line) {
		final int start = skipSpaceOrTab(line, 0);
		final LinkSyntax.Parsed title = LinkSyntax.parseTitle(line, start);
		if (title == null || !Escaping.isBlankFrom(line, title.end())) {
			return null;
		}
		return title;
	}

	private static int skipSpaceOrTab(@Nonnull String line, int from) {
		int i = from;
		while (i < line.length() && Escaping.isSpaceOrTab(line.charAt(i))) {
			i++;
		}
		return i;
	}
}
