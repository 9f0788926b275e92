package io.evitadb.marginalia.parser;

import io.evitadb.marginalia.ast.CodeSpan;
import io.evitadb.marginalia.ast.Emphasis;
import io.evitadb.marginalia.ast.HardBreak;
import io.evitadb.marginalia.ast.InlineNode;
import io.evitadb.marginalia.ast.Link;
import io.evitadb.marginalia.ast.LinkReference;
import io.evitadb.marginalia.ast.Position;
import io.evitadb.marginalia.ast.SoftBreak;
import io.evitadb.marginalia.ast.Strong;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Parses the inline content of one leaf block (phase two of parsing).
 *
 * The text is scanned once from left to right. Code spans, links and line breaks become nodes immediately; runs of
 * `*` and `_` are kept as literal text in slots of their own and recorded as {@link DelimiterRun delimiter runs},
 * which the {@link DelimiterResolver} pairs into emphasis afterwards. Adjacent text is merged at the end.
 */
final class InlineParser {

	@Nonnull
	private final String text;
	@Nonnull
	private final Map<String, LinkReference> references;
	@Nonnull
	private final ParserOptions options;
	private final int depth;
	private final boolean blockLevel;
	@Nonnull
	private final PositionLocator locator;
	@Nonnull
	private final InlineSlots slots;
	@Nonnull
	private final List<DelimiterRun> delimiters = new ArrayList<>();

	private InlineParser(
		@Nonnull String text,
		@Nonnull Position base,
		@Nonnull Map<String, LinkReference> references,
		@Nonnull ParserOptions options,
		int depth,
		boolean blockLevel
	) {
		this.text = text;
		this.references = references;
		this.options = options;
		this.depth = depth;
		this.blockLevel = blockLevel;
		this.locator = new PositionLocator(text, base);
		this.slots = new InlineSlots(this.locator);
	}

	/**
	 * Parses the raw inline content of a heading or paragraph.
	 *
	 * @param rawContent   the block's inline source
	 * @param contentStart position of the first character of {@code rawContent}
	 * @param references   link reference definitions of the whole document
	 * @param options      parser limits
	 * @param depth        nesting depth of the block's container
	 * @return inline nodes
	 * @throws MarkdownParseException when link texts nest too deeply or emphasis resolution fails
	 */
	@Nonnull
	static List<InlineNode> parse(
		@Nonnull String rawContent,
		@Nonnull Position contentStart,
		@Nonnull Map<String, LinkReference> references,
		@Nonnull ParserOptions options,
		int depth
	) throws MarkdownParseException {
		int end = rawContent.length();
		while (end > 0 && isTrailingWhitespace(rawContent.charAt(end - 1))) {
			end--;
		}
		return new InlineParser(rawContent.substring(0, end), contentStart, references, options, depth, true).parse();
	}

	@Nonnull
	private List<InlineNode> parse() throws MarkdownParseException {
		int i = this.blockLevel ? skipSpaceOrTab(0) : 0;
		while (i < this.text.length()) {
			final char ch = this.text.charAt(i);
			switch (ch) {
				case '\n' -> i = parseLineBreak(i);
				case '\\' -> i = parseBackslash(i);
				case '`' -> i = parseCodeSpan(i);
				case '*', '_' -> i = parseDelimiterRun(i);
				case '[' -> i = parseLink(i);
				default -> i = parseText(i);
			}
		}
		new DelimiterResolver(this.delimiters, this.slots).resolve();
		return this.slots.toNodes();
	}

	private int parseText(int start) {
		int i = start + 1;
		while (i < this.text.length() && !isSpecial(this.text.charAt(i))) {
			i++;
		}
		this.slots.appendText(this.text.substring(start, i), start, i);
		return i;
	}

	private int parseLineBreak(int newline) {
		int spacesStart = newline;
		while (spacesStart > 0 && this.text.charAt(spacesStart - 1) == ' ') {
			spacesStart--;
		}
		this.slots.trimTrailingSpaces();
		if (newline - spacesStart >= 2) {
			this.slots.addNode(new HardBreak(this.locator.span(spacesStart, newline + 1)));
		} else {
			this.slots.addNode(new SoftBreak(this.locator.span(spacesStart, newline + 1)));
		}
		return skipSpaceOrTab(newline + 1);
	}

	private int parseBackslash(int start) {
		if (start + 1 < this.text.length()) {
			final char next = this.text.charAt(start + 1);
			if (next == '\n') {
				this.slots.addNode(new HardBreak(this.locator.span(start, start + 2)));
				return skipSpaceOrTab(start + 2);
			}
			if (Escaping.isAsciiPunctuation(next)) {
				this.slots.appendText(String.valueOf(next), start, start + 2);
				return start + 2;
			}
		}
		this.slots.appendText("\\", start, start + 1);
		return start + 1;
	}

	private int parseCodeSpan(int start) {
		final int length = runLength(start, '`');
		final int contentStart = start + length;

		int i = contentStart;
		while (i < this.text.length()) {
			if (this.text.charAt(i) != '`') {
				i++;
				continue;
			}
			final int closing = runLength(i, '`');
			if (closing == length) {
				final String value = normalizeCodeSpan(this.text.substring(contentStart, i));
				this.slots.addNode(new CodeSpan(value, this.locator.span(start, i + closing)));
				return i + closing;
			}
			i += closing;
		}

		// no closer of the same length, the whole opening run is literal
		this.slots.appendText(this.text.substring(start, contentStart), start, contentStart);
		return contentStart;
	}

	@Nonnull
	private static String normalizeCodeSpan(@Nonnull String content) {
		final String value = content.replace('\n', ' ');
		if (value.length() >= 2 && value.charAt(0) == ' ' && value.charAt(value.length() - 1) == ' '
			&& !value.isBlank()) {
			return value.substring(1, value.length() - 1);
		}
		return value;
	}

	private int parseDelimiterRun(int start) {
		final char type = this.text.charAt(start);
		final int length = runLength(start, type);
		final int end = start + length;
		final char before = start > 0 ? this.text.charAt(start - 1) : '\n';
		final char after = end < this.text.length() ? this.text.charAt(end) : '\n';

		final int slot = this.slots.addDelimiterText(this.text.substring(start, end), start);
		final DelimiterRun run = DelimiterRun.create(type, length, before, after, slot);
		if (run.canOpen || run.canClose) {
			this.delimiters.add(run);
		}
		return end;
	}

	private int parseLink(int start) throws MarkdownParseException {
		final int close = findClosingBracket(start);
		if (close < 0) {
			return literalBracket(start);
		}
		final String label = this.text.substring(start + 1, close);

		// inline link [text](destination "title")
		if (close + 1 < this.text.length() && this.text.charAt(close + 1) == '(') {
			final LinkSyntax.InlineLinkTail tail = LinkSyntax.parseInlineLinkTail(this.text, close + 1);
			if (tail != null) {
				return addLink(start, label, tail.destination(), tail.title(), tail.end())
					? tail.end()
					: literalBracket(start);
			}
		}

		// full [text][label] or collapsed [text][] reference
		if (close + 1 < this.text.length() && this.text.charAt(close + 1) == '[') {
			final int labelClose = this.text.indexOf(']', close + 2);
			final int nestedOpen = this.text.indexOf('[', close + 2);
			if (labelClose >= 0 && (nestedOpen < 0 || nestedOpen > labelClose)) {
				final String reference = this.text.substring(close + 2, labelClose);
				final LinkReference definition = lookup(reference.isEmpty() ? label : reference);
				if (definition != null) {
					return addLink(start, label, definition.destination(), definition.title(), labelClose + 1)
						? labelClose + 1
						: literalBracket(start);
				}
				if (!reference.isEmpty()) {
					return literalBracket(start);
				}
			}
		}

		// shortcut [text] reference
		final LinkReference definition = lookup(label);
		if (definition != null) {
			return addLink(start, label, definition.destination(), definition.title(), close + 1)
				? close + 1
				: literalBracket(start);
		}
		return literalBracket(start);
	}

	/**
	 * Adds a link spanning {@code start} to {@code end}. Link text cannot contain another link; in that case nothing
	 * is added and the opening bracket is left to the caller as literal text.
	 *
	 * @return true when the link was added
	 */
	private boolean addLink(
		int start,
		@Nonnull String label,
		@Nonnull String destination,
		@Nullable String title,
		int end
	) throws MarkdownParseException {
		final int childDepth = this.depth + 1;
		if (childDepth > this.options.maxNestingDepth()) {
			throw new TooDeeplyNestedException(
				childDepth, this.options.maxNestingDepth(), this.locator.at(start).line()
			);
		}
		final List<InlineNode> children = new InlineParser(
			label, this.locator.at(start + 1), this.references, this.options, childDepth, false
		).parse();
		if (containsLink(children)) {
			return false;
		}
		this.slots.addNode(new Link(destination, title, children, this.locator.span(start, end)));
		return true;
	}

	private static boolean containsLink(@Nonnull List<InlineNode> nodes) {
		for (final InlineNode node : nodes) {
			if (node instanceof Link) {
				return true;
			}
			if (node instanceof Emphasis && containsLink(((Emphasis) node).children())) {
				return true;
			}
			if (node instanceof Strong && containsLink(((Strong) node).children())) {
				return true;
			}
		}
		return false;
	}

	@Nullable
	private LinkReference lookup(@Nonnull String label) {
		final String key = LinkLabels.normalize(label);
		return key.isEmpty() ? null : this.references.get(key);
	}

	private int literalBracket(int start) {
		this.slots.appendText("[", start, start + 1);
		return start + 1;
	}

	/**
	 * Finds the bracket closing the one at {@code open}, honouring nesting and backslash escapes.
	 *
	 * @return index of the closing bracket or -1
	 */
	private int findClosingBracket(int open) {
		int nesting = 0;
		for (int i = open + 1; i < this.text.length(); i++) {
			final char ch = this.text.charAt(i);
			if (ch == '\\') {
				i++;
			} else if (ch == '[') {
				nesting++;
			} else if (ch == ']') {
				if (nesting == 0) {
					return i;
				}
				nesting--;
			}
		}
		return -1;
	}

	private int runLength(int start, char ch) {
		int i = start;
		while (i < this.text.length() && this.text.charAt(i) == ch) {
			i++;
		}
		return i - start;
	}

	private int skipSpaceOrTab(int from) {
		int i = from;
		while (i < this.text.length() && Escaping.isSpaceOrTab(this.text.charAt(i))) {
			i++;
		}
		return i;
	}

	private static boolean isSpecial(char ch) {
		return ch == '\n' || ch == '\\' || ch == '`' || ch == '*' || ch == '_' || ch == '[';
	}

	private static boolean isTrailingWhitespace(char ch) {
		return ch == ' ' || ch == '\t' || ch == '\n';
	}
}
