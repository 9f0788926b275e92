package io.evitadb.marginalia.parser;

import io.evitadb.marginalia.ast.BlankLine;
import io.evitadb.marginalia.ast.BlockNode;
import io.evitadb.marginalia.ast.BlockQuote;
import io.evitadb.marginalia.ast.CodeBlock;
import io.evitadb.marginalia.ast.Document;
import io.evitadb.marginalia.ast.Heading;
import io.evitadb.marginalia.ast.LinkReference;
import io.evitadb.marginalia.ast.ListBlock;
import io.evitadb.marginalia.ast.ListItem;
import io.evitadb.marginalia.ast.Paragraph;
import io.evitadb.marginalia.ast.Position;
import io.evitadb.marginalia.ast.SourceLocation;
import io.evitadb.marginalia.ast.ThematicBreak;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds the block tree of a document (phase one of parsing).
 *
 * The parser walks the lines with a single cursor, classifies the current line and lets the matching construct consume
 * as many lines as it needs. List items and block quotes strip their markers and indentation and parse the remaining
 * sub-text recursively. Positions of the nodes produced by such a recursive call are relative to the stripped sub-text;
 * the container keeps the {@link io.evitadb.marginalia.ast.ContentMapping} that translates them back.
 *
 * Link reference definitions are collected into one map shared by all nesting levels; the first definition of a label
 * wins.
 */
final class BlockParser {

	@Nonnull
	private final ParserOptions options;
	@Nonnull
	private final Map<String, LinkReference> references = new LinkedHashMap<>();

	private BlockParser(@Nonnull ParserOptions options) {
		this.options = options;
	}

	/**
	 * Parses the block structure of the given text.
	 *
	 * @param text    the whole document
	 * @param options parser limits
	 * @return block tree and collected link references
	 * @throws TooDeeplyNestedException when containers nest deeper than allowed
	 */
	@Nonnull
	static BlockParseResult parse(@Nonnull String text, @Nonnull ParserOptions options) throws TooDeeplyNestedException {
		Objects.requireNonNull(text, "text must not be null");
		Objects.requireNonNull(options, "options must not be null");

		final BlockParser parser = new BlockParser(options);
		final List<Line> lines = LineScanner.scan(text);
		final Line last = lines.get(lines.size() - 1);

		// the empty remainder after a final newline is not a line of its own
		final List<Line> effective = last.raw().isEmpty() ? lines.subList(0, lines.size() - 1) : lines;
		final List<BlockNode> children = parser.parseLines(effective, 0);

		final Document document = new Document(
			children,
			new SourceLocation(Position.START, endOf(last)),
			text
		);
		return new BlockParseResult(document, parser.references);
	}

	/**
	 * Parses a stripped container sub-text one level deeper.
	 */
	@Nonnull
	private List<BlockNode> parseText(@Nonnull String text, int depth) throws TooDeeplyNestedException {
		return parseLines(LineScanner.scan(text), depth);
	}

	@Nonnull
	private List<BlockNode> parseLines(@Nonnull List<Line> lines, int depth) throws TooDeeplyNestedException {
		final List<BlockNode> blocks = new ArrayList<>();
		int i = 0;
		while (i < lines.size()) {
			final Line line = lines.get(i);
			final String next = i + 1 < lines.size() ? lines.get(i + 1).raw() : null;

			final LinkReferenceMatch definition = BlockClassifiers.matchLinkReferenceDefinition(line.raw(), next);
			if (definition != null) {
				this.references.putIfAbsent(
					LinkLabels.normalize(definition.label()),
					new LinkReference(definition.label(), definition.destination(), definition.title())
				);
				i += definition.linesConsumed();
				continue;
			}

			switch (BlockClassifiers.classify(line.raw())) {
				case BLANK -> {
					blocks.add(new BlankLine(lineLocation(line, line)));
					i++;
				}
				case ATX_HEADING -> {
					blocks.add(parseHeading(line));
					i++;
				}
				case THEMATIC_BREAK -> {
					blocks.add(new ThematicBreak(lineLocation(line, line)));
					i++;
				}
				case CODE_FENCE -> i = parseCodeBlock(lines, i, blocks);
				case BLOCK_QUOTE -> i = parseBlockQuote(lines, i, depth, blocks);
				case LIST_ITEM -> i = parseList(lines, i, depth, blocks);
				case PARAGRAPH -> i = parseParagraph(lines, i, blocks);
				default -> throw new IllegalStateException("Unexpected block kind for line " + line.lineNumber());
			}
		}
		return blocks;
	}

	@Nonnull
	private static Heading parseHeading(@Nonnull Line line) {
		final AtxHeadingMatch match = Objects.requireNonNull(BlockClassifiers.matchAtxHeading(line.raw()));
		return new Heading(
			match.level(),
			match.content(),
			new Position(line.lineNumber(), match.contentStart() + 1, line.offset() + match.contentStart()),
			List.of(),
			lineLocation(line, line)
		);
	}

	private static int parseParagraph(@Nonnull List<Line> lines, int start, @Nonnull List<BlockNode> blocks) {
		int end = start + 1;
		while (end < lines.size()) {
			final String raw = lines.get(end).raw();
			final String next = end + 1 < lines.size() ? lines.get(end + 1).raw() : null;
			if (BlockClassifiers.classify(raw) != BlockKind.PARAGRAPH
				|| BlockClassifiers.matchLinkReferenceDefinition(raw, next) != null) {
				break;
			}
			end++;
		}

		final Line first = lines.get(start);
		final StringBuilder raw = new StringBuilder(first.raw());
		for (int i = start + 1; i < end; i++) {
			raw.append('\n').append(lines.get(i).raw());
		}
		blocks.add(
			new Paragraph(
				raw.toString(),
				new Position(first.lineNumber(), 1, first.offset()),
				List.of(),
				lineLocation(first, lines.get(end - 1))
			)
		);
		return end;
	}

	private static int parseCodeBlock(@Nonnull List<Line> lines, int start, @Nonnull List<BlockNode> blocks) {
		final Line opening = lines.get(start);
		final CodeFenceMatch fence = Objects.requireNonNull(BlockClassifiers.matchCodeFence(opening.raw()));

		final StringBuilder value = new StringBuilder();
		int i = start + 1;
		while (i < lines.size()) {
			final String raw = lines.get(i).raw();
			if (BlockClassifiers.isClosingFence(raw, fence.fenceChar(), fence.fenceLength())) {
				i++;
				break;
			}
			final int strip = Math.min(fence.indent(), Escaping.leadingSpaces(raw));
			value.append(raw, strip, raw.length()).append('\n');
			i++;
		}

		blocks.add(new CodeBlock(fence.info(), value.toString(), lineLocation(opening, lines.get(i - 1))));
		return i;
	}

	private int parseBlockQuote(
		@Nonnull List<Line> lines,
		int start,
		int depth,
		@Nonnull List<BlockNode> blocks
	) throws TooDeeplyNestedException {
		final Line first = lines.get(start);
		final int childDepth = enter(depth, first);

		final StrippedContent content = new StrippedContent();
		int i = start;
		while (i < lines.size()) {
			final Line line = lines.get(i);
			final BlockQuoteMatch marker = BlockClassifiers.matchBlockQuote(line.raw());
			if (marker != null) {
				content.add(line.raw().substring(marker.markerLength()), line);
			} else if (isLazyContinuation(lines, i, content)) {
				content.add(line.raw().substring(Escaping.leadingSpaces(line.raw())), line);
			} else {
				break;
			}
			i++;
		}

		final List<BlockNode> children = parseText(content.text(), childDepth);
		blocks.add(new BlockQuote(children, lineLocation(first, lines.get(i - 1)), content.mapping()));
		return i;
	}

	private int parseList(
		@Nonnull List<Line> lines,
		int start,
		int depth,
		@Nonnull List<BlockNode> blocks
	) throws TooDeeplyNestedException {
		final ListItemMatch first = Objects.requireNonNull(listItemAt(lines, start));
		final List<ListItem> items = new ArrayList<>();
		boolean blankBetween = false;

		int i = start;
		ListItemMatch current = first;
		while (current != null) {
			final ItemResult item = parseListItem(lines, i, current, first, depth);
			items.add(item.item());
			blankBetween |= item.blankBeforeNext();
			i = item.next();

			final ListItemMatch following = listItemAt(lines, i);
			current = following != null && following.sameFamily(first) ? following : null;
		}

		boolean tight = !blankBetween;
		for (final ListItem item : items) {
			if (item.children().stream().anyMatch(BlankLine.class::isInstance)) {
				tight = false;
				break;
			}
		}

		final SourceLocation location = new SourceLocation(
			items.get(0).sourceLocation().start(),
			items.get(items.size() - 1).sourceLocation().end()
		);
		blocks.add(new ListBlock(first.ordered(), first.ordered() ? first.number() : 1, tight, items, location));
		return i;
	}

	/**
	 * Collects the lines of one list item and parses them recursively.
	 */
	@Nonnull
	private ItemResult parseListItem(
		@Nonnull List<Line> lines,
		int start,
		@Nonnull ListItemMatch match,
		@Nonnull ListItemMatch family,
		int depth
	) throws TooDeeplyNestedException {
		final Line markerLine = lines.get(start);
		final int childDepth = enter(depth, markerLine);
		final int contentColumn = match.contentColumn();

		final StrippedContent content = new StrippedContent();
		content.add(markerLine.raw().substring(match.contentStart()), markerLine);

		boolean blankBeforeNext = false;
		int i = start + 1;
		while (i < lines.size()) {
			final Line line = lines.get(i);
			final String raw = line.raw();

			if (BlockClassifiers.isBlank(raw)) {
				int nonBlank = i;
				while (nonBlank < lines.size() && BlockClassifiers.isBlank(lines.get(nonBlank).raw())) {
					nonBlank++;
				}
				if (nonBlank >= lines.size()) {
					break;
				}
				final boolean continues = Escaping.leadingSpaces(lines.get(nonBlank).raw()) >= contentColumn;
				if (continues && match.empty() && content.size() == 1) {
					// an empty item cannot continue after a blank line
					break;
				}
				final ListItemMatch sibling = continues ? null : listItemAt(lines, nonBlank);
				if (!continues && (sibling == null || !sibling.sameFamily(family))) {
					break;
				}
				for (int blank = i; blank < nonBlank; blank++) {
					final String blankRaw = lines.get(blank).raw();
					content.add(blankRaw.substring(Math.min(blankRaw.length(), contentColumn)), lines.get(blank));
				}
				i = nonBlank;
				if (!continues) {
					blankBeforeNext = true;
					break;
				}
				continue;
			}

			if (Escaping.leadingSpaces(raw) >= contentColumn) {
				content.add(raw.substring(contentColumn), line);
			} else if (isLazyContinuation(lines, i, content)) {
				content.add(raw.substring(Escaping.leadingSpaces(raw)), line);
			} else {
				break;
			}
			i++;
		}

		// an empty marker line followed by blank lines is kept, the blank run becomes BlankLine children
		if (match.empty() && content.size() > 1 && !BlockClassifiers.isBlank(content.contentAt(1))) {
			content.dropFirst();
		}

		final List<BlockNode> children = content.isSingleBlank()
			? List.of()
			: parseText(content.text(), childDepth);
		final ListItem item = new ListItem(
			match.marker(),
			children,
			lineLocation(markerLine, lines.get(i - 1)),
			content.mapping()
		);
		return new ItemResult(item, i, blankBeforeNext);
	}

	/**
	 * Decides whether a line without the container's marker or indentation still continues an open paragraph.
	 */
	private static boolean isLazyContinuation(@Nonnull List<Line> lines, int index, @Nonnull StrippedContent content) {
		if (content.isEmpty()) {
			return false;
		}
		final String raw = lines.get(index).raw();
		final String next = index + 1 < lines.size() ? lines.get(index + 1).raw() : null;
		if (BlockClassifiers.classify(raw) != BlockKind.PARAGRAPH
			|| BlockClassifiers.matchLinkReferenceDefinition(raw, next) != null) {
			return false;
		}
		final BlockKind previous = BlockClassifiers.classify(content.lastContent());
		return previous != BlockKind.BLANK
			&& previous != BlockKind.ATX_HEADING
			&& previous != BlockKind.THEMATIC_BREAK
			&& previous != BlockKind.CODE_FENCE
			&& !content.hasOpenFence();
	}

	@Nullable
	private static ListItemMatch listItemAt(@Nonnull List<Line> lines, int index) {
		if (index >= lines.size()) {
			return null;
		}
		final String raw = lines.get(index).raw();
		if (BlockClassifiers.classify(raw) != BlockKind.LIST_ITEM) {
			return null;
		}
		return BlockClassifiers.matchListItem(raw);
	}

	private int enter(int depth, @Nonnull Line line) throws TooDeeplyNestedException {
		final int childDepth = depth + 1;
		if (childDepth > this.options.maxNestingDepth()) {
			throw new TooDeeplyNestedException(childDepth, this.options.maxNestingDepth(), line.lineNumber());
		}
		return childDepth;
	}

	@Nonnull
	private static SourceLocation lineLocation(@Nonnull Line first, @Nonnull Line last) {
		return new SourceLocation(new Position(first.lineNumber(), 1, first.offset()), endOf(last));
	}

	@Nonnull
	private static Position endOf(@Nonnull Line line) {
		return new Position(line.lineNumber(), line.raw().length() + 1, line.endOffset());
	}

	/**
	 * A parsed list item and where parsing continues.
	 *
	 * @param item            the item
	 * @param next            index of the first line after the item
	 * @param blankBeforeNext true when blank lines separate this item from the next one
	 */
	private record ItemResult(@Nonnull ListItem item, int next, boolean blankBeforeNext) {
	}
}
