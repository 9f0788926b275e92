package io.evitadb.marginalia.parser;

import io.evitadb.marginalia.ast.BlockNode;
import io.evitadb.marginalia.ast.BlockQuote;
import io.evitadb.marginalia.ast.Document;
import io.evitadb.marginalia.ast.Heading;
import io.evitadb.marginalia.ast.LinkReference;
import io.evitadb.marginalia.ast.ListBlock;
import io.evitadb.marginalia.ast.ListItem;
import io.evitadb.marginalia.ast.Paragraph;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Rebuilds a block tree with the inline children of every heading and paragraph filled in.
 */
final class InlinePhase {

	@Nonnull
	private final Map<String, LinkReference> references;
	@Nonnull
	private final ParserOptions options;

	InlinePhase(@Nonnull Map<String, LinkReference> references, @Nonnull ParserOptions options) {
		this.references = references;
		this.options = options;
	}

	/**
	 * Returns a copy of the document with inline content parsed.
	 *
	 * @param document output of the block phase
	 * @return the complete document
	 * @throws MarkdownParseException when inline parsing fails
	 */
	@Nonnull
	Document apply(@Nonnull Document document) throws MarkdownParseException {
		return new Document(blocks(document.children(), 0), document.sourceLocation(), document.source());
	}

	@Nonnull
	private List<BlockNode> blocks(@Nonnull List<BlockNode> blocks, int depth) throws MarkdownParseException {
		final List<BlockNode> result = new ArrayList<>(blocks.size());
		for (final BlockNode block : blocks) {
			result.add(block(block, depth));
		}
		return result;
	}

	@Nonnull
	private BlockNode block(@Nonnull BlockNode block, int depth) throws MarkdownParseException {
		if (block instanceof Heading heading) {
			return heading.withChildren(
				InlineParser.parse(heading.rawContent(), heading.contentStart(), this.references, this.options, depth)
			);
		} else if (block instanceof Paragraph paragraph) {
			return paragraph.withChildren(
				InlineParser.parse(paragraph.rawContent(), paragraph.contentStart(), this.references, this.options, depth)
			);
		} else if (block instanceof ListBlock list) {
			final List<ListItem> items = new ArrayList<>(list.children().size());
			for (final ListItem item : list.children()) {
				items.add(item.withChildren(blocks(item.children(), depth + 1)));
			}
			return new ListBlock(list.ordered(), list.start(), list.tight(), items, list.sourceLocation());
		} else if (block instanceof BlockQuote quote) {
			return quote.withChildren(blocks(quote.children(), depth + 1));
		} else {
			// blank lines, thematic breaks and code blocks carry no inline content
			return block;
		}
	}
}
