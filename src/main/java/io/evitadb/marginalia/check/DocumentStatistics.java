package io.evitadb.marginalia.check;

import io.evitadb.marginalia.ast.BlankLine;
import io.evitadb.marginalia.ast.BlockNode;
import io.evitadb.marginalia.ast.BlockQuote;
import io.evitadb.marginalia.ast.BlockVisitor;
import io.evitadb.marginalia.ast.CodeBlock;
import io.evitadb.marginalia.ast.CodeSpan;
import io.evitadb.marginalia.ast.Document;
import io.evitadb.marginalia.ast.Emphasis;
import io.evitadb.marginalia.ast.HardBreak;
import io.evitadb.marginalia.ast.Heading;
import io.evitadb.marginalia.ast.InlineNode;
import io.evitadb.marginalia.ast.InlineVisitor;
import io.evitadb.marginalia.ast.Link;
import io.evitadb.marginalia.ast.ListBlock;
import io.evitadb.marginalia.ast.ListItem;
import io.evitadb.marginalia.ast.Paragraph;
import io.evitadb.marginalia.ast.SoftBreak;
import io.evitadb.marginalia.ast.Strong;
import io.evitadb.marginalia.ast.Text;
import io.evitadb.marginalia.ast.ThematicBreak;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;

/**
 * Node counts of one or more parsed documents.
 *
 * @param documents       number of documents counted
 * @param headings        number of headings
 * @param paragraphs      number of paragraphs
 * @param lists           number of lists
 * @param listItems       number of list items
 * @param blockQuotes     number of block quotes
 * @param codeBlocks      number of fenced code blocks
 * @param links           number of links, inline or by reference
 * @param maxNestingDepth deepest container nesting seen
 */
public record DocumentStatistics(
	int documents,
	int headings,
	int paragraphs,
	int lists,
	int listItems,
	int blockQuotes,
	int codeBlocks,
	int links,
	int maxNestingDepth
) {

	public static final DocumentStatistics EMPTY = new DocumentStatistics(0, 0, 0, 0, 0, 0, 0, 0, 0);

	/**
	 * Counts the nodes of a document.
	 *
	 * @param document parsed document
	 * @return statistics of that single document
	 */
	@Nonnull
	public static DocumentStatistics of(@Nonnull Document document) {
		Objects.requireNonNull(document, "document must not be null");
		final Counter counter = new Counter();
		counter.blocks(document.children());
		return new DocumentStatistics(
			1,
			counter.headings,
			counter.paragraphs,
			counter.lists,
			counter.listItems,
			counter.blockQuotes,
			counter.codeBlocks,
			counter.links,
			counter.maxDepth
		);
	}

	/**
	 * Adds two statistics together.
	 *
	 * @param other statistics to add
	 * @return combined statistics
	 */
	@Nonnull
	public DocumentStatistics plus(@Nonnull DocumentStatistics other) {
		return new DocumentStatistics(
			this.documents + other.documents,
			this.headings + other.headings,
			this.paragraphs + other.paragraphs,
			this.lists + other.lists,
			this.listItems + other.listItems,
			this.blockQuotes + other.blockQuotes,
			this.codeBlocks + other.codeBlocks,
			this.links + other.links,
			Math.max(this.maxNestingDepth, other.maxNestingDepth)
		);
	}

	private static final class Counter implements BlockVisitor<Void>, InlineVisitor<Void> {

		private int headings;
		private int paragraphs;
		private int lists;
		private int listItems;
		private int blockQuotes;
		private int codeBlocks;
		private int links;
		private int depth;
		private int maxDepth;

		void blocks(@Nonnull List<? extends BlockNode> blocks) {
			for (final BlockNode block : blocks) {
				block.accept(this);
			}
		}

		void inlines(@Nonnull List<InlineNode> inlines) {
			for (final InlineNode inline : inlines) {
				inline.accept(this);
			}
		}

		void container(@Nonnull List<BlockNode> children) {
			this.depth++;
			this.maxDepth = Math.max(this.maxDepth, this.depth);
			blocks(children);
			this.depth--;
		}

		@Override
		public Void visitHeading(@Nonnull Heading heading) {
			this.headings++;
			inlines(heading.children());
			return null;
		}

		@Override
		public Void visitParagraph(@Nonnull Paragraph paragraph) {
			this.paragraphs++;
			inlines(paragraph.children());
			return null;
		}

		@Override
		public Void visitBlankLine(@Nonnull BlankLine blankLine) {
			return null;
		}

		@Override
		public Void visitList(@Nonnull ListBlock list) {
			this.lists++;
			blocks(list.children());
			return null;
		}

		@Override
		public Void visitListItem(@Nonnull ListItem listItem) {
			this.listItems++;
			container(listItem.children());
			return null;
		}

		@Override
		public Void visitThematicBreak(@Nonnull ThematicBreak thematicBreak) {
			return null;
		}

		@Override
		public Void visitCodeBlock(@Nonnull CodeBlock codeBlock) {
			this.codeBlocks++;
			return null;
		}

		@Override
		public Void visitBlockQuote(@Nonnull BlockQuote blockQuote) {
			this.blockQuotes++;
			container(blockQuote.children());
			return null;
		}

		@Override
		public Void visitText(@Nonnull Text text) {
			return null;
		}

		@Override
		public Void visitEmphasis(@Nonnull Emphasis emphasis) {
			inlines(emphasis.children());
			return null;
		}

		@Override
		public Void visitStrong(@Nonnull Strong strong) {
			inlines(strong.children());
			return null;
		}

		@Override
		public Void visitLink(@Nonnull Link link) {
			this.links++;
			inlines(link.children());
			return null;
		}

		@Override
		public Void visitSoftBreak(@Nonnull SoftBreak softBreak) {
			return null;
		}

		@Override
		public Void visitHardBreak(@Nonnull HardBreak hardBreak) {
			return null;
		}

		@Override
		public Void visitCodeSpan(@Nonnull CodeSpan codeSpan) {
			return null;
		}
	}
}
