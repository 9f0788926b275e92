package io.evitadb.marginalia.serialize;

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
 * Renders a document as an indented outline of node types and attributes, one node per line.
 *
 * Source positions are left out, so two documents with the same structure render identically no matter how they
 * were written.
 *
 * ```
 * document
 *   list ordered=false start=1 tight=true
 *     item marker="-"
 *       paragraph
 *         text "a"
 * ```
 */
public final class OutlineRenderer {

	private static final String INDENT = "  ";

	/**
	 * Renders the outline of the document.
	 *
	 * @param document the document
	 * @return outline lines joined with `\n`
	 */
	@Nonnull
	public String render(@Nonnull Document document) {
		Objects.requireNonNull(document, "document must not be null");
		final Writer writer = new Writer();
		writer.line("document");
		writer.blocks(document.children());
		return writer.sb.toString();
	}

	@Nonnull
	private static String quote(@Nonnull String value) {
		return '"' + value
			.replace("\\", "\\\\")
			.replace("\"", "\\\"")
			.replace("\n", "\\n")
			.replace("\t", "\\t") + '"';
	}

	private static final class Writer implements BlockVisitor<Void>, InlineVisitor<Void> {

		private final StringBuilder sb = new StringBuilder();
		private int depth;

		void line(@Nonnull String text) {
			if (this.sb.length() > 0) {
				this.sb.append('\n');
			}
			this.sb.append(INDENT.repeat(this.depth)).append(text);
		}

		void blocks(@Nonnull List<? extends BlockNode> blocks) {
			this.depth++;
			for (final BlockNode block : blocks) {
				block.accept(this);
			}
			this.depth--;
		}

		void inlines(@Nonnull List<InlineNode> inlines) {
			this.depth++;
			for (final InlineNode inline : inlines) {
				inline.accept(this);
			}
			this.depth--;
		}

		@Override
		public Void visitHeading(@Nonnull Heading heading) {
			line("heading level=" + heading.level());
			inlines(heading.children());
			return null;
		}

		@Override
		public Void visitParagraph(@Nonnull Paragraph paragraph) {
			line("paragraph");
			inlines(paragraph.children());
			return null;
		}

		@Override
		public Void visitBlankLine(@Nonnull BlankLine blankLine) {
			line("blank_line");
			return null;
		}

		@Override
		public Void visitList(@Nonnull ListBlock list) {
			line("list ordered=" + list.ordered() + " start=" + list.start() + " tight=" + list.tight());
			blocks(list.children());
			return null;
		}

		@Override
		public Void visitListItem(@Nonnull ListItem listItem) {
			line("item marker=" + quote(listItem.marker()));
			blocks(listItem.children());
			return null;
		}

		@Override
		public Void visitThematicBreak(@Nonnull ThematicBreak thematicBreak) {
			line("thematic_break");
			return null;
		}

		@Override
		public Void visitCodeBlock(@Nonnull CodeBlock codeBlock) {
			line("code_block info=" + quote(codeBlock.info()) + " " + quote(codeBlock.value()));
			return null;
		}

		@Override
		public Void visitBlockQuote(@Nonnull BlockQuote blockQuote) {
			line("block_quote");
			blocks(blockQuote.children());
			return null;
		}

		@Override
		public Void visitText(@Nonnull Text text) {
			line("text " + quote(text.value()));
			return null;
		}

		@Override
		public Void visitEmphasis(@Nonnull Emphasis emphasis) {
			line("emphasis");
			inlines(emphasis.children());
			return null;
		}

		@Override
		public Void visitStrong(@Nonnull Strong strong) {
			line("strong");
			inlines(strong.children());
			return null;
		}

		@Override
		public Void visitLink(@Nonnull Link link) {
			final String title = link.title() == null ? "" : " title=" + quote(link.title());
			line("link destination=" + quote(link.destination()) + title);
			inlines(link.children());
			return null;
		}

		@Override
		public Void visitSoftBreak(@Nonnull SoftBreak softBreak) {
			line("soft_break");
			return null;
		}

		@Override
		public Void visitHardBreak(@Nonnull HardBreak hardBreak) {
			line("hard_break");
			return null;
		}

		@Override
		public Void visitCodeSpan(@Nonnull CodeSpan codeSpan) {
			line("code_span " + quote(codeSpan.value()));
			return null;
		}
	}
}
