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
import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Writes a parsed document back as canonical markdown.
 *
 * The output does not preserve the original formatting: reference links become inline links, markers and fences are
 * normalized and literal characters with a meaning are escaped. Parsing the output yields a tree with the same
 * structure as the serialized one.
 */
public final class MarkdownSerializer {

	private static final String ALWAYS_ESCAPED = "\\`*_[]#";
	private static final String ESCAPED_AT_LINE_START = ">-+~=";
	private static final Pattern ORDERED_MARKER = Pattern.compile("^(\\d{1,9})([.)])");

	/**
	 * Serializes the document.
	 *
	 * @param document the document
	 * @return canonical markdown, every top-level block terminated by a newline
	 */
	@Nonnull
	public String serialize(@Nonnull Document document) {
		Objects.requireNonNull(document, "document must not be null");
		final BlockWriter writer = new BlockWriter();
		final StringBuilder sb = new StringBuilder();
		for (final BlockNode block : document.children()) {
			// a trailing blank line survives only when the block before it is terminated as well
			sb.append(block.accept(writer)).append('\n');
		}
		return sb.toString();
	}

	@Nonnull
	private static String blocks(@Nonnull List<? extends BlockNode> blocks) {
		final BlockWriter writer = new BlockWriter();
		final StringBuilder sb = new StringBuilder();
		for (final BlockNode block : blocks) {
			if (sb.length() > 0) {
				sb.append('\n');
			}
			sb.append(block.accept(writer));
		}
		return sb.toString();
	}

	@Nonnull
	private static String inlines(@Nonnull List<InlineNode> inlines) {
		final InlineWriter writer = new InlineWriter();
		writer.writeAll(inlines, null);
		return writer.sb.toString();
	}

	/**
	 * Prefixes the first line and indents the others; blank lines stay empty.
	 */
	@Nonnull
	private static String prefixLines(@Nonnull String content, @Nonnull String first, @Nonnull String rest) {
		final String[] lines = content.split("\n", -1);
		final StringBuilder sb = new StringBuilder();
		for (int i = 0; i < lines.length; i++) {
			if (i > 0) {
				sb.append('\n');
			}
			final String prefix = i == 0 ? first : rest;
			if (lines[i].isEmpty()) {
				sb.append(prefix.stripTrailing());
			} else {
				sb.append(prefix).append(lines[i]);
			}
		}
		return sb.toString();
	}

	private static int longestRun(@Nonnull String value, char ch) {
		int longest = 0;
		int current = 0;
		for (int i = 0; i < value.length(); i++) {
			if (value.charAt(i) == ch) {
				current++;
				longest = Math.max(longest, current);
			} else {
				current = 0;
			}
		}
		return longest;
	}

	private static final class BlockWriter implements BlockVisitor<String> {

		@Override
		public String visitHeading(@Nonnull Heading heading) {
			final String hashes = "#".repeat(heading.level());
			final String content = inlines(heading.children());
			return content.isEmpty() ? hashes : hashes + " " + content;
		}

		@Override
		public String visitParagraph(@Nonnull Paragraph paragraph) {
			return inlines(paragraph.children());
		}

		@Override
		public String visitBlankLine(@Nonnull BlankLine blankLine) {
			return "";
		}

		@Override
		public String visitList(@Nonnull ListBlock list) {
			final StringBuilder sb = new StringBuilder();
			for (final ListItem item : list.children()) {
				if (sb.length() > 0) {
					sb.append('\n');
				}
				sb.append(item.accept(this));
			}
			return sb.toString();
		}

		@Override
		public String visitListItem(@Nonnull ListItem listItem) {
			if (listItem.children().isEmpty()) {
				return listItem.marker();
			}
			return prefixLines(
				blocks(listItem.children()),
				listItem.marker() + " ",
				" ".repeat(listItem.marker().length() + 1)
			);
		}

		@Override
		public String visitThematicBreak(@Nonnull ThematicBreak thematicBreak) {
			return "___";
		}

		@Override
		public String visitCodeBlock(@Nonnull CodeBlock codeBlock) {
			final char fenceChar = codeBlock.info().indexOf('`') >= 0 ? '~' : '`';
			final String fence = String.valueOf(fenceChar).repeat(
				Math.max(3, longestRun(codeBlock.value(), fenceChar) + 1)
			);
			return fence + codeBlock.info() + "\n" + codeBlock.value() + fence;
		}

		@Override
		public String visitBlockQuote(@Nonnull BlockQuote blockQuote) {
			return prefixLines(blocks(blockQuote.children()), "> ", "> ");
		}
	}

	private static final class InlineWriter implements InlineVisitor<Void> {

		private final StringBuilder sb = new StringBuilder();
		@Nullable
		private InlineNode parent;

		void writeAll(@Nonnull List<InlineNode> inlines, @Nullable InlineNode container) {
			final InlineNode previous = this.parent;
			this.parent = container;
			for (final InlineNode inline : inlines) {
				inline.accept(this);
			}
			this.parent = previous;
		}

		private boolean atLineStart() {
			return this.sb.length() == 0 || this.sb.charAt(this.sb.length() - 1) == '\n';
		}

		@Override
		public Void visitText(@Nonnull Text text) {
			final String value = text.value();
			int orderedDelimiter = -1;
			if (atLineStart()) {
				final Matcher matcher = ORDERED_MARKER.matcher(value);
				if (matcher.find()) {
					orderedDelimiter = matcher.start(2);
				}
			}
			for (int i = 0; i < value.length(); i++) {
				final char ch = value.charAt(i);
				if (ALWAYS_ESCAPED.indexOf(ch) >= 0
					|| i == 0 && atLineStart() && ESCAPED_AT_LINE_START.indexOf(ch) >= 0
					|| i == orderedDelimiter) {
					this.sb.append('\\');
				}
				this.sb.append(ch);
			}
			return null;
		}

		@Override
		public Void visitEmphasis(@Nonnull Emphasis emphasis) {
			// `*` as the only content of another emphasis would merge with its delimiters into one run
			final String delimiter = isSoleChildOfEmphasis() ? "_" : "*";
			this.sb.append(delimiter);
			writeAll(emphasis.children(), emphasis);
			this.sb.append(delimiter);
			return null;
		}

		private boolean isSoleChildOfEmphasis() {
			if (this.parent instanceof Emphasis emphasis) {
				return emphasis.children().size() == 1;
			} else if (this.parent instanceof Strong strong) {
				return strong.children().size() == 1;
			}
			return false;
		}

		@Override
		public Void visitStrong(@Nonnull Strong strong) {
			this.sb.append("**");
			writeAll(strong.children(), strong);
			this.sb.append("**");
			return null;
		}

		@Override
		public Void visitLink(@Nonnull Link link) {
			this.sb.append('[');
			writeAll(link.children(), link);
			this.sb.append("](").append(destination(link.destination()));
			if (link.title() != null) {
				this.sb.append(" \"").append(escape(link.title(), "\\\"")).append('"');
			}
			this.sb.append(')');
			return null;
		}

		@Override
		public Void visitSoftBreak(@Nonnull SoftBreak softBreak) {
			this.sb.append('\n');
			return null;
		}

		@Override
		public Void visitHardBreak(@Nonnull HardBreak hardBreak) {
			this.sb.append("\\\n");
			return null;
		}

		@Override
		public Void visitCodeSpan(@Nonnull CodeSpan codeSpan) {
			final String value = codeSpan.value();
			final String fence = "`".repeat(longestRun(value, '`') + 1);
			final boolean pad = !value.isEmpty()
				&& (value.charAt(0) == '`' || value.charAt(value.length() - 1) == '`'
				|| value.charAt(0) == ' ' && value.charAt(value.length() - 1) == ' ' && !value.isBlank());
			this.sb.append(fence);
			if (pad) {
				this.sb.append(' ').append(value).append(' ');
			} else {
				this.sb.append(value);
			}
			this.sb.append(fence);
			return null;
		}

		@Nonnull
		private static String destination(@Nonnull String destination) {
			if (destination.isEmpty() || destination.chars().anyMatch(ch -> ch == ' ' || ch == '(' || ch == ')')) {
				return "<" + escape(destination, "\\<>") + ">";
			}
			return escape(destination, "\\<");
		}

		@Nonnull
		private static String escape(@Nonnull String value, @Nonnull String characters) {
			final StringBuilder escaped = new StringBuilder(value.length());
			for (int i = 0; i < value.length(); i++) {
				final char ch = value.charAt(i);
				if (characters.indexOf(ch) >= 0) {
					escaped.append('\\');
				}
				escaped.append(ch);
			}
			return escaped.toString();
		}
	}
}
