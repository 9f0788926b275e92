package io.evitadb.marginalia.source;

import io.evitadb.marginalia.ast.BlockNode;
import io.evitadb.marginalia.ast.BlockQuote;
import io.evitadb.marginalia.ast.ContentMapping;
import io.evitadb.marginalia.ast.Document;
import io.evitadb.marginalia.ast.Emphasis;
import io.evitadb.marginalia.ast.Heading;
import io.evitadb.marginalia.ast.InlineNode;
import io.evitadb.marginalia.ast.Link;
import io.evitadb.marginalia.ast.ListBlock;
import io.evitadb.marginalia.ast.ListItem;
import io.evitadb.marginalia.ast.Node;
import io.evitadb.marginalia.ast.Paragraph;
import io.evitadb.marginalia.ast.SourceLocation;
import io.evitadb.marginalia.ast.Strong;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Resolves nodes of a parsed document back to the original source text.
 *
 * Nodes found inside list items and block quotes carry positions relative to the stripped text of their container.
 * This class remembers, for every node, the chain of {@link ContentMapping containers} around it and composes their
 * transforms to produce document-space locations. Nodes are tracked by identity, two equal nodes in different places
 * of the tree resolve independently.
 */
public final class SourceText {

	@Nonnull
	private final Document document;
	@Nonnull
	private final Map<Node, List<ContentMapping>> containers = new IdentityHashMap<>();
	@Nonnull
	private final Map<ContentMapping, String> spaceTexts = new IdentityHashMap<>();

	/**
	 * Indexes the given document.
	 *
	 * @param document parsed document
	 */
	public SourceText(@Nonnull Document document) {
		this.document = Objects.requireNonNull(document, "document must not be null");
		this.containers.put(document, List.of());
		indexBlocks(document.children(), List.of());
	}

	/**
	 * Returns the text the document was parsed from, sliced by the document's own location.
	 *
	 * @return the original input
	 */
	@Nonnull
	public String getText() {
		return getText(this.document);
	}

	/**
	 * Returns the original source text of the node, including any container markers inside its span.
	 *
	 * @param node a node of the indexed document
	 * @return slice of the original input
	 */
	@Nonnull
	public String getText(@Nonnull Node node) {
		final SourceLocation location = locate(node);
		return this.document.source().substring(location.start().offset(), location.end().offset());
	}

	/**
	 * Returns the location of the node in document space.
	 *
	 * @param node a node of the indexed document
	 * @return location relative to the original input
	 */
	@Nonnull
	public SourceLocation locate(@Nonnull Node node) {
		SourceLocation location = node.sourceLocation();
		for (final ContentMapping mapping : chainOf(node)) {
			location = mapping.toParent(location);
		}
		return location;
	}

	/**
	 * Returns the text the node's own offsets refer to: the original input for top-level nodes, the stripped content
	 * of the innermost container for nested ones.
	 *
	 * @param node a node of the indexed document
	 * @return text of the node's coordinate space
	 */
	@Nonnull
	public String getSpaceText(@Nonnull Node node) {
		final List<ContentMapping> chain = chainOf(node);
		return chain.isEmpty() ? this.document.source() : spaceText(chain, 0);
	}

	/**
	 * Returns how many containers enclose the node.
	 *
	 * @param node a node of the indexed document
	 * @return 0 for top-level blocks
	 */
	public int getNestingDepth(@Nonnull Node node) {
		return chainOf(node).size();
	}

	@Nonnull
	private List<ContentMapping> chainOf(@Nonnull Node node) {
		Objects.requireNonNull(node, "node must not be null");
		final List<ContentMapping> chain = this.containers.get(node);
		if (chain == null) {
			throw new IllegalArgumentException("Node " + node.getClass().getSimpleName() + " is not part of the document");
		}
		return chain;
	}

	/**
	 * Rebuilds the stripped text of {@code chain.get(index)} from the text of its parent space.
	 */
	@Nonnull
	private String spaceText(@Nonnull List<ContentMapping> chain, int index) {
		final ContentMapping mapping = chain.get(index);
		final String cached = this.spaceTexts.get(mapping);
		if (cached != null) {
			return cached;
		}
		final String parent = index + 1 < chain.size() ? spaceText(chain, index + 1) : this.document.source();
		final List<String> lines = new ArrayList<>(mapping.lines().size());
		for (final ContentMapping.StrippedLine line : mapping.lines()) {
			final int start = line.parentOffset() + line.removedPrefix();
			final int newline = parent.indexOf('\n', line.parentOffset());
			final int end = newline < 0 ? parent.length() : newline;
			lines.add(parent.substring(start, end));
		}
		final String text = String.join("\n", lines);
		this.spaceTexts.put(mapping, text);
		return text;
	}

	private void indexBlocks(@Nonnull List<? extends BlockNode> blocks, @Nonnull List<ContentMapping> chain) {
		for (final BlockNode block : blocks) {
			this.containers.put(block, chain);
			if (block instanceof Heading heading) {
				indexInlines(heading.children(), chain);
			} else if (block instanceof Paragraph paragraph) {
				indexInlines(paragraph.children(), chain);
			} else if (block instanceof ListBlock list) {
				indexBlocks(list.children(), chain);
			} else if (block instanceof ListItem item) {
				indexBlocks(item.children(), enclose(item.contentMapping(), chain));
			} else if (block instanceof BlockQuote quote) {
				indexBlocks(quote.children(), enclose(quote.contentMapping(), chain));
			}
		}
	}

	private void indexInlines(@Nonnull List<InlineNode> inlines, @Nonnull List<ContentMapping> chain) {
		for (final InlineNode inline : inlines) {
			this.containers.put(inline, chain);
			if (inline instanceof Emphasis emphasis) {
				indexInlines(emphasis.children(), chain);
			} else if (inline instanceof Strong strong) {
				indexInlines(strong.children(), chain);
			} else if (inline instanceof Link link) {
				indexInlines(link.children(), chain);
			}
		}
	}

	/**
	 * Returns the chain for content of a container, innermost mapping first.
	 */
	@Nonnull
	private static List<ContentMapping> enclose(@Nonnull ContentMapping mapping, @Nonnull List<ContentMapping> outer) {
		final List<ContentMapping> chain = new ArrayList<>(outer.size() + 1);
		chain.add(mapping);
		chain.addAll(outer);
		return Collections.unmodifiableList(chain);
	}
}
