package io.evitadb.marginalia.parser;

import io.evitadb.marginalia.ast.ContentMapping;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;

/**
 * Collects the stripped lines of a container block together with the transform that produced them.
 */
final class StrippedContent {

	private final List<String> contents = new ArrayList<>();
	private final List<Line> origins = new ArrayList<>();

	/**
	 * Adds a content line. The content must be a suffix of the origin line.
	 *
	 * @param content what remains of the line after stripping
	 * @param origin  the line in the parent space
	 */
	void add(@Nonnull String content, @Nonnull Line origin) {
		if (!origin.raw().endsWith(content)) {
			throw new IllegalArgumentException("content must be a suffix of line " + origin.lineNumber());
		}
		this.contents.add(content);
		this.origins.add(origin);
	}

	int size() {
		return this.contents.size();
	}

	boolean isEmpty() {
		return this.contents.isEmpty();
	}

	/**
	 * Returns the last added content line.
	 *
	 * @return last content
	 */
	@Nonnull
	String lastContent() {
		return this.contents.get(this.contents.size() - 1);
	}

	@Nonnull
	String contentAt(int index) {
		return this.contents.get(index);
	}

	/**
	 * Returns true when the content consists of a single blank line.
	 *
	 * @return true for content with nothing to parse
	 */
	boolean isSingleBlank() {
		return this.contents.size() == 1 && BlockClassifiers.isBlank(this.contents.get(0));
	}

	/**
	 * Returns true when a fenced code block opened in the content is still unclosed after its last line.
	 *
	 * @return true while the content ends inside a code fence
	 */
	boolean hasOpenFence() {
		CodeFenceMatch open = null;
		for (final String content : this.contents) {
			if (open == null) {
				open = BlockClassifiers.matchCodeFence(content);
			} else if (BlockClassifiers.isClosingFence(content, open.fenceChar(), open.fenceLength())) {
				open = null;
			}
		}
		return open != null;
	}

	void dropFirst() {
		this.contents.remove(0);
		this.origins.remove(0);
	}

	/**
	 * Joins the content lines with `\n`.
	 *
	 * @return the stripped sub-text
	 */
	@Nonnull
	String text() {
		return String.join("\n", this.contents);
	}

	/**
	 * Builds the transform mapping the stripped sub-text back to the parent space.
	 *
	 * @return content mapping with one entry per content line
	 */
	@Nonnull
	ContentMapping mapping() {
		final List<ContentMapping.StrippedLine> lines = new ArrayList<>(this.contents.size());
		int subOffset = 0;
		for (int i = 0; i < this.contents.size(); i++) {
			final String content = this.contents.get(i);
			final Line origin = this.origins.get(i);
			lines.add(
				new ContentMapping.StrippedLine(
					subOffset,
					origin.offset(),
					origin.lineNumber(),
					origin.raw().length() - content.length()
				)
			);
			subOffset += content.length() + 1;
		}
		return new ContentMapping(lines);
	}
}
