package io.evitadb.marginalia.parser;

import io.evitadb.marginalia.ast.Emphasis;
import io.evitadb.marginalia.ast.InlineNode;
import io.evitadb.marginalia.ast.Strong;
import io.evitadb.marginalia.ast.Text;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;

/**
 * Arena of inline node slots built while scanning one block.
 *
 * Slots are never inserted or shifted: a slot is either live or removed (a tombstone), so the slot index a
 * {@link DelimiterRun} remembers stays valid while emphasis is resolved. A slot holds either literal text with its
 * source span or a finished node.
 */
final class InlineSlots {

	@Nonnull
	private final List<Slot> slots = new ArrayList<>();
	@Nonnull
	private final PositionLocator locator;

	InlineSlots(@Nonnull PositionLocator locator) {
		this.locator = locator;
	}

	/**
	 * Appends literal text, merging it into the previous slot when that one is plain text ending where this one starts.
	 *
	 * @param value text value with escapes resolved
	 * @param start source index of the first character
	 * @param end   source index after the last character
	 */
	void appendText(@Nonnull String value, int start, int end) {
		final Slot last = lastLive();
		if (last != null && last.isText() && !last.delimiter && last.end == start) {
			last.value.append(value);
			last.end = end;
		} else {
			this.slots.add(Slot.text(value, start, end, false));
		}
	}

	/**
	 * Appends the text of a delimiter run into a slot of its own.
	 *
	 * @param value the run
	 * @param start source index of the first character
	 * @return index of the new slot
	 */
	int addDelimiterText(@Nonnull String value, int start) {
		this.slots.add(Slot.text(value, start, start + value.length(), true));
		return this.slots.size() - 1;
	}

	/**
	 * Appends a finished node.
	 *
	 * @param node the node
	 */
	void addNode(@Nonnull InlineNode node) {
		this.slots.add(Slot.node(node));
	}

	/**
	 * Drops spaces at the end of the last slot when it holds text. Tabs before a line break are content.
	 */
	void trimTrailingSpaces() {
		final Slot last = lastLive();
		if (last == null || !last.isText()) {
			return;
		}
		int length = last.value.length();
		while (length > 0 && last.value.charAt(length - 1) == ' ') {
			length--;
		}
		last.end -= last.value.length() - length;
		last.value.setLength(length);
		if (length == 0) {
			last.removed = true;
		}
	}

	/**
	 * Consumes {@code use} delimiter characters from the end of the opener slot and the start of the closer slot and
	 * replaces every live slot strictly between them with a single {@link Emphasis} (one character) or
	 * {@link Strong} (two characters) node.
	 *
	 * @param opener slot index of the opening delimiter run
	 * @param closer slot index of the closing delimiter run, greater than {@code opener + 1}
	 * @param use    1 or 2
	 */
	void wrap(int opener, int closer, int use) {
		final Slot open = this.slots.get(opener);
		final Slot close = this.slots.get(closer);

		open.value.setLength(open.value.length() - use);
		open.end -= use;
		final int start = open.end;
		final int end = close.start + use;
		close.value.delete(0, use);
		close.start += use;

		final List<InlineNode> children = materialize(opener + 1, closer);
		final InlineNode node = use == 2
			? new Strong(children, this.locator.span(start, end))
			: new Emphasis(children, this.locator.span(start, end));

		final Slot target = this.slots.get(opener + 1);
		target.node = node;
		target.value = null;
		target.delimiter = false;
		target.removed = false;

		if (open.value.length() == 0) {
			open.removed = true;
		}
		if (close.value.length() == 0) {
			close.removed = true;
		}
	}

	/**
	 * Returns the final node sequence with adjacent text merged.
	 *
	 * @return inline nodes
	 */
	@Nonnull
	List<InlineNode> toNodes() {
		return materialize(0, this.slots.size());
	}

	/**
	 * Turns live slots in {@code [from, to)} into nodes and removes them.
	 */
	@Nonnull
	private List<InlineNode> materialize(int from, int to) {
		final List<InlineNode> nodes = new ArrayList<>();
		StringBuilder text = null;
		int textStart = 0;
		int textEnd = 0;
		for (int i = from; i < to; i++) {
			final Slot slot = this.slots.get(i);
			if (slot.removed) {
				continue;
			}
			slot.removed = true;
			if (slot.isText()) {
				if (slot.value.length() == 0) {
					continue;
				}
				if (text == null) {
					text = new StringBuilder();
					textStart = slot.start;
				}
				text.append(slot.value);
				textEnd = slot.end;
			} else {
				if (text != null) {
					nodes.add(new Text(text.toString(), this.locator.span(textStart, textEnd)));
					text = null;
				}
				nodes.add(slot.node);
			}
		}
		if (text != null) {
			nodes.add(new Text(text.toString(), this.locator.span(textStart, textEnd)));
		}
		return nodes;
	}

	@Nullable
	private Slot lastLive() {
		for (int i = this.slots.size() - 1; i >= 0; i--) {
			final Slot slot = this.slots.get(i);
			if (!slot.removed) {
				return slot;
			}
		}
		return null;
	}

	/**
	 * One arena entry: literal text with its source span, or a finished node.
	 */
	private static final class Slot {

		@Nullable
		private StringBuilder value;
		@Nullable
		private InlineNode node;
		private int start;
		private int end;
		private boolean delimiter;
		private boolean removed;

		@Nonnull
		static Slot text(@Nonnull String value, int start, int end, boolean delimiter) {
			final Slot slot = new Slot();
			slot.value = new StringBuilder(value);
			slot.start = start;
			slot.end = end;
			slot.delimiter = delimiter;
			return slot;
		}

		@Nonnull
		static Slot node(@Nonnull InlineNode node) {
			final Slot slot = new Slot();
			slot.node = node;
			return slot;
		}

		boolean isText() {
			return this.value != null;
		}
	}
}
