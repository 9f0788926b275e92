package io.evitadb.marginalia.parser;

import javax.annotation.Nonnull;
import java.util.List;

/**
 * Pairs emphasis delimiter runs and wraps the content between each matched pair.
 *
 * The loop repeatedly takes the earliest active closer and looks backwards for the nearest compatible opener. Every
 * iteration either consumes at least one delimiter character or retires a closer, so it is bounded by the total
 * number of delimiter characters plus the number of runs.
 */
final class DelimiterResolver {

	@Nonnull
	private final List<DelimiterRun> delimiters;
	@Nonnull
	private final InlineSlots slots;

	DelimiterResolver(@Nonnull List<DelimiterRun> delimiters, @Nonnull InlineSlots slots) {
		this.delimiters = delimiters;
		this.slots = slots;
	}

	/**
	 * Matches all delimiter runs. Unmatched characters stay in their slots as literal text.
	 *
	 * @throws MalformedDelimiterStateException when the iteration bound is exceeded or a pair is not ordered
	 */
	void resolve() throws MalformedDelimiterStateException {
		int bound = this.delimiters.size() + 1;
		for (final DelimiterRun delimiter : this.delimiters) {
			bound += delimiter.origCount;
		}

		int iterations = 0;
		while (true) {
			if (++iterations > bound) {
				throw new MalformedDelimiterStateException("Emphasis resolution did not terminate", bound);
			}

			final int closerIndex = findCloser();
			if (closerIndex < 0) {
				return;
			}
			final DelimiterRun closer = this.delimiters.get(closerIndex);

			final int openerIndex = findOpener(closerIndex, closer);
			if (openerIndex < 0) {
				closer.canClose = false;
				if (!closer.canOpen) {
					closer.active = false;
				}
				continue;
			}
			final DelimiterRun opener = this.delimiters.get(openerIndex);
			if (opener.slot + 1 >= closer.slot) {
				throw new MalformedDelimiterStateException(
					"Opener slot " + opener.slot + " does not precede closer slot " + closer.slot, bound
				);
			}

			final int use = opener.count >= 2 && closer.count >= 2 ? 2 : 1;
			this.slots.wrap(opener.slot, closer.slot, use);
			opener.count -= use;
			closer.count -= use;

			for (int i = openerIndex + 1; i < closerIndex; i++) {
				this.delimiters.get(i).active = false;
			}
			if (opener.count == 0) {
				opener.active = false;
			}
			if (closer.count == 0) {
				closer.active = false;
			}
		}
	}

	private int findCloser() {
		for (int i = 0; i < this.delimiters.size(); i++) {
			final DelimiterRun candidate = this.delimiters.get(i);
			if (candidate.active && candidate.canClose && candidate.count > 0) {
				return i;
			}
		}
		return -1;
	}

	private int findOpener(int closerIndex, @Nonnull DelimiterRun closer) {
		for (int i = closerIndex - 1; i >= 0; i--) {
			final DelimiterRun candidate = this.delimiters.get(i);
			if (!candidate.active || !candidate.canOpen || candidate.count == 0 || candidate.type != closer.type) {
				continue;
			}
			if (candidate.forbidsPairWith(closer)) {
				continue;
			}
			return i;
		}
		return -1;
	}
}
