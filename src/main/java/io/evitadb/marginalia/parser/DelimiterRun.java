package io.evitadb.marginalia.parser;

/**
 * Candidate emphasis delimiter: a maximal run of `*` or `_` characters.
 *
 * The run refers to its text through the index of its {@link InlineSlots} slot. {@link #count} and {@link #canClose}
 * change while emphasis is resolved; everything derived from flanking stays as computed at creation.
 */
final class DelimiterRun {

	final char type;
	final int origCount;
	final boolean canOpen;
	final boolean opensAndCloses;
	final int slot;
	int count;
	boolean canClose;
	boolean active = true;

	private DelimiterRun(char type, int length, boolean canOpen, boolean canClose, int slot) {
		this.type = type;
		this.origCount = length;
		this.count = length;
		this.canOpen = canOpen;
		this.canClose = canClose;
		this.opensAndCloses = canOpen && canClose;
		this.slot = slot;
	}

	/**
	 * Creates a run and decides from its neighbours whether it may open or close emphasis.
	 *
	 * A run is left-flanking when it is not followed by whitespace, and either not followed by punctuation or preceded
	 * by whitespace or punctuation. Right-flanking is the mirror image. An underscore run inside a word can neither
	 * open nor close.
	 *
	 * @param type   `*` or `_`
	 * @param length number of characters in the run
	 * @param before character before the run, `\n` at the start of the text
	 * @param after  character after the run, `\n` at the end of the text
	 * @param slot   slot holding the run's text
	 * @return the run
	 */
	static DelimiterRun create(char type, int length, char before, char after, int slot) {
		final boolean beforeWhitespace = isWhitespace(before);
		final boolean afterWhitespace = isWhitespace(after);
		final boolean beforePunctuation = isPunctuation(before);
		final boolean afterPunctuation = isPunctuation(after);

		final boolean leftFlanking = !afterWhitespace
			&& (!afterPunctuation || beforeWhitespace || beforePunctuation);
		final boolean rightFlanking = !beforeWhitespace
			&& (!beforePunctuation || afterWhitespace || afterPunctuation);

		final boolean canOpen;
		final boolean canClose;
		if (type == '_') {
			canOpen = leftFlanking && (!rightFlanking || beforePunctuation);
			canClose = rightFlanking && (!leftFlanking || afterPunctuation);
		} else {
			canOpen = leftFlanking;
			canClose = rightFlanking;
		}
		return new DelimiterRun(type, length, canOpen, canClose, slot);
	}

	/**
	 * Returns true when matching this opener with the closer is forbidden by the multiple-of-three rule.
	 *
	 * @param closer the closing candidate
	 * @return true if the pair must not match
	 */
	boolean forbidsPairWith(DelimiterRun closer) {
		if (!this.opensAndCloses && !closer.opensAndCloses) {
			return false;
		}
		return (this.origCount + closer.origCount) % 3 == 0
			&& !(this.origCount % 3 == 0 && closer.origCount % 3 == 0);
	}

	static boolean isWhitespace(char ch) {
		return Character.isWhitespace(ch) || Character.getType(ch) == Character.SPACE_SEPARATOR;
	}

	static boolean isPunctuation(char ch) {
		if (Escaping.isAsciiPunctuation(ch)) {
			return true;
		}
		switch (Character.getType(ch)) {
			case Character.CONNECTOR_PUNCTUATION:
			case Character.DASH_PUNCTUATION:
			case Character.START_PUNCTUATION:
			case Character.END_PUNCTUATION:
			case Character.INITIAL_QUOTE_PUNCTUATION:
			case Character.FINAL_QUOTE_PUNCTUATION:
			case Character.OTHER_PUNCTUATION:
			case Character.MATH_SYMBOL:
			case Character.CURRENCY_SYMBOL:
			case Character.MODIFIER_SYMBOL:
			case Character.OTHER_SYMBOL:
				return true;
			default:
				return false;
		}
	}
}
