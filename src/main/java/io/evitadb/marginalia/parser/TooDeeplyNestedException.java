package io.evitadb.marginalia.parser;

/**
 * Thrown when container blocks or links are nested deeper than {@link ParserOptions#maxNestingDepth()} allows.
 */
public final class TooDeeplyNestedException extends MarkdownParseException {

	private final int depth;
	private final int limit;
	private final int lineNumber;

	/**
	 * Creates a new TooDeeplyNestedException.
	 *
	 * @param depth      the nesting depth that was about to be entered
	 * @param limit      the configured maximum depth
	 * @param lineNumber line of the construct that exceeded the limit, relative to its own container, or 0 if unknown
	 */
	public TooDeeplyNestedException(int depth, int limit, int lineNumber) {
		super(formatMessage(depth, limit, lineNumber));
		this.depth = depth;
		this.limit = limit;
		this.lineNumber = lineNumber;
	}

	private static String formatMessage(int depth, int limit, int lineNumber) {
		final String message = "Nesting depth " + depth + " exceeds the limit of " + limit;
		if (lineNumber > 0) {
			return message + " at line " + lineNumber;
		}
		return message;
	}

	/**
	 * Returns the nesting depth that was about to be entered.
	 *
	 * @return depth greater than the limit
	 */
	public int getDepth() {
		return this.depth;
	}

	/**
	 * Returns the configured maximum nesting depth.
	 *
	 * @return the limit
	 */
	public int getLimit() {
		return this.limit;
	}

	/**
	 * Returns the line of the offending construct within its container.
	 *
	 * @return line number (1-based), or 0 if unknown
	 */
	public int getLineNumber() {
		return this.lineNumber;
	}
}
