package io.evitadb.marginalia.parser;

/**
 * Single-line block construct a line introduces, in dispatch precedence order.
 * Link reference definitions are not listed because they may span two lines.
 */
public enum BlockKind {

	BLANK,
	ATX_HEADING,

	/**
	 * Checked before {@link #LIST_ITEM}: `- - -` is a rule, not a list.
	 */
	THEMATIC_BREAK,
	CODE_FENCE,
	BLOCK_QUOTE,
	LIST_ITEM,

	/**
	 * Fallback when nothing else matches.
	 */
	PARAGRAPH
}
