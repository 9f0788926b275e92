package io.evitadb.marginalia.parser;

/**
 * Result of matching a block quote line.
 *
 * @param markerLength length of the prefix to strip: indentation, `>` and one optional space
 */
public record BlockQuoteMatch(int markerLength) {
}
