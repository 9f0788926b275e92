package io.evitadb.marginalia.parser;

/**
 * Result of matching a thematic break line.
 *
 * @param character the repeated character (`-`, `*` or `_`)
 * @param count     how many times it occurs on the line
 */
public record ThematicBreakMatch(char character, int count) {
}
