package io.evitadb.marginalia.ast;

import javax.annotation.Nonnull;

/**
 * Line-oriented structural node. The hierarchy is closed; use {@link BlockVisitor} to dispatch over it.
 */
public sealed interface BlockNode extends Node
	permits Heading, Paragraph, BlankLine, ListBlock, ListItem, ThematicBreak, CodeBlock, BlockQuote {

	/**
	 * Dispatches this node to the matching method of the visitor.
	 *
	 * @param visitor the visitor
	 * @param <R>     visitor result type
	 * @return the visitor's result
	 */
	<R> R accept(@Nonnull BlockVisitor<R> visitor);
}
