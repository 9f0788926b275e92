package io.evitadb.marginalia.ast;

import javax.annotation.Nonnull;

/**
 * Character-level node inside a heading or paragraph. The hierarchy is closed; use {@link InlineVisitor} to
 * dispatch over it.
 */
public sealed interface InlineNode extends Node
	permits Text, Emphasis, Strong, Link, SoftBreak, HardBreak, CodeSpan {

	/**
	 * Dispatches this node to the matching method of the visitor.
	 *
	 * @param visitor the visitor
	 * @param <R>     visitor result type
	 * @return the visitor's result
	 */
	<R> R accept(@Nonnull InlineVisitor<R> visitor);
}
