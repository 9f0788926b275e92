package io.evitadb.marginalia.ast;

import javax.annotation.Nonnull;

/**
 * Visitor over the closed set of block nodes.
 *
 * @param <R> result type
 */
public interface BlockVisitor<R> {

	R visitHeading(@Nonnull Heading heading);

	R visitParagraph(@Nonnull Paragraph paragraph);

	R visitBlankLine(@Nonnull BlankLine blankLine);

	R visitList(@Nonnull ListBlock list);

	R visitListItem(@Nonnull ListItem listItem);

	R visitThematicBreak(@Nonnull ThematicBreak thematicBreak);

	R visitCodeBlock(@Nonnull CodeBlock codeBlock);

	R visitBlockQuote(@Nonnull BlockQuote blockQuote);
}
