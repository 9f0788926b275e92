package io.evitadb.marginalia.parser;

import io.evitadb.marginalia.ast.Document;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Parses markdown text into an immutable {@link Document}.
 *
 * Parsing runs in two phases. The block phase reads the whole input, builds the block tree and collects every link
 * reference definition. Only then the inline phase parses headings and paragraphs, so a reference may be used before
 * it is defined.
 *
 * Instances are immutable and can be shared between threads; every call owns its own state.
 */
public final class MarkdownParser {

	@Nonnull
	private final ParserOptions options;

	/**
	 * Creates a parser with default options.
	 */
	public MarkdownParser() {
		this(ParserOptions.defaults());
	}

	/**
	 * Creates a parser with the given options.
	 *
	 * @param options parser limits
	 */
	public MarkdownParser(@Nonnull ParserOptions options) {
		this.options = Objects.requireNonNull(options, "options must not be null");
	}

	/**
	 * Parses the given text.
	 *
	 * @param input markdown text
	 * @return the document tree
	 * @throws TooDeeplyNestedException         when containers or link texts nest deeper than allowed
	 * @throws MalformedDelimiterStateException when emphasis resolution breaks its invariants
	 * @throws MarkdownParseException           for any other fatal parse failure
	 */
	@Nonnull
	public Document parse(@Nonnull String input) throws MarkdownParseException {
		Objects.requireNonNull(input, "input must not be null");
		final BlockParseResult blocks = BlockParser.parse(input, this.options);
		return new InlinePhase(blocks.references(), this.options).apply(blocks.document());
	}

	/**
	 * Returns the options of this parser.
	 *
	 * @return parser limits
	 */
	@Nonnull
	public ParserOptions getOptions() {
		return this.options;
	}
}
