package io.evitadb.marginalia.check;

import io.evitadb.marginalia.ast.Document;
import io.evitadb.marginalia.parser.MalformedDelimiterStateException;
import io.evitadb.marginalia.parser.MarkdownParseException;
import io.evitadb.marginalia.parser.MarkdownParser;
import io.evitadb.marginalia.parser.TooDeeplyNestedException;
import io.evitadb.marginalia.serialize.MarkdownSerializer;
import io.evitadb.marginalia.serialize.OutlineRenderer;

import javax.annotation.Nonnull;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Parses markdown files and verifies that each one survives a canonical round trip.
 * Collects all errors for batch reporting at the end of the check.
 */
public final class MarkdownChecker {

	@Nonnull
	private final MarkdownParser parser;
	@Nonnull
	private final MarkdownSerializer serializer = new MarkdownSerializer();
	@Nonnull
	private final OutlineRenderer outlineRenderer = new OutlineRenderer();
	@Nonnull
	private final List<ParseFailure> parseFailures = new ArrayList<>();
	@Nonnull
	private final List<RoundTripError> roundTripErrors = new ArrayList<>();
	@Nonnull
	private DocumentStatistics statistics = DocumentStatistics.EMPTY;

	/**
	 * Creates a MarkdownChecker.
	 *
	 * @param parser the parser used for every file
	 */
	public MarkdownChecker(@Nonnull MarkdownParser parser) {
		this.parser = Objects.requireNonNull(parser, "parser must not be null");
	}

	/**
	 * Checks a single file.
	 *
	 * @param file    the file to check
	 * @param content the file content
	 */
	public void checkFile(@Nonnull Path file, @Nonnull String content) {
		Objects.requireNonNull(file, "file must not be null");
		Objects.requireNonNull(content, "content must not be null");

		final Document document;
		try {
			document = this.parser.parse(content);
		} catch (TooDeeplyNestedException e) {
			this.parseFailures.add(
				new ParseFailure(file, ParseFailure.ParseFailureType.TOO_DEEPLY_NESTED, e.getMessage(), e.getLineNumber())
			);
			return;
		} catch (MalformedDelimiterStateException e) {
			this.parseFailures.add(
				new ParseFailure(file, ParseFailure.ParseFailureType.MALFORMED_DELIMITER_STATE, e.getMessage(), 0)
			);
			return;
		} catch (MarkdownParseException e) {
			throw new IllegalStateException("Unsupported parse failure type: " + e.getClass().getName(), e);
		}

		this.statistics = this.statistics.plus(DocumentStatistics.of(document));
		checkRoundTrip(file, document);
	}

	/**
	 * Returns the collected check result with all errors.
	 *
	 * @return aggregated CheckResult
	 */
	@Nonnull
	public CheckResult getResult() {
		return new CheckResult(this.parseFailures, this.roundTripErrors, this.statistics);
	}

	/**
	 * Re-parses the canonical form of the document and compares the outlines of both trees.
	 *
	 * @param file     the source file
	 * @param document the parsed document
	 */
	private void checkRoundTrip(@Nonnull Path file, @Nonnull Document document) {
		final String expected = this.outlineRenderer.render(document);
		final String actual;
		try {
			actual = this.outlineRenderer.render(this.parser.parse(this.serializer.serialize(document)));
		} catch (MarkdownParseException e) {
			this.roundTripErrors.add(new RoundTripError(file, 1, "document", e.getMessage()));
			return;
		}
		if (expected.equals(actual)) {
			return;
		}

		final String[] expectedLines = expected.split("\n", -1);
		final String[] actualLines = actual.split("\n", -1);
		int line = 0;
		while (line < expectedLines.length && line < actualLines.length && expectedLines[line].equals(actualLines[line])) {
			line++;
		}
		this.roundTripErrors.add(
			new RoundTripError(
				file,
				line + 1,
				line < expectedLines.length ? expectedLines[line].strip() : "<end>",
				line < actualLines.length ? actualLines[line].strip() : "<end>"
			)
		);
	}
}
