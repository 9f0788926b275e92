package io.evitadb.marginalia.check;

import io.evitadb.marginalia.ast.Document;
import io.evitadb.marginalia.parser.MalformedDelimiterStateException;
import io.evitadb.marginalia.parser.MarkdownParser;
import io.evitadb.marginalia.parser.ParserOptions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("MarkdownChecker should collect parse failures and round trip errors")
public class MarkdownCheckerTest {

	private static final Path FILE = Path.of("docs/test.md");

	@Test
	@DisplayName("passes well-formed documents and sums their statistics")
	void shouldPassWellFormedDocuments() {
		final MarkdownChecker checker = new MarkdownChecker(new MarkdownParser());

		checker.checkFile(Path.of("docs/index.md"), "# Index\n\nSee [guide](guide.md).\n");
		checker.checkFile(Path.of("docs/guide.md"), "# Guide\n\n- one\n- two\n");
		final CheckResult result = checker.getResult();

		assertTrue(result.isSuccess());
		assertEquals(0, result.errorCount());
		assertEquals(2, result.statistics().documents());
		assertEquals(2, result.statistics().headings());
		assertEquals(1, result.statistics().links());
		assertEquals(2, result.statistics().listItems());
	}

	@Test
	@DisplayName("records documents nested deeper than the limit")
	void shouldRecordTooDeeplyNested() {
		final MarkdownChecker checker = new MarkdownChecker(new MarkdownParser(new ParserOptions(2)));

		checker.checkFile(FILE, "> > > deep");
		final CheckResult result = checker.getResult();

		assertFalse(result.isSuccess());
		assertEquals(1, result.parseFailures().size());
		final ParseFailure failure = result.parseFailures().get(0);
		assertEquals(FILE, failure.file());
		assertEquals(ParseFailure.ParseFailureType.TOO_DEEPLY_NESTED, failure.type());
		assertEquals(1, failure.lineNumber());
		assertEquals(0, result.statistics().documents());
	}

	@Test
	@DisplayName("records a malformed delimiter state reported by the parser")
	void shouldRecordMalformedDelimiterState() throws Exception {
		final MarkdownParser parser = mock(MarkdownParser.class);
		when(parser.parse("*a*")).thenThrow(new MalformedDelimiterStateException("broken", 3));
		final MarkdownChecker checker = new MarkdownChecker(parser);

		checker.checkFile(FILE, "*a*");
		final ParseFailure failure = checker.getResult().parseFailures().get(0);

		assertEquals(ParseFailure.ParseFailureType.MALFORMED_DELIMITER_STATE, failure.type());
		assertEquals("broken (iteration bound 3)", failure.message());
	}

	@Test
	@DisplayName("reports the first outline line that differs after the round trip")
	void shouldReportRoundTripDifference() throws Exception {
		final MarkdownParser realParser = new MarkdownParser();
		final Document paragraph = realParser.parse("a");
		final Document heading = realParser.parse("# a");

		final MarkdownParser parser = mock(MarkdownParser.class);
		when(parser.parse("a")).thenReturn(paragraph);
		when(parser.parse("a\n")).thenReturn(heading);
		final MarkdownChecker checker = new MarkdownChecker(parser);

		checker.checkFile(FILE, "a");
		final CheckResult result = checker.getResult();

		assertEquals(1, result.errorCount());
		final RoundTripError error = result.roundTripErrors().get(0);
		assertEquals(2, error.outlineLine());
		assertEquals("paragraph", error.expected());
		assertEquals("heading level=1", error.actual());
		assertEquals(1, result.statistics().paragraphs());
	}
}
