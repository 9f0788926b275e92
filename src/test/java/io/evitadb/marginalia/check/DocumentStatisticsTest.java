package io.evitadb.marginalia.check;

import io.evitadb.marginalia.parser.MarkdownParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

@DisplayName("DocumentStatistics should count nodes of parsed documents")
public class DocumentStatisticsTest {

	private final MarkdownParser parser = new MarkdownParser();

	@Test
	@DisplayName("counts every kind of node including nested ones")
	void shouldCountNodes() throws Exception {
		final DocumentStatistics statistics = DocumentStatistics.of(
			this.parser.parse("# T\n\n- a\n- [b](/u)\n\n> q\n> > r\n\n```\nx\n```\n")
		);

		assertEquals(new DocumentStatistics(1, 1, 4, 1, 2, 2, 1, 1, 2), statistics);
	}

	@Test
	@DisplayName("adds counts and keeps the deepest nesting")
	void shouldAddStatistics() {
		final DocumentStatistics first = new DocumentStatistics(1, 2, 3, 0, 0, 1, 0, 4, 1);
		final DocumentStatistics second = new DocumentStatistics(1, 1, 1, 1, 2, 0, 1, 0, 3);

		assertEquals(new DocumentStatistics(2, 3, 4, 1, 2, 1, 1, 4, 3), first.plus(second));
		assertEquals(first, DocumentStatistics.EMPTY.plus(first));
	}
}
