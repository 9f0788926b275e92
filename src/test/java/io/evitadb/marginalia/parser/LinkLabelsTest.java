package io.evitadb.marginalia.parser;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

@DisplayName("LinkLabels should normalize labels for lookup")
public class LinkLabelsTest {

	@Test
	@DisplayName("trims and collapses whitespace")
	void shouldCollapseWhitespace() {
		assertEquals("foo bar", LinkLabels.normalize("  Foo \t\n Bar "));
	}

	@Test
	@DisplayName("folds case")
	void shouldFoldCase() {
		assertEquals(LinkLabels.normalize("FOO"), LinkLabels.normalize("foo"));
		assertEquals(LinkLabels.normalize("STRASSE"), LinkLabels.normalize("Straße"));
	}

	@Test
	@DisplayName("blank label normalizes to empty string")
	void shouldNormalizeBlankToEmpty() {
		assertEquals("", LinkLabels.normalize(" \t "));
	}
}
