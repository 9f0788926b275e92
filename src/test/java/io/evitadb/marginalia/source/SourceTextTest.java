package io.evitadb.marginalia.source;

import io.evitadb.marginalia.ast.BlockQuote;
import io.evitadb.marginalia.ast.Document;
import io.evitadb.marginalia.ast.Emphasis;
import io.evitadb.marginalia.ast.Heading;
import io.evitadb.marginalia.ast.ListBlock;
import io.evitadb.marginalia.ast.ListItem;
import io.evitadb.marginalia.ast.Paragraph;
import io.evitadb.marginalia.ast.Position;
import io.evitadb.marginalia.ast.SourceLocation;
import io.evitadb.marginalia.ast.Text;
import io.evitadb.marginalia.parser.MarkdownParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("SourceText should resolve nodes back to the original input")
public class SourceTextTest {

	private MarkdownParser parser;

	@BeforeEach
	void setUp() {
		this.parser = new MarkdownParser();
	}

	@Test
	@DisplayName("document location reproduces the whole input")
	void shouldReproduceInput() throws Exception {
		for (final String input : List.of("", "   ", "\n", "a", "a\n", "# A\n\nB\n", "- a\n  - b\n- c", "> q\n> r\n")) {
			assertEquals(input, new SourceText(this.parser.parse(input)).getText(), "Round trip of " + input);
		}
	}

	@Test
	@DisplayName("resolves nodes nested in list items to document offsets")
	void shouldResolveNestedListNodes() throws Exception {
		final Document document = this.parser.parse("- a\n  - b\n- c");
		final SourceText source = new SourceText(document);

		final ListItem outerItem = ((ListBlock) document.children().get(0)).children().get(0);
		final ListBlock inner = (ListBlock) outerItem.children().get(1);
		final Paragraph paragraph = (Paragraph) inner.children().get(0).children().get(0);
		final Text b = (Text) paragraph.children().get(0);

		assertEquals("- b", source.getText(inner));
		assertEquals("b", source.getText(b));
		assertEquals(
			new SourceLocation(new Position(2, 5, 8), new Position(2, 6, 9)),
			source.locate(b)
		);
		assertEquals(2, source.getNestingDepth(b));
		assertEquals(1, source.getNestingDepth(inner));
		assertEquals("a\n- b", source.getSpaceText(inner));
		assertEquals("b", source.getSpaceText(b));
	}

	@Test
	@DisplayName("resolves inline nodes inside block quotes")
	void shouldResolveQuotedInlines() throws Exception {
		final Document document = this.parser.parse("> # Title\n> text *em*");
		final SourceText source = new SourceText(document);

		final BlockQuote quote = (BlockQuote) document.children().get(0);
		final Heading heading = (Heading) quote.children().get(0);
		final Paragraph paragraph = (Paragraph) quote.children().get(1);
		final Emphasis emphasis = (Emphasis) paragraph.children().get(1);

		assertEquals("Title", source.getText(heading.children().get(0)));
		assertEquals(4, source.locate(heading.children().get(0)).start().offset());
		assertEquals("*em*", source.getText(emphasis));
		assertEquals("em", source.getText(emphasis.children().get(0)));
	}

	@Test
	@DisplayName("a multi-line span includes the container markers between its lines")
	void shouldIncludeMarkersInMultiLineSpan() throws Exception {
		final Document document = this.parser.parse("> a\n> b");
		final SourceText source = new SourceText(document);
		final Paragraph paragraph = (Paragraph) ((BlockQuote) document.children().get(0)).children().get(0);

		assertEquals("a\n> b", source.getText(paragraph));
		assertEquals("a\nb", source.getSpaceText(paragraph).substring(
			paragraph.sourceLocation().start().offset(), paragraph.sourceLocation().end().offset()
		));
	}

	@Test
	@DisplayName("lazy continuation lines map back without a marker")
	void shouldMapLazyLines() throws Exception {
		final Document document = this.parser.parse("> a\nb");
		final SourceText source = new SourceText(document);
		final Paragraph paragraph = (Paragraph) ((BlockQuote) document.children().get(0)).children().get(0);

		assertEquals("a\nb", source.getText(paragraph));
	}

	@Test
	@DisplayName("top-level nodes live in document space")
	void shouldKeepTopLevelNodesInDocumentSpace() throws Exception {
		final Document document = this.parser.parse("para");
		final SourceText source = new SourceText(document);
		final Paragraph paragraph = (Paragraph) document.children().get(0);

		assertEquals(0, source.getNestingDepth(paragraph));
		assertEquals("para", source.getSpaceText(paragraph));
		assertEquals(paragraph.sourceLocation(), source.locate(paragraph));
	}

	@Test
	@DisplayName("rejects nodes of other documents")
	void shouldRejectForeignNode() throws Exception {
		final SourceText source = new SourceText(this.parser.parse("a"));
		final Document other = this.parser.parse("b");

		assertThrows(IllegalArgumentException.class, () -> source.getText(other.children().get(0)));
	}
}
