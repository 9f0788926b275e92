package io.evitadb.marginalia.parser;

import io.evitadb.marginalia.ast.BlockNode;
import io.evitadb.marginalia.ast.BlockQuote;
import io.evitadb.marginalia.ast.CodeSpan;
import io.evitadb.marginalia.ast.Document;
import io.evitadb.marginalia.ast.Emphasis;
import io.evitadb.marginalia.ast.Heading;
import io.evitadb.marginalia.ast.InlineNode;
import io.evitadb.marginalia.ast.Link;
import io.evitadb.marginalia.ast.ListBlock;
import io.evitadb.marginalia.ast.ListItem;
import io.evitadb.marginalia.ast.Paragraph;
import io.evitadb.marginalia.ast.Strong;
import io.evitadb.marginalia.ast.Text;
import io.evitadb.marginalia.ast.ThematicBreak;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("MarkdownParser should parse documents in two phases")
public class MarkdownParserTest {

	private MarkdownParser parser;

	@BeforeEach
	void setUp() {
		this.parser = new MarkdownParser();
	}

	private List<InlineNode> paragraphInlines(String input) throws MarkdownParseException {
		final Document document = this.parser.parse(input);
		return assertInstanceOf(Paragraph.class, document.children().get(0)).children();
	}

	@Test
	@DisplayName("uses default options when none are given")
	void shouldUseDefaultOptions() {
		assertEquals(ParserOptions.DEFAULT_MAX_NESTING_DEPTH, this.parser.getOptions().maxNestingDepth());
		final ParserOptions options = new ParserOptions(3);
		assertSame(options, new MarkdownParser(options).getOptions());
		assertThrows(IllegalArgumentException.class, () -> new ParserOptions(0));
	}

	@Test
	@DisplayName("keeps the source text on the document")
	void shouldKeepSource() throws Exception {
		assertEquals("# A\n", this.parser.parse("# A\n").source());
	}

	@Test
	@DisplayName("seven hashes are not a heading")
	void shouldNotParseSevenHashesAsHeading() throws Exception {
		final Paragraph paragraph = assertInstanceOf(Paragraph.class, this.parser.parse("####### x").children().get(0));
		assertEquals("####### x", ((Text) paragraph.children().get(0)).value());
	}

	@Test
	@DisplayName("spaced dashes are a thematic break")
	void shouldParseSpacedDashesAsThematicBreak() throws Exception {
		assertInstanceOf(ThematicBreak.class, this.parser.parse("- - -").children().get(0));
	}

	@Test
	@DisplayName("tightness depends on blank lines between items")
	void shouldDetectTightness() throws Exception {
		assertTrue(assertInstanceOf(ListBlock.class, this.parser.parse("- a\n- b").children().get(0)).tight());
		assertFalse(assertInstanceOf(ListBlock.class, this.parser.parse("- a\n\n- b").children().get(0)).tight());
	}

	@Test
	@DisplayName("code span wins over emphasis")
	void shouldPreferCodeSpan() throws Exception {
		final List<InlineNode> inlines = paragraphInlines("`*foo*`");

		assertEquals(1, inlines.size());
		assertEquals("*foo*", assertInstanceOf(CodeSpan.class, inlines.get(0)).value());
	}

	@Test
	@DisplayName("triple delimiters give emphasis around strong")
	void shouldParseTripleDelimiters() throws Exception {
		final Emphasis emphasis = assertInstanceOf(Emphasis.class, paragraphInlines("***foo***").get(0));
		final Strong strong = assertInstanceOf(Strong.class, emphasis.children().get(0));
		assertEquals("foo", assertInstanceOf(Text.class, strong.children().get(0)).value());
	}

	@Test
	@DisplayName("references may be used before they are defined")
	void shouldResolveForwardReference() throws Exception {
		final Link link = assertInstanceOf(Link.class, paragraphInlines("[foo][bar]\n\n[bar]: /url").get(0));
		assertEquals("/url", link.destination());
	}

	@Test
	@DisplayName("reference labels match case-insensitively")
	void shouldMatchLabelsCaseInsensitively() throws Exception {
		final Link link = assertInstanceOf(Link.class, paragraphInlines("[FOO]\n\n[foo]: /url").get(0));
		assertEquals("/url", link.destination());
	}

	@Test
	@DisplayName("the first definition of a label wins")
	void shouldUseFirstDefinition() throws Exception {
		final Link link = assertInstanceOf(
			Link.class, paragraphInlines("[foo]\n\n[foo]: /url1\n[foo]: /url2").get(0)
		);
		assertEquals("/url1", link.destination());
	}

	@Test
	@DisplayName("nested list stays inside its item and both lists are tight")
	void shouldParseNestedTightLists() throws Exception {
		final List<BlockNode> children = this.parser.parse("- a\n  - b\n- c").children();

		assertEquals(1, children.size());
		final ListBlock outer = assertInstanceOf(ListBlock.class, children.get(0));
		assertTrue(outer.tight());
		assertEquals(2, outer.children().size());
		final ListItem first = outer.children().get(0);
		final ListBlock inner = assertInstanceOf(ListBlock.class, first.children().get(1));
		assertTrue(inner.tight());
		final Paragraph b = assertInstanceOf(Paragraph.class, inner.children().get(0).children().get(0));
		assertEquals("b", ((Text) b.children().get(0)).value());
	}

	@Test
	@DisplayName("inline content of nested blocks is parsed")
	void shouldParseInlinesInContainers() throws Exception {
		final BlockQuote quote = assertInstanceOf(BlockQuote.class, this.parser.parse("> # *Title*").children().get(0));
		final Heading heading = assertInstanceOf(Heading.class, quote.children().get(0));
		assertInstanceOf(Emphasis.class, heading.children().get(0));
	}

	@Test
	@DisplayName("rejects documents nested deeper than the limit")
	void shouldRejectDeepNesting() {
		final String deep = "> ".repeat(100) + "a";

		final TooDeeplyNestedException exception = assertThrows(
			TooDeeplyNestedException.class, () -> this.parser.parse(deep)
		);
		assertEquals(ParserOptions.DEFAULT_MAX_NESTING_DEPTH + 1, exception.getDepth());
		assertTrue(exception.getMessage().startsWith("Nesting depth 65 exceeds the limit of 64"));
	}

	@Test
	@DisplayName("link text inside containers counts against the limit")
	void shouldCountLinksInContainers() throws Exception {
		final MarkdownParser limited = new MarkdownParser(new ParserOptions(2));

		limited.parse("> [a](/u)");
		assertThrows(TooDeeplyNestedException.class, () -> limited.parse("> > [a](/u)"));
	}
}
