package io.evitadb.marginalia.serialize;

import io.evitadb.marginalia.parser.MarkdownParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

@DisplayName("OutlineRenderer should print the node structure without positions")
public class OutlineRendererTest {

	private final MarkdownParser parser = new MarkdownParser();
	private final OutlineRenderer renderer = new OutlineRenderer();

	@Test
	@DisplayName("renders blocks and inlines with attributes")
	void shouldRenderStructure() throws Exception {
		final String expected = String.join(
			"\n",
			"document",
			"  heading level=1",
			"    text \"A\"",
			"  blank_line",
			"  list ordered=false start=1 tight=true",
			"    item marker=\"-\"",
			"      paragraph",
			"        link destination=\"/u\" title=\"t\"",
			"          text \"x\"",
			"        soft_break",
			"        emphasis",
			"          text \"e\"",
			"    item marker=\"-\"",
			"      paragraph",
			"        code_span \"c\"",
			"        hard_break",
			"        strong",
			"          text \"s\""
		);

		assertEquals(expected, this.renderer.render(this.parser.parse("# A\n\n- [x](/u \"t\")\n  *e*\n- `c`\\\n  **s**")));
	}

	@Test
	@DisplayName("renders leaf blocks and quotes special characters")
	void shouldRenderLeafBlocks() throws Exception {
		final String expected = String.join(
			"\n",
			"document",
			"  code_block info=\"js\" \"let s = \\\"q\\\";\\n\"",
			"  thematic_break",
			"  block_quote",
			"    paragraph",
			"      text \"q\""
		);

		assertEquals(expected, this.renderer.render(this.parser.parse("```js\nlet s = \"q\";\n```\n---\n> q")));
	}

	@Test
	@DisplayName("renders an empty document as a single line")
	void shouldRenderEmptyDocument() throws Exception {
		assertEquals("document", this.renderer.render(this.parser.parse("")));
	}
}
