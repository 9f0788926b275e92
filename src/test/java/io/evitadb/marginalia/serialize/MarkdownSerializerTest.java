package io.evitadb.marginalia.serialize;

import io.evitadb.marginalia.ast.Document;
import io.evitadb.marginalia.parser.MarkdownParseException;
import io.evitadb.marginalia.parser.MarkdownParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

@DisplayName("MarkdownSerializer should write canonical markdown that parses to the same structure")
public class MarkdownSerializerTest {

	private static final List<String> CORPUS = List.of(
		"# Title\n\nSome *emphasis* and **strong** text.\n",
		"- a\n  - b\n- c",
		"> quote\n> more\n\n```java\ncode\n```",
		"1. one\n2. two\n\n- x",
		"- a\n\n- b",
		"- a\n\n  b\n- c",
		"> - a\n> - b\n>\n> para",
		"Text with `code` and [link](</a b> 'T') here.",
		"## Title ##",
		"***strong emph*** and *__mixed__*",
		"a\n\n***\n\nb",
		"Escaped \\* star and 3. here\n\n3\\. not a list",
		"Line one  \nline two\\\nthree",
		"\\#hashtag and snake_case_name",
		"a\n+b",
		"- ```\n  code\n  ```",
		"~~~ a`b\nx\n~~~",
		"-\n- a",
		"-\n\n- a",
		"*\n\n*",
		"- a\n-\n\n- b",
		"**`x`** and *a* *b*",
		"[a [b] c](/u) and [a](/u(1)) and [a](/u \"say \\\"hi\\\"\")",
		"0. zero",
		"[link][ref] and `code`\n\n[ref]: /url \"Title\"",
		"\n\n"
	);

	private MarkdownParser parser;
	private MarkdownSerializer serializer;
	private OutlineRenderer outline;

	@BeforeEach
	void setUp() {
		this.parser = new MarkdownParser();
		this.serializer = new MarkdownSerializer();
		this.outline = new OutlineRenderer();
	}

	private String serialize(String input) throws MarkdownParseException {
		return this.serializer.serialize(this.parser.parse(input));
	}

	@Test
	@DisplayName("re-parsing the output yields the same structure")
	void shouldPreserveStructure() throws Exception {
		for (final String input : CORPUS) {
			final Document original = this.parser.parse(input);
			final String serialized = this.serializer.serialize(original);
			final Document reparsed = this.parser.parse(serialized);

			assertEquals(
				this.outline.render(original),
				this.outline.render(reparsed),
				"Structure of " + input + " serialized as " + serialized
			);
		}
	}

	@Test
	@DisplayName("serializing canonical output again changes nothing")
	void shouldBeStableOnCanonicalOutput() throws Exception {
		for (final String input : CORPUS) {
			final String once = serialize(input);
			assertEquals(once, serialize(once), "Canonical form of " + input);
		}
	}

	@Test
	@DisplayName("writes inline markup canonically")
	void shouldWriteInlineMarkup() throws Exception {
		assertEquals("# Title\n\nSome *emphasis* and **strong** text.\n", serialize("# Title\n\nSome _emphasis_ and __strong__ text."));
		assertEquals("***x***\n", serialize("***x***"));
		assertEquals("**_x_**\n", serialize("**_x_**"));
		assertEquals("a\\\nb\n", serialize("a  \nb"));
		assertEquals("``a`b``\n", serialize("``a`b``"));
	}

	@Test
	@DisplayName("turns reference links into inline links")
	void shouldInlineReferenceLinks() throws Exception {
		assertEquals("[link](/url \"Title\")\n\n", serialize("[link][ref]\n\n[ref]: /url \"Title\""));
		assertEquals("[a](<>)\n", serialize("[a]()"));
		assertEquals("[a](</u(1)>)\n", serialize("[a](/u(1))"));
	}

	@Test
	@DisplayName("escapes characters that would change the structure")
	void shouldEscapeSignificantCharacters() throws Exception {
		assertEquals("snake\\_case\n", serialize("snake_case"));
		assertEquals("1\\. not a list\n", serialize("1\\. not a list"));
		assertEquals("\\- not a list\n", serialize("\\- not a list"));
		assertEquals("\\#hashtag\n", serialize("#hashtag"));
	}

	@Test
	@DisplayName("normalizes blocks")
	void shouldNormalizeBlocks() throws Exception {
		assertEquals("* a\n* b\n", serialize("* a\n* b"));
		assertEquals("___\n", serialize("***"));
		assertEquals("## Title\n", serialize("## Title ##"));
		assertEquals("````\na ``` b\n````\n", serialize("```\na ``` b\n```"));
		assertEquals("> a\n>\n> b\n", serialize("> a\n>\n> b"));
		assertEquals("-\n\n- a\n", serialize("-\n\n- a"));
		assertEquals("- a\n-\n\n- b\n", serialize("- a\n-\n\n- b"));
		assertEquals("", serialize(""));
	}
}
