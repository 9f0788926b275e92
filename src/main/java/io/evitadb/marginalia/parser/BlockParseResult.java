package io.evitadb.marginalia.parser;

import io.evitadb.marginalia.ast.Document;
import io.evitadb.marginalia.ast.LinkReference;

import javax.annotation.Nonnull;
import java.util.Map;
import java.util.Objects;

/**
 * Output of the block phase: the block tree with unparsed inline content and every link reference definition found
 * anywhere in the document.
 *
 * @param document   block tree
 * @param references definitions keyed by normalized label
 */
record BlockParseResult(
	@Nonnull Document document,
	@Nonnull Map<String, LinkReference> references
) {

	BlockParseResult {
		Objects.requireNonNull(document, "document must not be null");
		Objects.requireNonNull(references, "references must not be null");
		references = Map.copyOf(references);
	}
}
