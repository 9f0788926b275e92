package io.evitadb.marginalia;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("Traverser should visit files matching regex in deterministic order and pass full contents")
public class TraverserTest {

	private static final Pattern MARKDOWN = Pattern.compile("(?i).*\\.md");

	private Path root;

	@BeforeEach
	void setUp() throws IOException {
		this.root = Files.createTempDirectory("traverser-test-");
	}

	@AfterEach
	void tearDown() throws IOException {
		deleteRecursively(this.root);
	}

	@Test
	@DisplayName("visits files in lexicographical order")
	void shouldVisitFilesInOrderWhenPatternMatches() throws Exception {
		// root/a/one.md, root/a/two.txt (ignored), root/b/sub/three.MD, root/z-four.md
		final Path f1 = write("a/one.md", "ONE\nLINE\n");
		write("a/two.txt", "TWO");
		final Path f3 = write("b/sub/three.MD", "THREE");
		final Path f4 = write("z-four.md", "Z-FOUR");

		final List<Path> visited = new ArrayList<>();
		final List<String> contents = new ArrayList<>();
		final int count = new Traverser(this.root, MARKDOWN, (file, content) -> {
			visited.add(file);
			contents.add(content);
		}).traverse();

		assertEquals(3, count);
		assertEquals(List.of(f1, f3, f4), visited, "Visited files order");
		assertEquals(List.of("ONE\nLINE\n", "THREE", "Z-FOUR"), contents, "File contents");
	}

	@Test
	@DisplayName("skips excluded directories and files")
	void shouldSkipExcludedPaths() throws Exception {
		final Path kept = write("docs/guide.md", "# Guide");
		write("docs/assets/readme.md", "skipped");
		write("docs/draft-notes.md", "skipped");

		final List<Path> visited = new ArrayList<>();
		new Traverser(
			this.root,
			MARKDOWN,
			List.of(Pattern.compile(".*/assets/.*"), Pattern.compile(".*/draft-.*\\.md")),
			(file, content) -> visited.add(file)
		).traverse();

		assertEquals(List.of(kept), visited);
	}

	@Test
	@DisplayName("fails when the source directory is missing")
	void shouldFailForMissingDirectory() {
		final Traverser traverser = new Traverser(this.root.resolve("missing"), MARKDOWN, (file, content) -> {});

		assertThrows(IOException.class, traverser::traverse);
	}

	private Path write(String relativePath, String text) throws IOException {
		final Path file = this.root.resolve(relativePath);
		Files.createDirectories(file.getParent());
		Files.writeString(file, text, StandardCharsets.UTF_8);
		return file;
	}

	private static void deleteRecursively(Path path) throws IOException {
		if (Files.notExists(path)) {
			return;
		}
		try (var paths = Files.walk(path)) {
			paths.sorted(Comparator.reverseOrder())
				.forEach(p -> {
					try {
						Files.deleteIfExists(p);
					} catch (IOException e) {
						// ignore in cleanup
					}
				});
		}
	}
}
