package io.evitadb.marginalia;

import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.plugin.logging.Log;
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

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("MarginaliaMojo actions")
public class MarginaliaMojoTest {

	private Path tempDir;
	private MarginaliaMojo mojo;
	private TestLog testLog;

	@BeforeEach
	void setUp() throws Exception {
		this.tempDir = Files.createTempDirectory("mojo-test-");
		this.mojo = new MarginaliaMojo();
		this.testLog = new TestLog();
		this.mojo.setLog(this.testLog);
	}

	@AfterEach
	void tearDown() throws Exception {
		deleteRecursively(this.tempDir);
	}

	@Test
	@DisplayName("shows configuration by default")
	void shouldShowConfiguration() {
		this.mojo.setSourceDir(this.tempDir.toString());

		assertDoesNotThrow(() -> this.mojo.execute());

		assertTrue(this.testLog.infoMessages.contains("Marginalia Plugin Configuration:"));
		assertTrue(this.testLog.infoMessages.contains(" - maxNestingDepth: 64"));
		assertTrue(this.testLog.warnMessages.isEmpty());
	}

	@Test
	@DisplayName("warns about missing source directory in configuration")
	void shouldWarnAboutMissingSourceDirInConfiguration() {
		this.mojo.setAction("show-config");

		assertDoesNotThrow(() -> this.mojo.execute());

		assertTrue(this.testLog.infoMessages.contains(" - sourceDir: <not set>"));
		assertTrue(this.testLog.warnMessages.contains("Source directory is not set"));
	}

	@Test
	@DisplayName("passes when all files are well formed")
	void shouldPassWhenAllFilesAreValid() throws Exception {
		writeFile("docs/index.md", "# Index\n\nSee [guide](guide.md).\n");
		writeFile("docs/guide.md", "# Guide\n\n- one\n- two\n\n> quoted *text*\n");
		configureCheck();

		assertDoesNotThrow(() -> this.mojo.execute());

		assertTrue(this.testLog.infoMessages.contains("Checked 2 files"));
		assertTrue(this.testLog.infoMessages.stream().anyMatch(m -> m.startsWith("Found 2 headings")));
		assertTrue(this.testLog.infoMessages.contains("All checks passed!"));
		assertTrue(this.testLog.errorMessages.isEmpty());
	}

	@Test
	@DisplayName("fails when a file is nested too deeply")
	void shouldFailWhenNestedTooDeeply() throws Exception {
		writeFile("docs/deep.md", "> > > deep\n");
		configureCheck();
		this.mojo.setMaxNestingDepth(2);

		final MojoExecutionException ex = assertThrows(MojoExecutionException.class, () -> this.mojo.execute());

		assertEquals("Check failed with 1 error(s)", ex.getMessage());
		assertTrue(this.testLog.errorMessages.contains("Parse failures: 1"));
		assertTrue(this.testLog.errorMessages.stream().anyMatch(m -> m.contains("TOO_DEEPLY_NESTED")));
	}

	@Test
	@DisplayName("only warns when failOnError is disabled")
	void shouldWarnWhenFailOnErrorDisabled() throws Exception {
		writeFile("docs/deep.md", "> > > deep\n");
		configureCheck();
		this.mojo.setMaxNestingDepth(2);
		this.mojo.setFailOnError(false);

		assertDoesNotThrow(() -> this.mojo.execute());

		assertTrue(this.testLog.warnMessages.contains("Check found 1 error(s), failOnError is disabled"));
		assertFalse(this.testLog.infoMessages.contains("All checks passed!"));
	}

	@Test
	@DisplayName("respects excluded file patterns")
	void shouldRespectExclusions() throws Exception {
		writeFile("docs/index.md", "# Index\n");
		writeFile("docs/assets/deep.md", "> > > deep\n");
		configureCheck();
		this.mojo.setMaxNestingDepth(2);
		this.mojo.setExcludedFilePatterns(List.of(".*/assets/.*"));

		assertDoesNotThrow(() -> this.mojo.execute());

		assertTrue(this.testLog.infoMessages.contains("Checked 1 files"));
		assertTrue(this.testLog.infoMessages.contains("All checks passed!"));
	}

	@Test
	@DisplayName("prints the outline of every file")
	void shouldPrintOutline() throws Exception {
		writeFile("docs/index.md", "# Title\n\nBody\n");
		this.mojo.setAction("outline");
		this.mojo.setSourceDir(this.tempDir.resolve("docs").toString());

		assertDoesNotThrow(() -> this.mojo.execute());

		assertTrue(this.testLog.infoMessages.contains("=== index.md ==="));
		assertTrue(this.testLog.infoMessages.contains("  heading level=1"));
		assertTrue(this.testLog.infoMessages.contains("    text \"Body\""));
	}

	@Test
	@DisplayName("fails the outline when a file cannot be parsed")
	void shouldFailOutlineForDeepFile() throws Exception {
		writeFile("docs/deep.md", "> > > deep\n");
		this.mojo.setAction("outline");
		this.mojo.setSourceDir(this.tempDir.resolve("docs").toString());
		this.mojo.setMaxNestingDepth(2);

		final MojoExecutionException ex = assertThrows(MojoExecutionException.class, () -> this.mojo.execute());

		assertEquals("Outline failed for 1 file(s)", ex.getMessage());
	}

	@Test
	@DisplayName("requires a source directory for check")
	void shouldFailWithoutSourceDir() {
		this.mojo.setAction("check");

		final MojoExecutionException ex = assertThrows(MojoExecutionException.class, () -> this.mojo.execute());

		assertEquals("Source directory not specified", ex.getMessage());
	}

	@Test
	@DisplayName("rejects an unknown action")
	void shouldRejectUnknownAction() {
		this.mojo.setAction("translate");

		final MojoExecutionException ex = assertThrows(MojoExecutionException.class, () -> this.mojo.execute());

		assertTrue(ex.getMessage().startsWith("Unknown action: translate"));
	}

	@Test
	@DisplayName("rejects a nesting depth below one")
	void shouldRejectInvalidNestingDepth() throws Exception {
		writeFile("docs/index.md", "# Index\n");
		configureCheck();
		this.mojo.setMaxNestingDepth(0);

		assertThrows(MojoExecutionException.class, () -> this.mojo.execute());
	}

	private void configureCheck() {
		this.mojo.setAction("check");
		this.mojo.setSourceDir(this.tempDir.resolve("docs").toString());
	}

	private Path writeFile(String relativePath, String content) throws IOException {
		final Path file = this.tempDir.resolve(relativePath);
		Files.createDirectories(file.getParent());
		Files.writeString(file, content, StandardCharsets.UTF_8);
		return file;
	}

	private void deleteRecursively(Path path) throws IOException {
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

	private static class TestLog implements Log {
		final List<String> debugMessages = new ArrayList<>();
		final List<String> infoMessages = new ArrayList<>();
		final List<String> warnMessages = new ArrayList<>();
		final List<String> errorMessages = new ArrayList<>();

		@Override
		public boolean isDebugEnabled() { return true; }

		@Override
		public void debug(CharSequence content) { this.debugMessages.add(content.toString()); }

		@Override
		public void debug(CharSequence content, Throwable error) { this.debugMessages.add(content.toString()); }

		@Override
		public void debug(Throwable error) { this.debugMessages.add(error.getMessage()); }

		@Override
		public boolean isInfoEnabled() { return true; }

		@Override
		public void info(CharSequence content) { this.infoMessages.add(content.toString()); }

		@Override
		public void info(CharSequence content, Throwable error) { this.infoMessages.add(content.toString()); }

		@Override
		public void info(Throwable error) { this.infoMessages.add(error.getMessage()); }

		@Override
		public boolean isWarnEnabled() { return true; }

		@Override
		public void warn(CharSequence content) { this.warnMessages.add(content.toString()); }

		@Override
		public void warn(CharSequence content, Throwable error) { this.warnMessages.add(content.toString()); }

		@Override
		public void warn(Throwable error) { this.warnMessages.add(error.getMessage()); }

		@Override
		public boolean isErrorEnabled() { return true; }

		@Override
		public void error(CharSequence content) { this.errorMessages.add(content.toString()); }

		@Override
		public void error(CharSequence content, Throwable error) { this.errorMessages.add(content.toString()); }

		@Override
		public void error(Throwable error) { this.errorMessages.add(error.getMessage()); }
	}
}
