package io.evitadb.marginalia;

import io.evitadb.marginalia.check.CheckResult;
import io.evitadb.marginalia.check.DocumentStatistics;
import io.evitadb.marginalia.check.MarkdownChecker;
import io.evitadb.marginalia.check.ParseFailure;
import io.evitadb.marginalia.check.RoundTripError;
import io.evitadb.marginalia.parser.MarkdownParseException;
import io.evitadb.marginalia.parser.MarkdownParser;
import io.evitadb.marginalia.parser.ParserOptions;
import io.evitadb.marginalia.serialize.OutlineRenderer;
import org.apache.maven.plugin.AbstractMojo;
import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.plugin.logging.Log;
import org.apache.maven.plugins.annotations.LifecyclePhase;
import org.apache.maven.plugins.annotations.Mojo;
import org.apache.maven.plugins.annotations.Parameter;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Main Mojo for Marginalia plugin providing actions:
 * - show-config: prints current configuration
 * - check: parses all matched markdown files and verifies their canonical round trip
 * - outline: prints the structural outline of every matched markdown file
 */
@Mojo(name = "run", defaultPhase = LifecyclePhase.NONE, threadSafe = true)
public class MarginaliaMojo extends AbstractMojo {

	/** Which action to perform: "show-config", "check" or "outline". */
	@Parameter(property = "marginalia.action", defaultValue = "show-config")
	private String action;

	/** Source directory path - relative to the project root (no default). */
	@Parameter(property = "marginalia.sourceDir")
	private String sourceDir;

	/** Regex to match all files to parse - default (?i).*\.md (ignore case). */
	@Parameter(property = "marginalia.fileRegex", defaultValue = "(?i).*\\.md")
	private String fileRegex = "(?i).*\\.md";

	/** Regex patterns of directories and files to skip. */
	@Parameter(property = "marginalia.excludedFilePatterns")
	private List<String> excludedFilePatterns;

	/** Maximum nesting depth of containers and link texts (default 64). */
	@Parameter(property = "marginalia.maxNestingDepth", defaultValue = "64")
	private int maxNestingDepth = ParserOptions.DEFAULT_MAX_NESTING_DEPTH;

	/** When true, the build fails if any file fails a check. */
	@Parameter(property = "marginalia.failOnError", defaultValue = "true")
	private boolean failOnError = true;

	@Override
	public void execute() throws MojoExecutionException {
		if (this.action == null || this.action.isBlank()) {
			this.action = "show-config";
		}
		switch (this.action) {
			case "show-config":
				showConfig(getLog());
				break;
			case "check":
				check(getLog());
				break;
			case "outline":
				outline(getLog());
				break;
			default:
				throw new MojoExecutionException("Unknown action: " + this.action + ". Supported actions: show-config, check, outline");
		}
	}

	private void showConfig(@Nonnull final Log log) {
		log.info("Marginalia Plugin Configuration:");
		log.info(" - sourceDir: " + (this.sourceDir == null || this.sourceDir.isBlank() ? "<not set>" : this.sourceDir));
		if (this.sourceDir == null || this.sourceDir.isBlank()) {
			log.warn("Source directory is not set");
		}
		log.info(" - fileRegex: " + this.fileRegex);
		if (this.excludedFilePatterns == null || this.excludedFilePatterns.isEmpty()) {
			log.info(" - excludedFilePatterns: <none>");
		} else {
			log.info(" - excludedFilePatterns:");
			for (final String pattern : this.excludedFilePatterns) {
				log.info("   - " + pattern);
			}
		}
		log.info(" - maxNestingDepth: " + this.maxNestingDepth);
		if (this.maxNestingDepth < 1) {
			log.warn("Maximum nesting depth must be at least 1");
		}
		log.info(" - failOnError: " + this.failOnError);
	}

	/**
	 * Executes the check action: parses every matched file, re-parses its canonical form and compares the structure.
	 *
	 * @param log the Maven log
	 * @throws MojoExecutionException if any file fails and failOnError is set
	 */
	private void check(@Nonnull final Log log) throws MojoExecutionException {
		final Path root = resolveSourceDir(log, "check");
		final MarkdownChecker checker = new MarkdownChecker(createParser());

		log.info("=== Checking files in: " + root + " ===");
		final int fileCount = traverse(root, checker::checkFile);
		final CheckResult result = checker.getResult();

		log.info("Checked " + fileCount + " files");
		final DocumentStatistics statistics = result.statistics();
		log.info(
			"Found " + statistics.headings() + " headings, " + statistics.paragraphs() + " paragraphs, " +
				statistics.lists() + " lists (" + statistics.listItems() + " items), " +
				statistics.blockQuotes() + " block quotes, " + statistics.codeBlocks() + " code blocks, " +
				statistics.links() + " links; deepest nesting " + statistics.maxNestingDepth()
		);

		if (!result.parseFailures().isEmpty()) {
			log.error("Parse failures: " + result.parseFailures().size());
			for (final ParseFailure failure : result.parseFailures()) {
				log.error("  " + root.relativize(failure.file().toAbsolutePath().normalize()) + ": " +
					failure.message() + " (" + failure.type() + ")");
			}
		}

		if (!result.roundTripErrors().isEmpty()) {
			log.error("Round trip errors: " + result.roundTripErrors().size());
			for (final RoundTripError error : result.roundTripErrors()) {
				log.error("  " + root.relativize(error.file().toAbsolutePath().normalize()) +
					": outline line " + error.outlineLine() + " expected [" + error.expected() +
					"] but was [" + error.actual() + "]");
			}
		}

		if (!result.isSuccess()) {
			if (this.failOnError) {
				throw new MojoExecutionException("Check failed with " + result.errorCount() + " error(s)");
			}
			log.warn("Check found " + result.errorCount() + " error(s), failOnError is disabled");
			return;
		}

		log.info("All checks passed!");
	}

	/**
	 * Executes the outline action: logs the structural outline of every matched file.
	 *
	 * @param log the Maven log
	 * @throws MojoExecutionException if any file cannot be parsed and failOnError is set
	 */
	private void outline(@Nonnull final Log log) throws MojoExecutionException {
		final Path root = resolveSourceDir(log, "outline");
		final MarkdownParser parser = createParser();
		final OutlineRenderer renderer = new OutlineRenderer();
		final AtomicInteger failures = new AtomicInteger(0);

		traverse(root, (file, content) -> {
			log.info("=== " + root.relativize(file.toAbsolutePath().normalize()) + " ===");
			try {
				for (final String line : renderer.render(parser.parse(content)).split("\n")) {
					log.info(line);
				}
			} catch (MarkdownParseException e) {
				failures.incrementAndGet();
				log.error("Failed to parse " + file + ": " + e.getMessage());
			}
		});

		if (failures.get() > 0 && this.failOnError) {
			throw new MojoExecutionException("Outline failed for " + failures.get() + " file(s)");
		}
	}

	@Nonnull
	private Path resolveSourceDir(@Nonnull final Log log, @Nonnull final String actionName) throws MojoExecutionException {
		if (this.sourceDir == null || this.sourceDir.isBlank()) {
			log.error("Source directory must be specified for " + actionName + " action");
			throw new MojoExecutionException("Source directory not specified");
		}
		final Path root = Path.of(this.sourceDir).toAbsolutePath().normalize();
		if (!Files.exists(root) || !Files.isDirectory(root)) {
			log.error("Source directory does not exist or is not a directory: " + root);
			throw new MojoExecutionException("Invalid source directory: " + root);
		}
		return root;
	}

	@Nonnull
	private MarkdownParser createParser() throws MojoExecutionException {
		try {
			return new MarkdownParser(new ParserOptions(this.maxNestingDepth));
		} catch (IllegalArgumentException e) {
			throw new MojoExecutionException("Invalid maxNestingDepth: " + this.maxNestingDepth, e);
		}
	}

	private int traverse(@Nonnull final Path root, @Nonnull final Visitor visitor) throws MojoExecutionException {
		try {
			final Pattern pattern = Pattern.compile(this.fileRegex);
			return new Traverser(root, pattern, compileExclusions(), visitor).traverse();
		} catch (final PatternSyntaxException ex) {
			throw new MojoExecutionException("Invalid file pattern: " + ex.getMessage(), ex);
		} catch (final IOException ex) {
			throw new MojoExecutionException("Traversal of " + root + " failed: " + ex.getMessage(), ex);
		}
	}

	@Nonnull
	private List<Pattern> compileExclusions() {
		if (this.excludedFilePatterns == null) {
			return List.of();
		}
		final List<Pattern> patterns = new ArrayList<>(this.excludedFilePatterns.size());
		for (final String pattern : this.excludedFilePatterns) {
			if (pattern != null && !pattern.isBlank()) {
				patterns.add(Pattern.compile(pattern));
			}
		}
		return patterns;
	}

	// Setters to aid testing without Maven parameter injection
	void setAction(@Nullable final String action) { this.action = action; }
	void setSourceDir(@Nullable final String sourceDir) { this.sourceDir = sourceDir; }
	void setFileRegex(@Nonnull final String fileRegex) { this.fileRegex = fileRegex; }
	void setExcludedFilePatterns(@Nullable final List<String> excludedFilePatterns) { this.excludedFilePatterns = excludedFilePatterns; }
	void setMaxNestingDepth(final int maxNestingDepth) { this.maxNestingDepth = maxNestingDepth; }
	void setFailOnError(final boolean failOnError) { this.failOnError = failOnError; }
}
