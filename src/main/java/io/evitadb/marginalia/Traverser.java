package io.evitadb.marginalia;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Walks a source directory recursively and hands the contents of every matching markdown file to a visitor.
 *
 * - Files are visited in lexicographical order of their paths.
 * - Contents are read as UTF-8.
 * - Patterns are matched against the whole path string; an excluded directory is not entered at all.
 */
public final class Traverser {

	@Nonnull
	private final Path sourceDir;
	@Nonnull
	private final Pattern filePattern;
	@Nonnull
	private final List<Pattern> exclusionPatterns;
	@Nonnull
	private final Visitor visitor;

	/**
	 * Create a traverser without exclusions.
	 *
	 * @param sourceDir   root directory to traverse
	 * @param filePattern regex pattern for matching file paths (Path.toString())
	 * @param visitor     callback to process file contents
	 */
	public Traverser(@Nonnull final Path sourceDir, @Nonnull final Pattern filePattern, @Nonnull final Visitor visitor) {
		this(sourceDir, filePattern, null, visitor);
	}

	/**
	 * Create a traverser.
	 *
	 * @param sourceDir         root directory to traverse
	 * @param filePattern       regex pattern for matching file paths (Path.toString())
	 * @param exclusionPatterns regex patterns for excluding directories and files
	 * @param visitor           callback to process file contents
	 */
	public Traverser(
		@Nonnull final Path sourceDir,
		@Nonnull final Pattern filePattern,
		@Nullable final List<Pattern> exclusionPatterns,
		@Nonnull final Visitor visitor
	) {
		this.sourceDir = sourceDir;
		this.filePattern = filePattern;
		this.exclusionPatterns = exclusionPatterns != null ? List.copyOf(exclusionPatterns) : List.of();
		this.visitor = visitor;
	}

	/**
	 * Perform recursive traversal and notify the visitor for each matched file.
	 *
	 * @return number of files passed to the visitor
	 * @throws IOException when directory reading fails
	 */
	public int traverse() throws IOException {
		if (!Files.exists(this.sourceDir)) {
			throw new IOException("Source directory does not exist: " + this.sourceDir);
		}
		if (!Files.isDirectory(this.sourceDir)) {
			throw new IOException("Source path is not a directory: " + this.sourceDir);
		}

		final List<Path> files = new ArrayList<>();
		Files.walkFileTree(this.sourceDir, new SimpleFileVisitor<>() {
			@Override
			public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
				final String dirPath = dir.toString();
				if (!dir.equals(Traverser.this.sourceDir) && (isExcluded(dirPath) || isExcluded(dirPath + "/"))) {
					return FileVisitResult.SKIP_SUBTREE;
				}
				return FileVisitResult.CONTINUE;
			}

			@Override
			public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
				final String path = file.toString();
				if (attrs.isRegularFile() && Traverser.this.filePattern.matcher(path).matches() && !isExcluded(path)) {
					files.add(file);
				}
				return FileVisitResult.CONTINUE;
			}
		});
		files.sort(Comparator.comparing(Path::toString));

		for (final Path file : files) {
			// malformed UTF-8 is replaced rather than rejected
			final String content = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
			this.visitor.visit(file, content);
		}
		return files.size();
	}

	/**
	 * Checks if the given path matches any exclusion pattern.
	 *
	 * @param path the path to check
	 * @return true if the path should be excluded
	 */
	private boolean isExcluded(@Nonnull final String path) {
		for (final Pattern pattern : this.exclusionPatterns) {
			if (pattern.matcher(path).matches()) {
				return true;
			}
		}
		return false;
	}
}
