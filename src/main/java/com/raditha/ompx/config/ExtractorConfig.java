package com.raditha.ompx.config;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Configuration for one extraction run.
 *
 * @param codeSnippets      include source snippets in report entries
 * @param sourceRoot        directory that file names in syntax trees are resolved against
 * @param outputDirectory   directory reports are written to; {@code null} writes each
 *                          report next to its source file
 * @param skipSystemHeaders ignore functions declared in system headers
 */
public record ExtractorConfig(
        boolean codeSnippets,
        Path sourceRoot,
        Path outputDirectory,
        boolean skipSystemHeaders) {

    public static final Path DEFAULT_SOURCE_ROOT = Path.of(".");

    /**
     * Validate configuration.
     */
    public ExtractorConfig {
        if (sourceRoot == null) {
            sourceRoot = DEFAULT_SOURCE_ROOT;
        }
        if (outputDirectory != null && outputDirectory.toString().isBlank()) {
            throw new IllegalArgumentException("outputDirectory cannot be blank");
        }
    }

    /**
     * Snippets on, files resolved against the working directory, reports next to
     * their sources, system headers skipped.
     */
    public static ExtractorConfig defaults() {
        return new ExtractorConfig(
                true, // codeSnippets
                DEFAULT_SOURCE_ROOT,
                null, // outputDirectory
                true); // skipSystemHeaders
    }

    public Optional<Path> getOutputDirectory() {
        return Optional.ofNullable(outputDirectory);
    }

    public ExtractorConfig withCodeSnippets(boolean enabled) {
        return new ExtractorConfig(enabled, sourceRoot, outputDirectory, skipSystemHeaders);
    }

    public ExtractorConfig withOutputDirectory(Path directory) {
        return new ExtractorConfig(codeSnippets, sourceRoot, directory, skipSystemHeaders);
    }
}
