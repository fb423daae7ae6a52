package com.notionexport.core.export;

import java.util.Objects;

/**
 * Options of one export run.
 *
 * @param outputDirectory directory receiving the files
 * @param rewriteLinks link exported pages to each other locally; when false every page link
 *                     points at notion.so
 * @param indexFile name of the index file
 */
public record ExportOptions(
    String outputDirectory,
    boolean rewriteLinks,
    String indexFile
) {
    public static final String DEFAULT_OUTPUT_DIRECTORY = "./notion_export";
    public static final String DEFAULT_INDEX_FILE = "_INDEX.md";

    /**
     * Compact constructor with validation.
     */
    public ExportOptions {
        Objects.requireNonNull(outputDirectory, "outputDirectory must not be null");
        if (indexFile == null || indexFile.isBlank()) {
            indexFile = DEFAULT_INDEX_FILE;
        }
    }

    public static ExportOptions defaults() {
        return new ExportOptions(DEFAULT_OUTPUT_DIRECTORY, true, DEFAULT_INDEX_FILE);
    }
}
