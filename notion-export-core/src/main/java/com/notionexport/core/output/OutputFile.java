package com.notionexport.core.output;

import java.util.Objects;

/**
 * A file produced by an export.
 *
 * @param relativePath path relative to the output directory (e.g. "roadmap--0f1e2d3c4b.md")
 * @param content file content
 * @param contentType content type, e.g. "text/markdown"
 */
public record OutputFile(
    String relativePath,
    String content,
    String contentType
) {
    public static final String MARKDOWN = "text/markdown";

    /**
     * Compact constructor with validation.
     */
    public OutputFile {
        Objects.requireNonNull(relativePath, "relativePath must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }

    public static OutputFile markdown(String relativePath, String content) {
        return new OutputFile(relativePath, content, MARKDOWN);
    }
}
