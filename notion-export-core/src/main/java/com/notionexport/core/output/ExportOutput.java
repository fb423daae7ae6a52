package com.notionexport.core.output;

import java.util.List;
import java.util.Objects;

/**
 * Files produced by one export run, in write order.
 *
 * @param files page files followed by the index file
 */
public record ExportOutput(
    List<OutputFile> files
) {
    /**
     * Compact constructor with validation.
     */
    public ExportOutput {
        Objects.requireNonNull(files, "files must not be null");
        files = List.copyOf(files);
    }
}
