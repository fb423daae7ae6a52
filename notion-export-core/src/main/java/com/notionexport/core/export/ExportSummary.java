package com.notionexport.core.export;

import com.notionexport.core.crawl.RootKind;
import com.notionexport.core.model.NodeIdentity;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Set;

/**
 * Result of a completed export, for reporting.
 *
 * @param rootKind whether the root was a page or a database
 * @param exportedCount number of pages written
 * @param skipped pages that could not be accessed
 * @param outputDirectory absolute output directory
 * @param indexFile absolute path of the index file
 */
public record ExportSummary(
    RootKind rootKind,
    int exportedCount,
    Set<NodeIdentity> skipped,
    Path outputDirectory,
    Path indexFile
) {
    /**
     * Compact constructor with validation.
     */
    public ExportSummary {
        Objects.requireNonNull(rootKind, "rootKind must not be null");
        skipped = skipped == null ? Set.of() : Set.copyOf(skipped);
    }
}
