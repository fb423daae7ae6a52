package com.notionexport.core.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * One crawled page.
 *
 * @param id page identity
 * @param title display title
 * @param filename output file name, relative to the export directory
 * @param rawMarkdown rendered Markdown with link placeholders still embedded
 * @param forwardLinks pages referenced from this page, in discovery order
 */
public record DocumentRecord(
    NodeIdentity id,
    String title,
    String filename,
    String rawMarkdown,
    Set<NodeIdentity> forwardLinks
) {
    /**
     * Compact constructor with validation.
     */
    public DocumentRecord {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(title, "title must not be null");
        Objects.requireNonNull(filename, "filename must not be null");
        Objects.requireNonNull(rawMarkdown, "rawMarkdown must not be null");
        forwardLinks = forwardLinks == null
            ? Set.of()
            : Collections.unmodifiableSet(new LinkedHashSet<>(forwardLinks));
    }
}
