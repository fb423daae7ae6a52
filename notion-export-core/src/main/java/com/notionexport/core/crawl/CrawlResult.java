package com.notionexport.core.crawl;

import com.notionexport.core.model.DocumentRecord;
import com.notionexport.core.model.NodeIdentity;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable outcome of a finished crawl.
 *
 * @param rootId export root
 * @param rootKind whether the root was a page or a database
 * @param documents exported pages keyed by id, in crawl order
 * @param skipped pages that could not be accessed
 */
public record CrawlResult(
    NodeIdentity rootId,
    RootKind rootKind,
    Map<NodeIdentity, DocumentRecord> documents,
    Set<NodeIdentity> skipped
) {
    /**
     * Compact constructor with validation.
     */
    public CrawlResult {
        Objects.requireNonNull(rootId, "rootId must not be null");
        Objects.requireNonNull(rootKind, "rootKind must not be null");
        documents = documents == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(documents));
        skipped = skipped == null
            ? Set.of()
            : Collections.unmodifiableSet(new LinkedHashSet<>(skipped));
    }
}
