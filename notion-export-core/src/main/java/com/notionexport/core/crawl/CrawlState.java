package com.notionexport.core.crawl;

import com.notionexport.core.model.DocumentRecord;
import com.notionexport.core.model.NodeIdentity;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Working set of one crawl: visited and skipped pages, the FIFO work queue, and the records
 * produced so far.
 *
 * <p>Owned and mutated by a single {@link GraphCrawler#crawl} invocation; not thread-safe.
 * An id that has been visited or skipped is never queued again, which bounds the crawl even
 * when pages link to each other in cycles.
 */
final class CrawlState {

    private final Set<NodeIdentity> visited = new LinkedHashSet<>();
    private final Set<NodeIdentity> skipped = new LinkedHashSet<>();
    private final Deque<NodeIdentity> queue = new ArrayDeque<>();
    private final Set<NodeIdentity> queued = new HashSet<>();
    private final Map<NodeIdentity, DocumentRecord> records = new LinkedHashMap<>();
    private final Set<String> filenames = new HashSet<>();

    /**
     * Queues the id unless it was already visited, skipped, or queued.
     *
     * @param id page id
     * @return true if the id was added to the queue
     */
    boolean enqueue(NodeIdentity id) {
        if (isSettled(id) || queued.contains(id)) {
            return false;
        }
        queue.addLast(id);
        queued.add(id);
        return true;
    }

    void enqueueAll(Collection<NodeIdentity> ids) {
        ids.forEach(this::enqueue);
    }

    Optional<NodeIdentity> poll() {
        NodeIdentity next = queue.pollFirst();
        if (next != null) {
            queued.remove(next);
        }
        return Optional.ofNullable(next);
    }

    boolean isSettled(NodeIdentity id) {
        return visited.contains(id) || skipped.contains(id);
    }

    void markSkipped(NodeIdentity id) {
        skipped.add(id);
    }

    void record(DocumentRecord document) {
        visited.add(document.id());
        records.put(document.id(), document);
        filenames.add(document.filename());
    }

    Set<String> filenames() {
        return Collections.unmodifiableSet(filenames);
    }

    Map<NodeIdentity, DocumentRecord> records() {
        return records;
    }

    Set<NodeIdentity> skipped() {
        return skipped;
    }

    int pending() {
        return queue.size();
    }
}
