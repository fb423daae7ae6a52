package com.notionexport.core.resolve;

import com.notionexport.core.model.DocumentRecord;
import com.notionexport.core.model.NodeIdentity;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable page id to output filename mapping, built after the crawl has finished.
 *
 * @param filenames filename per exported page
 */
public record LinkMap(Map<NodeIdentity, String> filenames) {

    /**
     * Compact constructor with validation.
     */
    public LinkMap {
        filenames = filenames == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(filenames));
    }

    /**
     * Builds the map from crawled documents.
     *
     * @param documents every exported document
     * @return link map
     */
    public static LinkMap of(Collection<DocumentRecord> documents) {
        Map<NodeIdentity, String> filenames = new LinkedHashMap<>();
        for (DocumentRecord document : documents) {
            filenames.put(document.id(), document.filename());
        }
        return new LinkMap(filenames);
    }

    public static LinkMap empty() {
        return new LinkMap(Map.of());
    }

    public Optional<String> filenameOf(NodeIdentity id) {
        return Optional.ofNullable(filenames.get(id));
    }

    public int size() {
        return filenames.size();
    }
}
