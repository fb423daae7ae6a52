package com.notionexport.core.crawl;

import com.notionexport.core.exception.RemoteApiException;
import com.notionexport.core.model.DocumentRecord;
import com.notionexport.core.model.NodeIdentity;

/**
 * Progress callbacks raised by {@link GraphCrawler}. All methods default to no-ops.
 */
public interface CrawlListener {

    CrawlListener NONE = new CrawlListener() {
    };

    default void onRootDetected(NodeIdentity rootId, RootKind kind, int seedCount) {
    }

    default void onDocumentExported(DocumentRecord document) {
    }

    default void onDocumentSkipped(NodeIdentity id, RemoteApiException cause) {
    }
}
