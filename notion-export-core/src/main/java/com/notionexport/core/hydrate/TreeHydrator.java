package com.notionexport.core.hydrate;

import com.notionexport.core.model.NodeIdentity;
import com.notionexport.core.model.block.ChildPage;
import com.notionexport.core.model.block.ContentNode;
import com.notionexport.core.remote.ContentApi;
import com.notionexport.core.remote.ResultPage;
import com.notionexport.core.retry.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Materializes the complete block tree below a page.
 *
 * <p>Children are fetched page by page until the listing is exhausted, in the order the API
 * returns them. Every node that reports children is rebuilt with its hydrated subtree
 * attached; the renderer needs the whole tree (toggle bodies, table rows) in one pass.
 * Child pages are left unexpanded: they are separate documents, hydrated on their own when
 * the crawler reaches them.
 */
public class TreeHydrator {

    private static final Logger log = LoggerFactory.getLogger(TreeHydrator.class);

    private final ContentApi api;
    private final RetryPolicy retryPolicy;

    public TreeHydrator(ContentApi api, RetryPolicy retryPolicy) {
        this.api = Objects.requireNonNull(api, "api must not be null");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy must not be null");
    }

    /**
     * Fetches and hydrates the full tree under a page or block.
     *
     * @param rootId page or block id
     * @return hydrated top-level nodes in reading order
     */
    public List<ContentNode> hydrateTree(NodeIdentity rootId) {
        return hydrate(fetchChildren(rootId));
    }

    /**
     * Fetches all direct children of a block, following pagination cursors.
     *
     * @param id parent id
     * @return unhydrated children in API order
     */
    public List<ContentNode> fetchChildren(NodeIdentity id) {
        List<ContentNode> results = new ArrayList<>();
        String cursor = null;
        int pages = 0;
        while (true) {
            String pageCursor = cursor;
            ResultPage<ContentNode> page = retryPolicy.execute(
                "list children of " + id, () -> api.listChildren(id, pageCursor));
            results.addAll(page.items());
            pages++;
            if (!page.hasMore() || page.nextCursor() == null) {
                break;
            }
            cursor = page.nextCursor();
        }
        log.debug("Fetched {} children of {} in {} page(s)", results.size(), id, pages);
        return results;
    }

    /**
     * Returns copies of the given nodes with every descendant attached, stopping at child pages.
     *
     * @param nodes unhydrated nodes
     * @return hydrated nodes in the same order
     */
    public List<ContentNode> hydrate(List<ContentNode> nodes) {
        List<ContentNode> hydrated = new ArrayList<>(nodes.size());
        for (ContentNode node : nodes) {
            if (node.hasChildren() && !(node instanceof ChildPage)) {
                List<ContentNode> children = hydrate(fetchChildren(node.id()));
                hydrated.add(node.withChildren(children));
            } else {
                hydrated.add(node);
            }
        }
        return hydrated;
    }
}
