package com.notionexport.core.crawl;

import com.notionexport.core.exception.ExportException;
import com.notionexport.core.exception.RemoteApiException;
import com.notionexport.core.hydrate.TreeHydrator;
import com.notionexport.core.markdown.MarkdownRenderer;
import com.notionexport.core.markdown.RenderResult;
import com.notionexport.core.model.DocumentRecord;
import com.notionexport.core.model.NodeIdentity;
import com.notionexport.core.model.RichSpan;
import com.notionexport.core.model.block.ContentNode;
import com.notionexport.core.remote.ContentApi;
import com.notionexport.core.remote.RemoteDocument;
import com.notionexport.core.remote.ResultPage;
import com.notionexport.core.retry.RetryPolicy;
import com.notionexport.core.util.FileNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Breadth-first crawl over the page graph reachable from a root.
 *
 * <p>For each page taken from the queue the crawler resolves its title, hydrates and renders
 * its block tree, stores a {@link DocumentRecord}, and queues every page the rendering links
 * to. Pages the integration cannot access (403/404 on retrieval) are recorded as skipped and
 * the crawl moves on. Other failures, including exhausted retries, abort the crawl.
 *
 * <p>A database root is expanded into its member pages, which seed the queue. The queue is
 * FIFO, so the crawl order, and with it filename tie-breaking, is deterministic for a given
 * graph.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * GraphCrawler crawler = new GraphCrawler(api, RetryPolicy.defaults(), CrawlListener.NONE);
 * CrawlResult result = crawler.crawl(IdentityNormalizer.normalize(rootUrl));
 * }</pre>
 */
public class GraphCrawler {

    private static final Logger log = LoggerFactory.getLogger(GraphCrawler.class);

    private static final String DATABASE_ERROR_MARKER = "is a database";
    private static final String UNTITLED = "Untitled";

    private final ContentApi api;
    private final RetryPolicy retryPolicy;
    private final TreeHydrator hydrator;
    private final MarkdownRenderer renderer;
    private final CrawlListener listener;

    public GraphCrawler(ContentApi api, RetryPolicy retryPolicy, CrawlListener listener) {
        this(api, retryPolicy, new TreeHydrator(api, retryPolicy), new MarkdownRenderer(), listener);
    }

    public GraphCrawler(
            ContentApi api,
            RetryPolicy retryPolicy,
            TreeHydrator hydrator,
            MarkdownRenderer renderer,
            CrawlListener listener) {
        this.api = Objects.requireNonNull(api, "api must not be null");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy must not be null");
        this.hydrator = Objects.requireNonNull(hydrator, "hydrator must not be null");
        this.renderer = Objects.requireNonNull(renderer, "renderer must not be null");
        this.listener = listener == null ? CrawlListener.NONE : listener;
    }

    /**
     * Crawls every page reachable from the root.
     *
     * @param rootId page or database id
     * @return crawled pages and skipped ids
     * @throws ExportException if the root cannot be identified or a remote call keeps failing
     */
    public CrawlResult crawl(NodeIdentity rootId) {
        CrawlState state = new CrawlState();

        RootKind kind = detectRootKind(rootId);
        if (kind == RootKind.COLLECTION) {
            List<NodeIdentity> members = collectionMembers(rootId);
            log.info("Found {} pages in database {}", members.size(), rootId);
            state.enqueueAll(members);
        } else {
            state.enqueue(rootId);
        }
        listener.onRootDetected(rootId, kind, state.pending());
        log.info("Starting crawl of {} (root: {}, seeds: {})", rootId, kind, state.pending());

        Optional<NodeIdentity> next;
        while ((next = state.poll()).isPresent()) {
            NodeIdentity id = next.get();
            if (state.isSettled(id)) {
                continue;
            }
            processPage(id, state);
        }

        log.info("Crawl complete: {} pages exported, {} skipped", state.records().size(), state.skipped().size());
        return new CrawlResult(rootId, kind, state.records(), state.skipped());
    }

    /**
     * Decides whether the root is a page or a database.
     *
     * <p>The page lookup is tried first; an error saying the id is a database, or a successful
     * database lookup, marks it as a collection.
     *
     * @param rootId root id
     * @return root kind
     * @throws ExportException if the id is neither an accessible page nor a database
     */
    RootKind detectRootKind(NodeIdentity rootId) {
        try {
            retryPolicy.execute("retrieve page " + rootId, () -> api.retrieveDocument(rootId));
            return RootKind.DOCUMENT;
        } catch (RemoteApiException e) {
            String message = e.getMessage() == null ? "" : e.getMessage().toLowerCase(Locale.ROOT);
            if (message.contains(DATABASE_ERROR_MARKER)) {
                return RootKind.COLLECTION;
            }
            log.debug("{} is not retrievable as a page: {}", rootId, e.getMessage());
        }

        try {
            retryPolicy.execute("retrieve database " + rootId, () -> api.retrieveCollection(rootId));
            return RootKind.COLLECTION;
        } catch (RemoteApiException e) {
            throw new ExportException("Could not identify " + rootId
                + " as a page or database. Make sure it's shared with your integration.", e);
        }
    }

    private List<NodeIdentity> collectionMembers(NodeIdentity collectionId) {
        List<NodeIdentity> members = new ArrayList<>();
        String cursor = null;
        while (true) {
            String pageCursor = cursor;
            ResultPage<RemoteDocument> page = retryPolicy.execute(
                "query database " + collectionId, () -> api.queryCollectionMembers(collectionId, pageCursor));
            for (RemoteDocument member : page.items()) {
                if (member.isPage()) {
                    members.add(member.id());
                }
            }
            if (!page.hasMore() || page.nextCursor() == null) {
                return members;
            }
            cursor = page.nextCursor();
        }
    }

    private void processPage(NodeIdentity id, CrawlState state) {
        Optional<String> title = resolveTitle(id, state);
        if (title.isEmpty()) {
            return;
        }
        log.info("Exporting: {}", title.get());

        List<ContentNode> tree = hydrator.hydrateTree(id);
        RenderResult rendered = renderer.render(tree);

        DocumentRecord document = new DocumentRecord(
            id,
            title.get(),
            FileNames.forPage(title.get(), id, state.filenames()),
            rendered.markdown(),
            rendered.linkedPages());
        state.record(document);
        listener.onDocumentExported(document);

        state.enqueueAll(document.forwardLinks());
    }

    /**
     * Looks up the page title, marking the page skipped if it is not accessible.
     */
    private Optional<String> resolveTitle(NodeIdentity id, CrawlState state) {
        RemoteDocument page;
        try {
            page = retryPolicy.execute("retrieve page " + id, () -> api.retrieveDocument(id));
        } catch (RemoteApiException e) {
            if (e.isInaccessible()) {
                log.warn("[SKIP] Cannot access page {}: {}", id, e.getMessage());
                state.markSkipped(id);
                listener.onDocumentSkipped(id, e);
                return Optional.empty();
            }
            throw e;
        }
        return Optional.of(displayTitle(page.title()));
    }

    static String displayTitle(List<RichSpan> title) {
        String text = title.stream().map(RichSpan::plainText).collect(Collectors.joining()).strip();
        return text.isEmpty() ? UNTITLED : text;
    }
}
