package com.notionexport.cli;

import com.notionexport.core.config.ConfigLoader;
import com.notionexport.core.config.ExportConfig;
import com.notionexport.core.crawl.CrawlListener;
import com.notionexport.core.crawl.GraphCrawler;
import com.notionexport.core.crawl.RootKind;
import com.notionexport.core.exception.RemoteApiException;
import com.notionexport.core.export.ExportOptions;
import com.notionexport.core.export.ExportService;
import com.notionexport.core.export.ExportSummary;
import com.notionexport.core.identity.IdentityNormalizer;
import com.notionexport.core.model.DocumentRecord;
import com.notionexport.core.model.NodeIdentity;
import com.notionexport.core.output.OutputRenderer;
import com.notionexport.core.remote.ContentApi;
import com.notionexport.core.remote.http.NotionApiSettings;
import com.notionexport.core.remote.http.NotionHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.function.Function;

/**
 * Command to export a page or database and every page reachable from it.
 *
 * <p>Pipeline:
 * <ol>
 *   <li>Load configuration and normalize the root id</li>
 *   <li>Crawl the page graph breadth-first</li>
 *   <li>Resolve page links and write the files and index</li>
 * </ol>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * notion-export export <page-or-database-url-or-id>
 *
 * # Custom output directory, links to notion.so instead of local files
 * notion-export export <root> -o ./docs --no-rewrite-links
 *
 * # Print instead of writing files
 * notion-export export <root> --target console
 * }</pre>
 */
@Command(
    name = "export",
    description = "Export a Notion page or database and every page it links to",
    mixinStandardHelpOptions = true
)
public class ExportCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ExportCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    @Spec
    CommandSpec spec;

    @Parameters(
        index = "0",
        paramLabel = "ROOT",
        description = "Page or database URL or id"
    )
    String root;

    @Option(
        names = {"-o", "--out"},
        description = "Output directory (default: ./notion_export, or output.directory from config)"
    )
    Path outputDir;

    @Option(
        names = {"--token"},
        description = "Integration token (default: $NOTION_TOKEN)",
        defaultValue = "${env:NOTION_TOKEN}"
    )
    String token;

    @Option(
        names = {"--notion-version"},
        description = "Notion-Version header (default: $NOTION_VERSION or api.version from config)",
        defaultValue = "${env:NOTION_VERSION}"
    )
    String notionVersion;

    @Option(
        names = {"--no-rewrite-links"},
        description = "Link to notion.so instead of the exported local files"
    )
    boolean noRewriteLinks;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: notion-export.yaml)"
    )
    Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Option(
        names = {"--target"},
        description = "Output renderer id (default: filesystem). See 'list renderers'."
    )
    String target;

    private final Function<NotionApiSettings, ContentApi> apiFactory;

    public ExportCommand() {
        this(NotionHttpClient::new);
    }

    public ExportCommand(Function<NotionApiSettings, ContentApi> apiFactory) {
        this.apiFactory = Objects.requireNonNull(apiFactory, "apiFactory must not be null");
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        if (token == null || token.isBlank()) {
            err.println("✗ Missing integration token. Pass --token or set NOTION_TOKEN.");
            return EXIT_USAGE;
        }

        Optional<NodeIdentity> rootId = IdentityNormalizer.tryNormalize(root);
        if (rootId.isEmpty()) {
            err.println("✗ Could not find a Notion page id in: " + root);
            return EXIT_USAGE;
        }

        ExportConfig config = ConfigLoader.load(configPath);
        String rendererId = target != null ? target : config.output().renderer();
        Optional<OutputRenderer> renderer = OutputRenderer.find(rendererId);
        if (renderer.isEmpty()) {
            err.println("✗ Unknown output target: " + rendererId + ". Use 'list renderers' to see available targets.");
            return EXIT_USAGE;
        }

        try {
            ExportOptions options = new ExportOptions(
                outputDir != null ? outputDir.toString() : config.output().directory(),
                config.output().rewriteLinks() && !noRewriteLinks,
                config.output().indexFile());

            ContentApi api = apiFactory.apply(config.api().toSettings(token, notionVersion));
            GraphCrawler crawler = new GraphCrawler(api, config.retry().toPolicy(), new ProgressListener(out));
            ExportSummary summary = new ExportService(crawler, renderer.get()).export(rootId.get(), options);

            out.println();
            if (!summary.skipped().isEmpty()) {
                out.println("Skipped " + summary.skipped().size() + " inaccessible pages");
            }
            if (renderer.get().writesToDisk()) {
                out.println("Exported " + summary.exportedCount() + " pages to: " + summary.outputDirectory());
                out.println("Wrote index: " + summary.indexFile());
            } else {
                out.println("Rendered " + summary.exportedCount() + " pages with '" + renderer.get().getId()
                    + "' (nothing written to disk)");
            }
            return EXIT_OK;

        } catch (Exception e) {
            log.error("Export failed", e);
            err.println("✗ Export failed: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    /**
     * Prints crawl progress as it happens.
     */
    static final class ProgressListener implements CrawlListener {

        private final PrintWriter out;

        ProgressListener(PrintWriter out) {
            this.out = out;
        }

        @Override
        public void onRootDetected(NodeIdentity rootId, RootKind kind, int seedCount) {
            if (kind == RootKind.COLLECTION) {
                out.println("Exporting database " + rootId + " (" + seedCount + " pages)");
            } else {
                out.println("Exporting page " + rootId);
            }
            out.flush();
        }

        @Override
        public void onDocumentExported(DocumentRecord document) {
            out.println("✓ " + document.title() + " -> " + document.filename());
            out.flush();
        }

        @Override
        public void onDocumentSkipped(NodeIdentity id, RemoteApiException cause) {
            out.println("✗ Skipped " + id + " (" + cause.getMessage() + ")");
            out.flush();
        }
    }
}
