package com.notionexport.core.export;

import com.notionexport.core.crawl.CrawlResult;
import com.notionexport.core.crawl.GraphCrawler;
import com.notionexport.core.model.NodeIdentity;
import com.notionexport.core.output.ExportOutput;
import com.notionexport.core.output.OutputContext;
import com.notionexport.core.output.OutputRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Objects;

/**
 * Runs a complete export: crawl, resolve links, write files.
 *
 * <p>Nothing is written until the crawl has finished, so every link is resolved against the
 * complete set of exported and skipped pages. A failed crawl writes nothing.
 */
public class ExportService {

    private static final Logger log = LoggerFactory.getLogger(ExportService.class);

    private final GraphCrawler crawler;
    private final ExportAssembler assembler;
    private final OutputRenderer renderer;

    public ExportService(GraphCrawler crawler, OutputRenderer renderer) {
        this(crawler, new ExportAssembler(), renderer);
    }

    public ExportService(GraphCrawler crawler, ExportAssembler assembler, OutputRenderer renderer) {
        this.crawler = Objects.requireNonNull(crawler, "crawler must not be null");
        this.assembler = Objects.requireNonNull(assembler, "assembler must not be null");
        this.renderer = Objects.requireNonNull(renderer, "renderer must not be null");
    }

    /**
     * Exports every page reachable from the root.
     *
     * @param rootId page or database id
     * @param options output options
     * @return export summary
     */
    public ExportSummary export(NodeIdentity rootId, ExportOptions options) {
        CrawlResult crawl = crawler.crawl(rootId);

        ExportOutput output = assembler.assemble(crawl, options);
        log.debug("Assembled {} files (rewrite links: {})", output.files().size(), options.rewriteLinks());
        renderer.render(output, new OutputContext(options.outputDirectory(), Map.of()));

        Path outputDirectory = Paths.get(options.outputDirectory()).toAbsolutePath().normalize();
        ExportSummary summary = new ExportSummary(
            crawl.rootKind(),
            crawl.documents().size(),
            crawl.skipped(),
            outputDirectory,
            outputDirectory.resolve(options.indexFile()));
        log.info("Exported {} pages with renderer '{}'", summary.exportedCount(), renderer.getId());
        return summary;
    }
}
