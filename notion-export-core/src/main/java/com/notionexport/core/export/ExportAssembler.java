package com.notionexport.core.export;

import com.notionexport.core.crawl.CrawlResult;
import com.notionexport.core.model.DocumentRecord;
import com.notionexport.core.output.ExportOutput;
import com.notionexport.core.output.OutputFile;
import com.notionexport.core.resolve.LinkMap;
import com.notionexport.core.resolve.LinkResolver;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Turns a finished crawl into output files.
 *
 * <p>Builds the {@link LinkMap} from every crawled page, resolves the placeholders of each page,
 * prefixes the provenance comment, and appends the index. Page files keep crawl order; index
 * entries are sorted by case-insensitive title, then by id.
 */
public class ExportAssembler {

    static final String PROVENANCE_PREFIX = "<!-- Exported from Notion page: ";
    static final String PROVENANCE_SUFFIX = " -->";
    static final String INDEX_TITLE = "# Notion Export Index";

    private static final Comparator<DocumentRecord> INDEX_ORDER = Comparator
        .comparing((DocumentRecord document) -> document.title().toLowerCase(Locale.ROOT))
        .thenComparing(DocumentRecord::id);

    /**
     * Assembles page files and the index.
     *
     * @param crawl finished crawl
     * @param options export options
     * @return files to write
     */
    public ExportOutput assemble(CrawlResult crawl, ExportOptions options) {
        LinkMap linkMap = LinkMap.of(crawl.documents().values());
        LinkResolver resolver = new LinkResolver(linkMap, options.rewriteLinks());

        List<OutputFile> files = new ArrayList<>();
        for (DocumentRecord document : crawl.documents().values()) {
            String content = provenance(document) + "\n" + resolver.resolve(document.rawMarkdown());
            files.add(OutputFile.markdown(document.filename(), content));
        }
        files.add(OutputFile.markdown(options.indexFile(), index(crawl.documents().values())));
        return new ExportOutput(files);
    }

    /**
     * Renders the index listing every exported page.
     *
     * @param documents exported pages
     * @return index Markdown
     */
    String index(Iterable<DocumentRecord> documents) {
        List<DocumentRecord> sorted = new ArrayList<>();
        documents.forEach(sorted::add);
        sorted.sort(INDEX_ORDER);

        StringBuilder index = new StringBuilder(INDEX_TITLE).append("\n\n");
        for (DocumentRecord document : sorted) {
            index.append("- [").append(document.title()).append("](./").append(document.filename()).append(")\n");
        }
        return index.toString();
    }

    private static String provenance(DocumentRecord document) {
        return PROVENANCE_PREFIX + document.id() + PROVENANCE_SUFFIX;
    }
}
