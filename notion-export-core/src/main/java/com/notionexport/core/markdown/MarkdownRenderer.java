package com.notionexport.core.markdown;

import com.notionexport.core.model.NodeIdentity;
import com.notionexport.core.model.RichSpan;
import com.notionexport.core.model.block.Bookmark;
import com.notionexport.core.model.block.Callout;
import com.notionexport.core.model.block.ChildPage;
import com.notionexport.core.model.block.CodeBlock;
import com.notionexport.core.model.block.ContentNode;
import com.notionexport.core.model.block.Divider;
import com.notionexport.core.model.block.Heading;
import com.notionexport.core.model.block.LinkToPage;
import com.notionexport.core.model.block.ListItem;
import com.notionexport.core.model.block.ListStyle;
import com.notionexport.core.model.block.Media;
import com.notionexport.core.model.block.MediaKind;
import com.notionexport.core.model.block.NodeVisitor;
import com.notionexport.core.model.block.Paragraph;
import com.notionexport.core.model.block.Quote;
import com.notionexport.core.model.block.Table;
import com.notionexport.core.model.block.TableRow;
import com.notionexport.core.model.block.ToDo;
import com.notionexport.core.model.block.Toggle;
import com.notionexport.core.model.block.UnsupportedNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Renders a hydrated block tree to Markdown.
 *
 * <p>Links to other pages are emitted as {@link LinkPlaceholder}s and collected in
 * {@link RenderResult#linkedPages()}; they are resolved once the whole page graph is known.
 *
 * <h2>Block mapping</h2>
 * <ul>
 *   <li>paragraph: its text; an empty paragraph is kept as a blank line</li>
 *   <li>heading 1-3: {@code #}, {@code ##}, {@code ###}</li>
 *   <li>quote: {@code > text}; callout: {@code > icon text}</li>
 *   <li>list items: {@code -}, {@code 1.}, {@code - [x]}, {@code - [ ]}; children indented by two spaces</li>
 *   <li>toggle: {@code <details>} with the text as {@code <summary>} and children as body</li>
 *   <li>code: fenced block tagged with the language</li>
 *   <li>divider: {@code ---}</li>
 *   <li>link to page, child page: list entry linking to the page</li>
 *   <li>image: {@code ![alt](url)}; other media and bookmarks: {@code [label](url)}</li>
 *   <li>table: HTML {@code <table>} with one {@code <td>} per cell, row-major</li>
 *   <li>anything else: its rich text, if it has any</li>
 * </ul>
 *
 * <p>Children of other blocks follow the block's own line. The renderer is stateless; each
 * call builds its own line buffer.
 */
public class MarkdownRenderer {

    private static final Logger log = LoggerFactory.getLogger(MarkdownRenderer.class);

    private static final String NEWLINE = "\n";
    private static final String QUOTE = "> ";
    private static final String FENCE = "```";
    private static final String RULE = "---";
    private static final String LIST_INDENT = "  ";
    private static final String PAGE_ID_TARGET = "page_id";

    private final RichTextRenderer richText;

    public MarkdownRenderer() {
        this(new RichTextRenderer());
    }

    public MarkdownRenderer(RichTextRenderer richText) {
        this.richText = richText;
    }

    /**
     * Renders blocks to Markdown.
     *
     * @param nodes hydrated blocks in reading order
     * @return Markdown ending with one newline, plus every page the blocks link to
     */
    public RenderResult render(List<ContentNode> nodes) {
        BlockWriter writer = new BlockWriter();
        for (ContentNode node : nodes) {
            node.accept(writer);
        }
        String markdown = String.join(NEWLINE, writer.lines).stripTrailing() + NEWLINE;
        return new RenderResult(markdown, writer.linked);
    }

    /**
     * Indents every non-blank line.
     *
     * @param text multi-line text
     * @param indent prefix to add
     * @return indented text without trailing newline
     */
    static String indentLines(String text, String indent) {
        return text.lines()
            .map(line -> line.isBlank() ? line : indent + line)
            .collect(Collectors.joining(NEWLINE));
    }

    /**
     * Visitor that appends the Markdown lines of one block list.
     */
    private final class BlockWriter implements NodeVisitor<Void> {

        private final List<String> lines = new ArrayList<>();
        private final Set<NodeIdentity> linked = new LinkedHashSet<>();

        @Override
        public Void visitParagraph(Paragraph node) {
            String text = inline(node.text());
            lines.add(text.isBlank() ? "" : text);
            appendChildren(node);
            return null;
        }

        @Override
        public Void visitHeading(Heading node) {
            lines.add(("#".repeat(node.level()) + " " + inline(node.text())).stripTrailing());
            appendChildren(node);
            return null;
        }

        @Override
        public Void visitQuote(Quote node) {
            lines.add((QUOTE + inline(node.text())).stripTrailing());
            appendChildren(node);
            return null;
        }

        @Override
        public Void visitCallout(Callout node) {
            String icon = node.icon() == null ? "" : node.icon() + " ";
            lines.add((QUOTE + icon + inline(node.text())).stripTrailing());
            appendChildren(node);
            return null;
        }

        @Override
        public Void visitListItem(ListItem node) {
            String marker = node.style() == ListStyle.NUMBERED ? "1." : "-";
            appendListEntry(marker, node.text(), node);
            return null;
        }

        @Override
        public Void visitToDo(ToDo node) {
            appendListEntry(node.checked() ? "- [x]" : "- [ ]", node.text(), node);
            return null;
        }

        @Override
        public Void visitToggle(Toggle node) {
            lines.add("<details>");
            lines.add("<summary>" + inline(node.text()) + "</summary>");
            String body = renderChildren(node);
            if (!body.isBlank()) {
                lines.add("");
                lines.add(body.stripTrailing());
                lines.add("");
            }
            lines.add("</details>");
            return null;
        }

        @Override
        public Void visitCode(CodeBlock node) {
            String code = inline(node.text());
            lines.add((FENCE + node.language()).stripTrailing());
            lines.add(code);
            lines.add(FENCE);
            appendChildren(node);
            return null;
        }

        @Override
        public Void visitDivider(Divider node) {
            lines.add(RULE);
            return null;
        }

        @Override
        public Void visitLinkToPage(LinkToPage node) {
            if (!PAGE_ID_TARGET.equals(node.targetType())) {
                lines.add("- Linked: " + node.targetType());
            } else if (node.target() != null) {
                linked.add(node.target());
                lines.add("- [Linked page](" + LinkPlaceholder.of(node.target()) + ")");
            }
            return null;
        }

        @Override
        public Void visitChildPage(ChildPage node) {
            String title = node.title().isBlank() ? "Subpage" : node.title();
            linked.add(node.id());
            lines.add("- [" + title + "](" + LinkPlaceholder.of(node.id()) + ")");
            return null;
        }

        @Override
        public Void visitMedia(Media node) {
            String caption = inline(node.caption()).strip();
            if (node.url() == null) {
                log.debug("Skipping {} block {} without url", node.kind().typeName(), node.id());
                return null;
            }
            if (node.kind() == MediaKind.IMAGE) {
                lines.add("![" + (caption.isEmpty() ? "image" : caption) + "](" + node.url() + ")");
            } else {
                lines.add("[" + (caption.isEmpty() ? node.kind().typeName() : caption) + "](" + node.url() + ")");
            }
            return null;
        }

        @Override
        public Void visitBookmark(Bookmark node) {
            String caption = inline(node.caption()).strip();
            if (node.url() != null) {
                lines.add("[" + (caption.isEmpty() ? node.url() : caption) + "](" + node.url() + ")");
            }
            return null;
        }

        @Override
        public Void visitTable(Table node) {
            lines.add("<table>");
            for (ContentNode child : node.children()) {
                if (child instanceof TableRow row) {
                    lines.add("<tr>");
                    for (List<RichSpan> cell : row.cells()) {
                        lines.add("<td>" + inline(cell) + "</td>");
                    }
                    lines.add("</tr>");
                }
            }
            lines.add("</table>");
            return null;
        }

        @Override
        public Void visitTableRow(TableRow node) {
            // rows are rendered by their table
            return null;
        }

        @Override
        public Void visitUnsupported(UnsupportedNode node) {
            String text = inline(node.text());
            if (!text.isBlank()) {
                lines.add(text);
            }
            appendChildren(node);
            return null;
        }

        private void appendListEntry(String marker, List<RichSpan> text, ContentNode node) {
            lines.add((marker + " " + inline(text)).stripTrailing());
            String children = renderChildren(node);
            if (!children.isBlank()) {
                lines.add(indentLines(children, LIST_INDENT));
            }
        }

        private void appendChildren(ContentNode node) {
            String children = renderChildren(node);
            if (!children.isBlank()) {
                lines.add(children.stripTrailing());
            }
        }

        private String renderChildren(ContentNode node) {
            if (node.children().isEmpty()) {
                return "";
            }
            RenderResult result = render(node.children());
            linked.addAll(result.linkedPages());
            return result.markdown();
        }

        private String inline(List<RichSpan> spans) {
            return richText.render(spans, linked);
        }
    }
}
