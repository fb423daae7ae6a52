package com.notionexport.core.remote.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.notionexport.core.identity.IdentityNormalizer;
import com.notionexport.core.model.Annotations;
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
import com.notionexport.core.model.block.Paragraph;
import com.notionexport.core.model.block.Quote;
import com.notionexport.core.model.block.Table;
import com.notionexport.core.model.block.TableRow;
import com.notionexport.core.model.block.ToDo;
import com.notionexport.core.model.block.Toggle;
import com.notionexport.core.model.block.UnsupportedNode;
import com.notionexport.core.remote.RemoteDocument;
import com.notionexport.core.remote.ResultPage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Maps Notion API JSON (blocks, pages, databases, list responses) onto the content model.
 *
 * <p>The parser is lenient: missing fields become empty text or null urls, and block types it
 * does not recognize become {@link UnsupportedNode} carrying whatever {@code rich_text} sits
 * under the type's own field.
 */
public class BlockJsonParser {

    private static final Logger log = LoggerFactory.getLogger(BlockJsonParser.class);

    /** Block types mapped onto a dedicated node; anything else becomes {@link UnsupportedNode}. */
    public static final List<String> SUPPORTED_TYPES = List.of(
        "paragraph", "heading_1", "heading_2", "heading_3", "quote", "callout",
        "bulleted_list_item", "numbered_list_item", "to_do", "toggle", "code", "divider",
        "link_to_page", "child_page", "image", "file", "pdf", "video", "audio", "bookmark",
        "table", "table_row");

    /**
     * Parses a {@code list} response of block children.
     *
     * @param response list response
     * @return parsed page of nodes
     */
    public ResultPage<ContentNode> parseBlockList(JsonNode response) {
        return parseList(response, this::parseBlock);
    }

    /**
     * Parses a database query response. Every result is returned; callers filter on
     * {@link RemoteDocument#isPage()}.
     *
     * @param response list response
     * @return parsed page of members
     */
    public ResultPage<RemoteDocument> parseDocumentList(JsonNode response) {
        return parseList(response, this::parseDocument);
    }

    /**
     * Parses a page or database object.
     *
     * <p>For pages the title is the property of type {@code title}; for databases it is the
     * top-level {@code title} array.
     *
     * @param json page or database object
     * @return remote document
     */
    public RemoteDocument parseDocument(JsonNode json) {
        NodeIdentity id = IdentityNormalizer.normalize(json.path("id").asText());
        String object = json.path("object").asText(RemoteDocument.PAGE);

        if (RemoteDocument.DATABASE.equals(object)) {
            return new RemoteDocument(id, object, parseRichText(json.path("title")));
        }

        Iterator<Map.Entry<String, JsonNode>> properties = json.path("properties").fields();
        while (properties.hasNext()) {
            JsonNode property = properties.next().getValue();
            if ("title".equals(property.path("type").asText())) {
                return new RemoteDocument(id, object, parseRichText(property.path("title")));
            }
        }
        return new RemoteDocument(id, object, List.of());
    }

    /**
     * Parses a single block object.
     *
     * @param json block object
     * @return content node without children
     */
    public ContentNode parseBlock(JsonNode json) {
        NodeIdentity id = IdentityNormalizer.normalize(json.path("id").asText());
        String type = json.path("type").asText("");
        boolean hasChildren = json.path("has_children").asBoolean(false);
        JsonNode payload = json.path(type);
        List<ContentNode> none = List.of();

        Optional<MediaKind> mediaKind = MediaKind.fromType(type);
        if (mediaKind.isPresent()) {
            return new Media(id, mediaKind.get(), fileUrl(payload), parseRichText(payload.path("caption")),
                hasChildren, none);
        }

        return switch (type) {
            case "paragraph" -> new Paragraph(id, text(payload), hasChildren, none);
            case "heading_1" -> new Heading(id, 1, text(payload), hasChildren, none);
            case "heading_2" -> new Heading(id, 2, text(payload), hasChildren, none);
            case "heading_3" -> new Heading(id, 3, text(payload), hasChildren, none);
            case "quote" -> new Quote(id, text(payload), hasChildren, none);
            case "callout" -> new Callout(id, emojiIcon(payload), text(payload), hasChildren, none);
            case "bulleted_list_item" -> new ListItem(id, ListStyle.BULLETED, text(payload), hasChildren, none);
            case "numbered_list_item" -> new ListItem(id, ListStyle.NUMBERED, text(payload), hasChildren, none);
            case "to_do" -> new ToDo(id, payload.path("checked").asBoolean(false), text(payload), hasChildren, none);
            case "toggle" -> new Toggle(id, text(payload), hasChildren, none);
            case "code" -> new CodeBlock(id, payload.path("language").asText(""), text(payload), hasChildren, none);
            case "divider" -> new Divider(id, hasChildren, none);
            case "link_to_page" -> parseLinkToPage(id, payload, hasChildren);
            case "child_page" -> new ChildPage(id, payload.path("title").asText(""), hasChildren, none);
            case "bookmark" -> new Bookmark(id, textOrNull(payload.path("url")),
                parseRichText(payload.path("caption")), hasChildren, none);
            case "table" -> new Table(id, payload.path("table_width").asInt(0), hasChildren, none);
            case "table_row" -> new TableRow(id, parseCells(payload.path("cells")), hasChildren, none);
            default -> {
                log.debug("Unsupported block type '{}' ({})", type, id);
                yield new UnsupportedNode(id, type, text(payload), hasChildren, none);
            }
        };
    }

    /**
     * Parses a rich text array.
     *
     * @param array rich text JSON array, may be missing
     * @return spans in order
     */
    public List<RichSpan> parseRichText(JsonNode array) {
        if (array == null || !array.isArray()) {
            return List.of();
        }
        List<RichSpan> spans = new ArrayList<>();
        for (JsonNode item : array) {
            JsonNode annotations = item.path("annotations");
            NodeIdentity mentionedPage = null;
            if ("mention".equals(item.path("type").asText())
                && "page".equals(item.path("mention").path("type").asText())) {
                mentionedPage = IdentityNormalizer.tryNormalize(
                    item.path("mention").path("page").path("id").asText(null)).orElse(null);
            }
            spans.add(new RichSpan(
                item.path("plain_text").asText(""),
                new Annotations(
                    annotations.path("bold").asBoolean(false),
                    annotations.path("italic").asBoolean(false),
                    annotations.path("strikethrough").asBoolean(false),
                    annotations.path("underline").asBoolean(false),
                    annotations.path("code").asBoolean(false)),
                textOrNull(item.path("href")),
                mentionedPage));
        }
        return spans;
    }

    private <T> ResultPage<T> parseList(JsonNode response, Function<JsonNode, T> itemParser) {
        List<T> items = new ArrayList<>();
        for (JsonNode result : response.path("results")) {
            items.add(itemParser.apply(result));
        }
        boolean hasMore = response.path("has_more").asBoolean(false);
        return new ResultPage<>(items, hasMore, textOrNull(response.path("next_cursor")));
    }

    private ContentNode parseLinkToPage(NodeIdentity id, JsonNode payload, boolean hasChildren) {
        String targetType = payload.path("type").asText("unknown");
        NodeIdentity target = IdentityNormalizer.tryNormalize(textOrNull(payload.path(targetType))).orElse(null);
        return new LinkToPage(id, targetType, target, hasChildren, List.of());
    }

    private List<List<RichSpan>> parseCells(JsonNode cells) {
        List<List<RichSpan>> parsed = new ArrayList<>();
        for (JsonNode cell : cells) {
            parsed.add(parseRichText(cell));
        }
        return parsed;
    }

    private List<RichSpan> text(JsonNode payload) {
        return parseRichText(payload.path("rich_text"));
    }

    private String emojiIcon(JsonNode payload) {
        JsonNode icon = payload.path("icon");
        if ("emoji".equals(icon.path("type").asText())) {
            return textOrNull(icon.path("emoji"));
        }
        return null;
    }

    private String fileUrl(JsonNode payload) {
        String hosting = payload.path("type").asText("");
        if ("external".equals(hosting) || "file".equals(hosting)) {
            return textOrNull(payload.path(hosting).path("url"));
        }
        return null;
    }

    private static String textOrNull(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        return node.asText();
    }
}
