package com.notionexport.core.remote.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.notionexport.core.model.NodeIdentity;
import com.notionexport.core.model.RichSpan;
import com.notionexport.core.model.block.Callout;
import com.notionexport.core.model.block.ContentNode;
import com.notionexport.core.model.block.Heading;
import com.notionexport.core.model.block.LinkToPage;
import com.notionexport.core.model.block.Media;
import com.notionexport.core.model.block.MediaKind;
import com.notionexport.core.model.block.TableRow;
import com.notionexport.core.model.block.ToDo;
import com.notionexport.core.model.block.UnsupportedNode;
import com.notionexport.core.remote.RemoteDocument;
import com.notionexport.core.remote.ResultPage;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link BlockJsonParser}.
 */
class BlockJsonParserTest {

    private static final String BLOCK_ID = "59833787-2cf9-4fdf-8782-e53db20768a5";
    private static final String PAGE_ID = "0123abcd-ef01-2345-6789-abcdef012345";

    private final ObjectMapper mapper = new ObjectMapper();
    private final BlockJsonParser parser = new BlockJsonParser();

    private ContentNode block(String type, String payload) throws Exception {
        return parser.parseBlock(mapper.readTree(
            "{\"object\":\"block\",\"id\":\"" + BLOCK_ID + "\",\"type\":\"" + type + "\","
                + "\"has_children\":true,\"" + type + "\":" + payload + "}"));
    }

    @Test
    void parseBlock_heading_levelAndText() throws Exception {
        ContentNode node = block("heading_2", """
            {"rich_text":[{"type":"text","plain_text":"Goals","annotations":{"bold":true}}]}""");

        assertThat(node).isInstanceOf(Heading.class);
        Heading heading = (Heading) node;
        assertThat(heading.level()).isEqualTo(2);
        assertThat(heading.hasChildren()).isTrue();
        assertThat(heading.children()).isEmpty();
        assertThat(heading.text()).singleElement().satisfies(span -> {
            assertThat(span.plainText()).isEqualTo("Goals");
            assertThat(span.annotations().bold()).isTrue();
            assertThat(span.annotations().italic()).isFalse();
        });
    }

    @Test
    void parseBlock_toDoAndCallout() throws Exception {
        ToDo todo = (ToDo) block("to_do", "{\"rich_text\":[],\"checked\":true}");
        Callout callout = (Callout) block("callout",
            "{\"rich_text\":[],\"icon\":{\"type\":\"emoji\",\"emoji\":\"💡\"}}");
        Callout noIcon = (Callout) block("callout",
            "{\"rich_text\":[],\"icon\":{\"type\":\"external\",\"external\":{\"url\":\"https://x/y.png\"}}}");

        assertThat(todo.checked()).isTrue();
        assertThat(callout.icon()).isEqualTo("💡");
        assertThat(noIcon.icon()).isNull();
    }

    @Test
    void parseBlock_mediaHostedAndExternal() throws Exception {
        Media image = (Media) block("image", """
            {"type":"external","external":{"url":"https://img/x.png"},"caption":[{"plain_text":"Diagram"}]}""");
        Media pdf = (Media) block("pdf", """
            {"type":"file","file":{"url":"https://s3/file.pdf","expiry_time":"2030-01-01T00:00:00.000Z"}}""");

        assertThat(image.kind()).isEqualTo(MediaKind.IMAGE);
        assertThat(image.url()).isEqualTo("https://img/x.png");
        assertThat(image.caption()).extracting(RichSpan::plainText).containsExactly("Diagram");
        assertThat(pdf.kind()).isEqualTo(MediaKind.PDF);
        assertThat(pdf.url()).isEqualTo("https://s3/file.pdf");
    }

    @Test
    void parseBlock_linkToPageAndDatabase() throws Exception {
        LinkToPage page = (LinkToPage) block("link_to_page", "{\"type\":\"page_id\",\"page_id\":\"" + PAGE_ID + "\"}");
        LinkToPage database = (LinkToPage) block("link_to_page",
            "{\"type\":\"database_id\",\"database_id\":\"" + PAGE_ID + "\"}");

        assertThat(page.targetType()).isEqualTo("page_id");
        assertThat(page.target()).isEqualTo(new NodeIdentity(PAGE_ID));
        assertThat(database.targetType()).isEqualTo("database_id");
    }

    @Test
    void parseBlock_tableRowCells() throws Exception {
        TableRow row = (TableRow) block("table_row", """
            {"cells":[[{"plain_text":"a"}],[{"plain_text":"b"},{"plain_text":"c"}]]}""");

        assertThat(row.cells()).hasSize(2);
        assertThat(row.cells().get(1)).extracting(RichSpan::plainText).containsExactly("b", "c");
    }

    @Test
    void parseBlock_unknownType_unsupportedWithText() throws Exception {
        ContentNode node = block("equation", "{\"rich_text\":[{\"plain_text\":\"E = mc^2\"}]}");

        assertThat(node).isInstanceOf(UnsupportedNode.class);
        assertThat(((UnsupportedNode) node).type()).isEqualTo("equation");
        assertThat(((UnsupportedNode) node).text()).extracting(RichSpan::plainText).containsExactly("E = mc^2");
    }

    @Test
    void parseRichText_hrefAndPageMention() throws Exception {
        JsonNode array = mapper.readTree("""
            [
              {"type":"text","plain_text":"site","href":"https://example.com"},
              {"type":"mention","plain_text":"Roadmap","href":null,
               "mention":{"type":"page","page":{"id":"%s"}}}
            ]""".formatted(PAGE_ID));

        List<RichSpan> spans = parser.parseRichText(array);

        assertThat(spans.get(0).href()).isEqualTo("https://example.com");
        assertThat(spans.get(0).mentionedPage()).isNull();
        assertThat(spans.get(1).href()).isNull();
        assertThat(spans.get(1).mentionedPage()).isEqualTo(new NodeIdentity(PAGE_ID));
    }

    @Test
    void parseDocument_pageTitleFromTitleProperty() throws Exception {
        RemoteDocument page = parser.parseDocument(mapper.readTree("""
            {"object":"page","id":"%s","properties":{
              "Status":{"type":"select","select":null},
              "Name":{"type":"title","title":[{"plain_text":"Road"},{"plain_text":"map"}]}
            }}""".formatted(PAGE_ID)));

        assertThat(page.isPage()).isTrue();
        assertThat(page.title()).extracting(RichSpan::plainText).containsExactly("Road", "map");
    }

    @Test
    void parseDocument_databaseTitleTopLevel() throws Exception {
        RemoteDocument database = parser.parseDocument(mapper.readTree("""
            {"object":"database","id":"%s","title":[{"plain_text":"Tasks"}],"properties":{}}""".formatted(PAGE_ID)));

        assertThat(database.isPage()).isFalse();
        assertThat(database.title()).extracting(RichSpan::plainText).containsExactly("Tasks");
    }

    @Test
    void parseBlockList_paginationFields() throws Exception {
        ResultPage<ContentNode> page = parser.parseBlockList(mapper.readTree("""
            {"object":"list","results":[
              {"id":"%s","type":"divider","has_children":false,"divider":{}}
            ],"has_more":true,"next_cursor":"abc"}""".formatted(BLOCK_ID)));

        assertThat(page.items()).hasSize(1);
        assertThat(page.hasMore()).isTrue();
        assertThat(page.nextCursor()).isEqualTo("abc");
    }

    @Test
    void parseBlockList_lastPage_nullCursor() throws Exception {
        ResultPage<ContentNode> page = parser.parseBlockList(mapper.readTree(
            "{\"results\":[],\"has_more\":false,\"next_cursor\":null}"));

        assertThat(page.hasMore()).isFalse();
        assertThat(page.nextCursor()).isNull();
    }
}
