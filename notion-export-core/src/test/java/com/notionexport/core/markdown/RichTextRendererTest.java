package com.notionexport.core.markdown;

import com.notionexport.core.model.Annotations;
import com.notionexport.core.model.NodeIdentity;
import com.notionexport.core.model.RichSpan;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static com.notionexport.core.model.block.TestNodes.id;
import static com.notionexport.core.model.block.TestNodes.mention;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link RichTextRenderer}.
 */
class RichTextRendererTest {

    private final RichTextRenderer renderer = new RichTextRenderer();
    private final Set<NodeIdentity> linked = new LinkedHashSet<>();

    @Test
    void render_boldCode_codeOutermost() {
        RichSpan span = RichSpan.styled("hi", new Annotations(true, false, false, false, true));

        assertThat(renderer.render(List.of(span), linked)).isEqualTo("`**hi**`");
    }

    @Test
    void render_allStyles_nestInFixedOrder() {
        RichSpan span = RichSpan.styled("x", new Annotations(true, true, true, true, true));

        assertThat(renderer.render(List.of(span), linked)).isEqualTo("`***~~<u>x</u>~~***`");
    }

    @Test
    void render_adjacentSpans_concatenated() {
        List<RichSpan> spans = List.of(
            RichSpan.text("Hello "),
            RichSpan.styled("world", new Annotations(false, true, false, false, false)),
            RichSpan.text("!"));

        assertThat(renderer.render(spans, linked)).isEqualTo("Hello *world*!");
    }

    @Test
    void render_emptyStyledSpan_notWrapped() {
        RichSpan span = RichSpan.styled("", new Annotations(true, false, false, false, false));

        assertThat(renderer.render(List.of(span), linked)).isEmpty();
    }

    @Test
    void render_externalLink_keptVerbatim() {
        String markdown = renderer.render(List.of(RichSpan.link("docs", "https://example.com/docs")), linked);

        assertThat(markdown).isEqualTo("[docs](https://example.com/docs)");
        assertThat(linked).isEmpty();
    }

    @Test
    void render_linkToPage_becomesPlaceholderAndRecordsTarget() {
        NodeIdentity target = new NodeIdentity("0123abcd-ef01-2345-6789-abcdef012345");
        RichSpan span = RichSpan.link("Roadmap", "https://www.notion.so/Roadmap-0123abcdef0123456789abcdef012345");

        String markdown = renderer.render(List.of(span), linked);

        assertThat(markdown).isEqualTo("[Roadmap]({PAGE:0123abcd-ef01-2345-6789-abcdef012345})");
        assertThat(linked).containsExactly(target);
    }

    @Test
    void render_pageMentionWithoutHref_recordsTarget() {
        String markdown = renderer.render(List.of(mention("Roadmap", id(7))), linked);

        assertThat(markdown).isEqualTo("Roadmap");
        assertThat(linked).containsExactly(id(7));
    }
}
