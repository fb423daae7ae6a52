package com.notionexport.core.resolve;

import com.notionexport.core.markdown.LinkPlaceholder;
import com.notionexport.core.model.DocumentRecord;
import com.notionexport.core.model.NodeIdentity;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static com.notionexport.core.model.block.TestNodes.id;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link LinkResolver}.
 */
class LinkResolverTest {

    private static final NodeIdentity EXPORTED = id(1);
    private static final NodeIdentity MISSING = id(2);

    private final LinkMap linkMap = LinkMap.of(List.of(
        new DocumentRecord(EXPORTED, "Roadmap", "roadmap--0000000000.md", "", Set.of())));

    private final String markdown = "See [Roadmap](" + LinkPlaceholder.of(EXPORTED) + ") and "
        + "[Secret](" + LinkPlaceholder.of(MISSING) + ").\n";

    @Test
    void resolve_exportedTarget_relativeLocalLink() {
        String resolved = new LinkResolver(linkMap, true).resolve(markdown);

        assertThat(resolved).contains("[Roadmap](./roadmap--0000000000.md)");
    }

    @Test
    void resolve_missingTarget_remoteFallback() {
        String resolved = new LinkResolver(linkMap, true).resolve(markdown);

        assertThat(resolved).contains("[Secret](https://www.notion.so/" + MISSING.compact() + ")");
        assertThat(LinkPlaceholder.containsAny(resolved)).isFalse();
    }

    @Test
    void resolve_rewritingDisabled_everyLinkRemote() {
        String resolved = new LinkResolver(linkMap, false).resolve(markdown);

        assertThat(resolved).isEqualTo("See [Roadmap](https://www.notion.so/" + EXPORTED.compact() + ") and "
            + "[Secret](https://www.notion.so/" + MISSING.compact() + ").\n");
    }

    @Test
    void resolve_noPlaceholders_unchanged() {
        String text = "Plain $1 text with \\ and {braces}\n";

        assertThat(new LinkResolver(LinkMap.empty(), true).resolve(text)).isEqualTo(text);
    }

    @Test
    void resolve_repeatedPlaceholder_allReplaced() {
        String twice = LinkPlaceholder.of(EXPORTED) + " " + LinkPlaceholder.of(EXPORTED);

        assertThat(new LinkResolver(linkMap, true).resolve(twice))
            .isEqualTo("./roadmap--0000000000.md ./roadmap--0000000000.md");
    }

    @Test
    void linkMap_filenameLookup() {
        assertThat(linkMap.size()).isEqualTo(1);
        assertThat(linkMap.filenameOf(EXPORTED)).contains("roadmap--0000000000.md");
        assertThat(linkMap.filenameOf(MISSING)).isEmpty();
    }
}
