package com.notionexport.core.hydrate;

import com.notionexport.core.exception.RemoteApiException;
import com.notionexport.core.model.NodeIdentity;
import com.notionexport.core.model.block.ChildPage;
import com.notionexport.core.model.block.ContentNode;
import com.notionexport.core.model.block.ListItem;
import com.notionexport.core.model.block.ListStyle;
import com.notionexport.core.model.block.Paragraph;
import com.notionexport.core.model.block.Toggle;
import com.notionexport.core.remote.InMemoryContentApi;
import com.notionexport.core.retry.RetryPolicy;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static com.notionexport.core.model.block.TestNodes.id;
import static com.notionexport.core.model.block.TestNodes.paragraph;
import static com.notionexport.core.model.block.TestNodes.text;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link TreeHydrator}.
 */
class TreeHydratorTest {

    private static final RetryPolicy NO_WAIT = new RetryPolicy(3, Duration.ofMillis(1), 2.0);

    @Test
    void fetchChildren_acrossPages_returnsAllInOrder() {
        NodeIdentity pageId = id(1);
        ContentNode[] blocks = new ContentNode[7];
        for (int i = 0; i < blocks.length; i++) {
            blocks[i] = paragraph("p" + i);
        }
        InMemoryContentApi api = new InMemoryContentApi().page(pageId, "Page", blocks).pageSize(3);

        List<ContentNode> children = new TreeHydrator(api, NO_WAIT).fetchChildren(pageId);

        assertThat(children).containsExactly(blocks);
        assertThat(api.callCount("listChildren", pageId)).isEqualTo(3);
    }

    @Test
    void hydrateTree_nestedChildren_attachedBottomUp() {
        NodeIdentity pageId = id(1);
        NodeIdentity toggleId = id(2);
        NodeIdentity itemId = id(3);
        Toggle toggle = new Toggle(toggleId, text("More"), true, List.of());
        ListItem item = new ListItem(itemId, ListStyle.BULLETED, text("outer"), true, List.of());
        Paragraph deepest = paragraph("deepest");
        InMemoryContentApi api = new InMemoryContentApi()
            .page(pageId, "Page", toggle)
            .children(toggleId, item)
            .children(itemId, deepest);

        List<ContentNode> tree = new TreeHydrator(api, NO_WAIT).hydrateTree(pageId);

        assertThat(tree).hasSize(1);
        ContentNode hydratedToggle = tree.get(0);
        assertThat(hydratedToggle.children()).hasSize(1);
        assertThat(hydratedToggle.children().get(0).id()).isEqualTo(itemId);
        assertThat(hydratedToggle.children().get(0).children()).containsExactly(deepest);
    }

    @Test
    void hydrate_leafNodes_notFetched() {
        NodeIdentity pageId = id(1);
        Paragraph leaf = paragraph("leaf");
        InMemoryContentApi api = new InMemoryContentApi().page(pageId, "Page", leaf);

        new TreeHydrator(api, NO_WAIT).hydrateTree(pageId);

        assertThat(api.callCount("listChildren", leaf.id())).isZero();
    }

    @Test
    void hydrateTree_childPageWithContent_leftUnexpanded() {
        NodeIdentity pageId = id(1);
        NodeIdentity subPageId = id(2);
        ChildPage subPage = new ChildPage(subPageId, "Sub", true, List.of());
        InMemoryContentApi api = new InMemoryContentApi()
            .page(pageId, "Page", subPage)
            .page(subPageId, "Sub", paragraph("inside"));

        List<ContentNode> tree = new TreeHydrator(api, NO_WAIT).hydrateTree(pageId);

        assertThat(tree).containsExactly(subPage);
        assertThat(api.callCount("listChildren", subPageId)).isZero();
    }

    @Test
    void fetchChildren_transientFailure_retried() {
        NodeIdentity pageId = id(1);
        InMemoryContentApi api = new InMemoryContentApi()
            .page(pageId, "Page", paragraph("only"))
            .failNext(pageId, 502, 2);

        List<ContentNode> children = new TreeHydrator(api, NO_WAIT).fetchChildren(pageId);

        assertThat(children).hasSize(1);
        assertThat(api.callCount("listChildren", pageId)).isEqualTo(3);
    }

    @Test
    void fetchChildren_persistentFailure_propagates() {
        NodeIdentity pageId = id(1);
        InMemoryContentApi api = new InMemoryContentApi()
            .page(pageId, "Page")
            .failNext(pageId, 503, 5);

        assertThatThrownBy(() -> new TreeHydrator(api, NO_WAIT).fetchChildren(pageId))
            .isInstanceOf(RemoteApiException.class);
    }
}
