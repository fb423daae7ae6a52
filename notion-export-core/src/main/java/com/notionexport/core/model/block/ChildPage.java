package com.notionexport.core.model.block;

import com.notionexport.core.model.NodeIdentity;

import java.util.List;
import java.util.Objects;

/**
 * Sub-page embedded in its parent. The block id is the sub-page id.
 *
 * @param id block id
 * @param title sub-page title
 * @param hasChildren whether the block has children remotely
 * @param children hydrated children
 */
public record ChildPage(
    NodeIdentity id,
    String title,
    boolean hasChildren,
    List<ContentNode> children
) implements ContentNode {

    /**
     * Compact constructor with validation.
     */
    public ChildPage {
        Objects.requireNonNull(id, "id must not be null");
        title = title == null ? "" : title;
        children = children == null ? List.of() : List.copyOf(children);
    }

    @Override
    public ChildPage withChildren(List<ContentNode> children) {
        return new ChildPage(id, title, hasChildren, children);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitChildPage(this);
    }
}
