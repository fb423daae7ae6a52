package com.notionexport.core.model.block;

import com.notionexport.core.model.NodeIdentity;

import java.util.List;
import java.util.Objects;

/**
 * Block-level link to another page or database.
 *
 * @param id block id
 * @param targetType {@code page_id}, {@code database_id}, ...
 * @param target linked object id, or null if absent
 * @param hasChildren whether the block has children remotely
 * @param children hydrated children
 */
public record LinkToPage(
    NodeIdentity id,
    String targetType,
    NodeIdentity target,
    boolean hasChildren,
    List<ContentNode> children
) implements ContentNode {

    /**
     * Compact constructor with validation.
     */
    public LinkToPage {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(targetType, "targetType must not be null");
        children = children == null ? List.of() : List.copyOf(children);
    }

    @Override
    public LinkToPage withChildren(List<ContentNode> children) {
        return new LinkToPage(id, targetType, target, hasChildren, children);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitLinkToPage(this);
    }
}
