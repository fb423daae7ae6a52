package com.notionexport.core.model.block;

import com.notionexport.core.model.NodeIdentity;

import java.util.List;
import java.util.Objects;

/**
 * Horizontal rule.
 *
 * @param id block id
 * @param hasChildren whether the block has children remotely
 * @param children hydrated children
 */
public record Divider(
    NodeIdentity id,
    boolean hasChildren,
    List<ContentNode> children
) implements ContentNode {

    /**
     * Compact constructor with validation.
     */
    public Divider {
        Objects.requireNonNull(id, "id must not be null");
        children = children == null ? List.of() : List.copyOf(children);
    }

    @Override
    public Divider withChildren(List<ContentNode> children) {
        return new Divider(id, hasChildren, children);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitDivider(this);
    }
}
