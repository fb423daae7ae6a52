package com.notionexport.core.model.block;

import com.notionexport.core.model.NodeIdentity;

import java.util.List;
import java.util.Objects;

/**
 * Table. Its children are {@link TableRow} nodes.
 *
 * @param id block id
 * @param width number of columns
 * @param hasChildren whether the block has children remotely
 * @param children hydrated children
 */
public record Table(
    NodeIdentity id,
    int width,
    boolean hasChildren,
    List<ContentNode> children
) implements ContentNode {

    /**
     * Compact constructor with validation.
     */
    public Table {
        Objects.requireNonNull(id, "id must not be null");
        children = children == null ? List.of() : List.copyOf(children);
    }

    @Override
    public Table withChildren(List<ContentNode> children) {
        return new Table(id, width, hasChildren, children);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitTable(this);
    }
}
