package com.notionexport.core.model.block;

import com.notionexport.core.model.NodeIdentity;
import com.notionexport.core.model.RichSpan;

import java.util.List;
import java.util.Objects;

/**
 * Table row holding one rich text list per cell.
 *
 * @param id block id
 * @param cells cells in column order
 * @param hasChildren whether the block has children remotely
 * @param children hydrated children
 */
public record TableRow(
    NodeIdentity id,
    List<List<RichSpan>> cells,
    boolean hasChildren,
    List<ContentNode> children
) implements ContentNode {

    /**
     * Compact constructor with validation.
     */
    public TableRow {
        Objects.requireNonNull(id, "id must not be null");
        cells = cells == null ? List.of() : cells.stream().map(List::copyOf).toList();
        children = children == null ? List.of() : List.copyOf(children);
    }

    @Override
    public TableRow withChildren(List<ContentNode> children) {
        return new TableRow(id, cells, hasChildren, children);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitTableRow(this);
    }
}
