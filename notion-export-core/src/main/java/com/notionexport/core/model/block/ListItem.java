package com.notionexport.core.model.block;

import com.notionexport.core.model.NodeIdentity;
import com.notionexport.core.model.RichSpan;

import java.util.List;
import java.util.Objects;

/**
 * Bulleted or numbered list item.
 *
 * @param id block id
 * @param style list marker style
 * @param text rich text content
 * @param hasChildren whether the block has children remotely
 * @param children hydrated children
 */
public record ListItem(
    NodeIdentity id,
    ListStyle style,
    List<RichSpan> text,
    boolean hasChildren,
    List<ContentNode> children
) implements ContentNode {

    /**
     * Compact constructor with validation.
     */
    public ListItem {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(style, "style must not be null");
        text = text == null ? List.of() : List.copyOf(text);
        children = children == null ? List.of() : List.copyOf(children);
    }

    @Override
    public ListItem withChildren(List<ContentNode> children) {
        return new ListItem(id, style, text, hasChildren, children);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitListItem(this);
    }
}
