package com.notionexport.core.model.block;

import com.notionexport.core.model.NodeIdentity;
import com.notionexport.core.model.RichSpan;

import java.util.List;
import java.util.Objects;

/**
 * Highlighted callout, optionally decorated with an emoji icon.
 *
 * @param id block id
 * @param icon emoji icon, or null
 * @param text rich text content
 * @param hasChildren whether the block has children remotely
 * @param children hydrated children
 */
public record Callout(
    NodeIdentity id,
    String icon,
    List<RichSpan> text,
    boolean hasChildren,
    List<ContentNode> children
) implements ContentNode {

    /**
     * Compact constructor with validation.
     */
    public Callout {
        Objects.requireNonNull(id, "id must not be null");
        text = text == null ? List.of() : List.copyOf(text);
        children = children == null ? List.of() : List.copyOf(children);
    }

    @Override
    public Callout withChildren(List<ContentNode> children) {
        return new Callout(id, icon, text, hasChildren, children);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitCallout(this);
    }
}
