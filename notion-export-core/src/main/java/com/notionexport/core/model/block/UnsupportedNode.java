package com.notionexport.core.model.block;

import com.notionexport.core.model.NodeIdentity;
import com.notionexport.core.model.RichSpan;

import java.util.List;
import java.util.Objects;

/**
 * Block of a kind this exporter does not model; keeps any rich text found under the kind's own field.
 *
 * @param id block id
 * @param type raw block type
 * @param text rich text content
 * @param hasChildren whether the block has children remotely
 * @param children hydrated children
 */
public record UnsupportedNode(
    NodeIdentity id,
    String type,
    List<RichSpan> text,
    boolean hasChildren,
    List<ContentNode> children
) implements ContentNode {

    /**
     * Compact constructor with validation.
     */
    public UnsupportedNode {
        Objects.requireNonNull(id, "id must not be null");
        type = type == null ? "unknown" : type;
        text = text == null ? List.of() : List.copyOf(text);
        children = children == null ? List.of() : List.copyOf(children);
    }

    @Override
    public UnsupportedNode withChildren(List<ContentNode> children) {
        return new UnsupportedNode(id, type, text, hasChildren, children);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitUnsupported(this);
    }
}
