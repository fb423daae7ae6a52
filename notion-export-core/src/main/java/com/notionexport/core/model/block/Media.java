package com.notionexport.core.model.block;

import com.notionexport.core.model.NodeIdentity;
import com.notionexport.core.model.RichSpan;

import java.util.List;
import java.util.Objects;

/**
 * Image, file, PDF, video or audio block.
 *
 * @param id block id
 * @param kind media kind
 * @param url hosted or external url, or null
 * @param caption rich text caption
 * @param hasChildren whether the block has children remotely
 * @param children hydrated children
 */
public record Media(
    NodeIdentity id,
    MediaKind kind,
    String url,
    List<RichSpan> caption,
    boolean hasChildren,
    List<ContentNode> children
) implements ContentNode {

    /**
     * Compact constructor with validation.
     */
    public Media {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        caption = caption == null ? List.of() : List.copyOf(caption);
        children = children == null ? List.of() : List.copyOf(children);
    }

    @Override
    public Media withChildren(List<ContentNode> children) {
        return new Media(id, kind, url, caption, hasChildren, children);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitMedia(this);
    }
}
