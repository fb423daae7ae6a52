package com.notionexport.core.model.block;

import com.notionexport.core.model.NodeIdentity;
import com.notionexport.core.model.RichSpan;

import java.util.List;
import java.util.Objects;

/**
 * Web bookmark.
 *
 * @param id block id
 * @param url bookmarked url, or null
 * @param caption rich text caption
 * @param hasChildren whether the block has children remotely
 * @param children hydrated children
 */
public record Bookmark(
    NodeIdentity id,
    String url,
    List<RichSpan> caption,
    boolean hasChildren,
    List<ContentNode> children
) implements ContentNode {

    /**
     * Compact constructor with validation.
     */
    public Bookmark {
        Objects.requireNonNull(id, "id must not be null");
        caption = caption == null ? List.of() : List.copyOf(caption);
        children = children == null ? List.of() : List.copyOf(children);
    }

    @Override
    public Bookmark withChildren(List<ContentNode> children) {
        return new Bookmark(id, url, caption, hasChildren, children);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitBookmark(this);
    }
}
