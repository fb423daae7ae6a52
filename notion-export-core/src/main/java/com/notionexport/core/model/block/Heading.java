package com.notionexport.core.model.block;

import com.notionexport.core.model.NodeIdentity;
import com.notionexport.core.model.RichSpan;

import java.util.List;
import java.util.Objects;

/**
 * Heading of level 1 to 3.
 *
 * @param id block id
 * @param level heading level, 1 to 3
 * @param text rich text content
 * @param hasChildren whether the block has children remotely
 * @param children hydrated children
 */
public record Heading(
    NodeIdentity id,
    int level,
    List<RichSpan> text,
    boolean hasChildren,
    List<ContentNode> children
) implements ContentNode {

    /**
     * Compact constructor with validation.
     */
    public Heading {
        Objects.requireNonNull(id, "id must not be null");
        if (level < 1 || level > 3) {
            throw new IllegalArgumentException("level must be between 1 and 3: " + level);
        }
        text = text == null ? List.of() : List.copyOf(text);
        children = children == null ? List.of() : List.copyOf(children);
    }

    @Override
    public Heading withChildren(List<ContentNode> children) {
        return new Heading(id, level, text, hasChildren, children);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitHeading(this);
    }
}
