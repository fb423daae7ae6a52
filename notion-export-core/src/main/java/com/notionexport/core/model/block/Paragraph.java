package com.notionexport.core.model.block;

import com.notionexport.core.model.NodeIdentity;
import com.notionexport.core.model.RichSpan;

import java.util.List;
import java.util.Objects;

/**
 * Plain paragraph. A paragraph with empty text is kept as a blank line.
 *
 * @param id block id
 * @param text rich text content
 * @param hasChildren whether the block has children remotely
 * @param children hydrated children
 */
public record Paragraph(
    NodeIdentity id,
    List<RichSpan> text,
    boolean hasChildren,
    List<ContentNode> children
) implements ContentNode {

    /**
     * Compact constructor with validation.
     */
    public Paragraph {
        Objects.requireNonNull(id, "id must not be null");
        text = text == null ? List.of() : List.copyOf(text);
        children = children == null ? List.of() : List.copyOf(children);
    }

    @Override
    public Paragraph withChildren(List<ContentNode> children) {
        return new Paragraph(id, text, hasChildren, children);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitParagraph(this);
    }
}
