package com.notionexport.core.model.block;

import com.notionexport.core.model.NodeIdentity;
import com.notionexport.core.model.RichSpan;

import java.util.List;
import java.util.Objects;

/**
 * Fenced code block.
 *
 * @param id block id
 * @param language language tag, may be empty
 * @param text rich text content
 * @param hasChildren whether the block has children remotely
 * @param children hydrated children
 */
public record CodeBlock(
    NodeIdentity id,
    String language,
    List<RichSpan> text,
    boolean hasChildren,
    List<ContentNode> children
) implements ContentNode {

    /**
     * Compact constructor with validation.
     */
    public CodeBlock {
        Objects.requireNonNull(id, "id must not be null");
        language = language == null ? "" : language;
        text = text == null ? List.of() : List.copyOf(text);
        children = children == null ? List.of() : List.copyOf(children);
    }

    @Override
    public CodeBlock withChildren(List<ContentNode> children) {
        return new CodeBlock(id, language, text, hasChildren, children);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitCode(this);
    }
}
