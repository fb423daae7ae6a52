package com.notionexport.core.model.block;

import com.notionexport.core.model.NodeIdentity;

import java.util.List;

/**
 * A block in a page's content tree.
 *
 * <p>One record per block kind, plus {@link UnsupportedNode} for kinds this exporter does not
 * know. Children are empty until the tree is hydrated; hydration builds new nodes through
 * {@link #withChildren(List)} rather than mutating existing ones.
 *
 * <p>Consumers dispatch through {@link #accept(NodeVisitor)}, so adding a kind is a compile
 * error in every visitor until it is handled.
 */
public sealed interface ContentNode permits
    Paragraph, Heading, Quote, Callout, ListItem, ToDo, Toggle, CodeBlock, Divider,
    LinkToPage, ChildPage, Media, Bookmark, Table, TableRow, UnsupportedNode {

    /**
     * Returns the block id.
     *
     * @return block identity
     */
    NodeIdentity id();

    /**
     * Returns whether the remote API reported children for this block.
     *
     * @return true if children exist remotely
     */
    boolean hasChildren();

    /**
     * Returns hydrated children in reading order.
     *
     * @return immutable child list, empty before hydration
     */
    List<ContentNode> children();

    /**
     * Returns a copy of this node with the given children attached.
     *
     * @param children hydrated children
     * @return new node
     */
    ContentNode withChildren(List<ContentNode> children);

    /**
     * Dispatches to the visitor method for this kind.
     *
     * @param visitor visitor
     * @param <R> visitor result type
     * @return visitor result
     */
    <R> R accept(NodeVisitor<R> visitor);
}
