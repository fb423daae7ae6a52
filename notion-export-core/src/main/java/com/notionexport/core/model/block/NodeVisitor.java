package com.notionexport.core.model.block;

/**
 * Visitor over every {@link ContentNode} kind.
 *
 * @param <R> result type
 */
public interface NodeVisitor<R> {

    R visitParagraph(Paragraph node);

    R visitHeading(Heading node);

    R visitQuote(Quote node);

    R visitCallout(Callout node);

    R visitListItem(ListItem node);

    R visitToDo(ToDo node);

    R visitToggle(Toggle node);

    R visitCode(CodeBlock node);

    R visitDivider(Divider node);

    R visitLinkToPage(LinkToPage node);

    R visitChildPage(ChildPage node);

    R visitMedia(Media node);

    R visitBookmark(Bookmark node);

    R visitTable(Table node);

    R visitTableRow(TableRow node);

    R visitUnsupported(UnsupportedNode node);
}
