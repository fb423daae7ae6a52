package com.notionexport.core.remote;

import com.notionexport.core.model.NodeIdentity;
import com.notionexport.core.model.block.ContentNode;

/**
 * Remote content API consumed by the crawler and hydrator.
 *
 * <p>Implementations report failures as
 * {@link com.notionexport.core.exception.RemoteApiException} carrying the HTTP status, so that
 * {@link com.notionexport.core.retry.RetryPolicy} can tell permanent from transient errors.
 * Paginated calls accept a null cursor for the first page.
 */
public interface ContentApi {

    RemoteDocument retrieveDocument(NodeIdentity id);

    RemoteDocument retrieveCollection(NodeIdentity id);

    /**
     * Lists direct children of a page or block. Returned nodes are not hydrated.
     *
     * @param id parent id
     * @param cursor continuation cursor, or null
     * @return one page of children
     */
    ResultPage<ContentNode> listChildren(NodeIdentity id, String cursor);

    /**
     * Queries the members of a database.
     *
     * @param id database id
     * @param cursor continuation cursor, or null
     * @return one page of members; non-page members are included with their object type
     */
    ResultPage<RemoteDocument> queryCollectionMembers(NodeIdentity id, String cursor);
}
