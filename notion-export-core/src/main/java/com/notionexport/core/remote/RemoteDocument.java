package com.notionexport.core.remote;

import com.notionexport.core.model.NodeIdentity;
import com.notionexport.core.model.RichSpan;

import java.util.List;
import java.util.Objects;

/**
 * A page or database as returned by a retrieve call.
 *
 * @param id object id
 * @param object API object type ({@code page} or {@code database})
 * @param title rich text of the title property, empty when the object has none
 */
public record RemoteDocument(
    NodeIdentity id,
    String object,
    List<RichSpan> title
) {
    public static final String PAGE = "page";
    public static final String DATABASE = "database";

    /**
     * Compact constructor with validation.
     */
    public RemoteDocument {
        Objects.requireNonNull(id, "id must not be null");
        object = object == null ? PAGE : object;
        title = title == null ? List.of() : List.copyOf(title);
    }

    public boolean isPage() {
        return PAGE.equals(object);
    }
}
