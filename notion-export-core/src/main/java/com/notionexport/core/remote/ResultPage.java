package com.notionexport.core.remote;

import java.util.List;

/**
 * One page of a paginated API listing.
 *
 * @param items items in API order
 * @param hasMore whether another page follows
 * @param nextCursor cursor for the next page, null when {@code hasMore} is false
 * @param <T> item type
 */
public record ResultPage<T>(
    List<T> items,
    boolean hasMore,
    String nextCursor
) {
    /**
     * Compact constructor with validation.
     */
    public ResultPage {
        items = items == null ? List.of() : List.copyOf(items);
    }

    /**
     * Creates the final page of a listing.
     *
     * @param items items
     * @param <T> item type
     * @return page without continuation
     */
    public static <T> ResultPage<T> last(List<T> items) {
        return new ResultPage<>(items, false, null);
    }
}
