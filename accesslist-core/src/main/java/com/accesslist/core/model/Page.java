package com.accesslist.core.model;

import java.util.List;
import java.util.function.Function;

/**
 * One page of items. {@code continuationToken} is null on the last page; otherwise it is
 * the key of the first item of the next page.
 */
public record Page<T>(List<T> items, String continuationToken) {

    public Page {
        items = List.copyOf(items);
    }

    /**
     * Builds a page from a query that fetched up to {@code pageSize + 1} items; the extra
     * item only tells whether there is a next page.
     */
    public static <T> Page<T> create(List<T> fetched, int pageSize, Function<? super T, String> keyOf) {
        if (fetched.size() <= pageSize) {
            return new Page<>(fetched, null);
        }
        return new Page<>(fetched.subList(0, pageSize), keyOf.apply(fetched.get(pageSize)));
    }

    public boolean hasNext() {
        return continuationToken != null;
    }
}
