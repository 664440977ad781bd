package io.schedula.core.store;

import java.util.List;

/**
 * One page of an ordered list plus the total number of items in the list.
 */
public record ListPage<T>(List<T> items, int length) {
    public ListPage {
        items = items == null ? List.of() : List.copyOf(items);
        length = Math.max(0, length);
    }

    public static <T> ListPage<T> empty() {
        return new ListPage<>(List.of(), 0);
    }
}
