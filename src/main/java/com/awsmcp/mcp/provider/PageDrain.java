package com.awsmcp.mcp.provider;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.function.Function;

/**
 * Drains a cursor-paginated provider listing into one ordered list.
 */
public final class PageDrain {

    private PageDrain() {}

    /**
     * Fetch pages until the next cursor is absent or empty and concatenate their items in page order.
     * The first page is fetched with a null cursor. A failing fetch propagates and the items collected
     * so far are dropped.
     *
     * @param fetch page fetch for a cursor
     * @param items item extractor of one page
     * @param nextCursor next-cursor extractor of one page
     * @throws IllegalStateException if the provider hands back the cursor it was just called with
     */
    public static <P, T> List<T> drain(Function<String, P> fetch,
                                       Function<? super P, ? extends Collection<? extends T>> items,
                                       Function<? super P, String> nextCursor) {
        List<T> collected = new ArrayList<>();
        String cursor = null;
        while (true) {
            P page = fetch.apply(cursor);
            collected.addAll(items.apply(page));

            String next = nextCursor.apply(page);
            if (next == null || next.isEmpty()) {
                return collected;
            }
            if (next.equals(cursor)) {
                throw new IllegalStateException("Pagination did not advance: cursor " + next + " returned twice");
            }
            cursor = next;
        }
    }
}
