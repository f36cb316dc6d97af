package com.awsmcp.mcp.provider;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

class PageDrainTest {

    /** Minimal page: items plus the cursor of the next page. */
    private record Page(List<String> items, String next) {}

    @Test
    void testDrain_ConcatenatesPagesInOrder() {
        Map<String, Page> pages = Map.of(
            "", new Page(List.of("a", "b"), "p2"),
            "p2", new Page(List.of("c"), "p3"),
            "p3", new Page(List.of("d", "e"), null));
        List<String> cursors = new ArrayList<>();

        List<String> items = PageDrain.drain(cursor -> {
            cursors.add(cursor);
            return pages.get(cursor == null ? "" : cursor);
        }, Page::items, Page::next);

        assertEquals(List.of("a", "b", "c", "d", "e"), items);
        assertEquals(Arrays.asList(null, "p2", "p3"), cursors);
    }

    @Test
    void testDrain_EmptyCursorEndsListing() {
        List<String> items = PageDrain.drain(cursor -> new Page(List.of("only"), ""), Page::items, Page::next);

        assertEquals(List.of("only"), items);
    }

    @Test
    void testDrain_FailureOnLaterPagePropagates() {
        RuntimeException failure = new RuntimeException("page 2 failed");

        RuntimeException thrown = assertThrows(RuntimeException.class, () -> PageDrain.drain(cursor -> {
            if (cursor == null) return new Page(List.of("a"), "p2");
            throw failure;
        }, Page::items, Page::next));

        assertEquals(failure, thrown);
    }

    @Test
    void testDrain_RepeatedCursorIsAnError() {
        IllegalStateException e = assertThrows(IllegalStateException.class,
            () -> PageDrain.drain(cursor -> new Page(List.of("x"), "stuck"), Page::items, Page::next));

        assertEquals("Pagination did not advance: cursor stuck returned twice", e.getMessage());
    }
}
