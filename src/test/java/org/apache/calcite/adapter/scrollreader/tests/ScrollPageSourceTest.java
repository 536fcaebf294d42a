package org.apache.calcite.adapter.scrollreader.tests;

import org.apache.calcite.adapter.scrollreader.source.Page;
import org.apache.calcite.adapter.scrollreader.source.ScrollCursor;
import org.apache.calcite.adapter.scrollreader.source.ScrollPageSource;
import org.apache.calcite.adapter.scrollreader.source.ScrolledPage;
import org.apache.calcite.adapter.scrollreader.source.exception.CorruptPageException;
import org.apache.calcite.adapter.scrollreader.source.exception.FetchException;
import org.apache.calcite.adapter.scrollreader.source.interfaces.ScrollIterator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class ScrollPageSourceTest {

    private static final List<String> COLUMNS = List.of("title", "year");

    /**
     * Hands out scripted pages and records the cursors it was called with.
     */
    static class ScriptedIterator implements ScrollIterator {
        final Deque<Object> script = new ArrayDeque<>();
        final List<ScrollCursor> seen = new ArrayList<>();
        final List<ScrollCursor> released = new ArrayList<>();

        ScriptedIterator page(List<Object> titles, List<Object> years) {
            script.add(Page.of(COLUMNS, List.of(titles, years)));
            return this;
        }

        ScriptedIterator failure(RuntimeException e) {
            script.add(e);
            return this;
        }

        @Override
        public ScrolledPage getMore(ScrollCursor cursor) {
            seen.add(cursor);
            Object next = script.poll();
            if (next == null) {
                fail("Fetched past the end of the script");
            }
            if (next instanceof RuntimeException) {
                throw (RuntimeException) next;
            }
            return new ScrolledPage((Page) next, cursor.advance("scroll-" + seen.size()));
        }

        @Override
        public void release(ScrollCursor cursor) {
            released.add(cursor);
        }
    }

    private static ScrollCursor start() {
        return ScrollCursor.initial("scroll-0", List.of());
    }

    @Test
    @DisplayName("Three non-empty pages then an empty one yields exactly three pages")
    public void testTakeWhileNonEmpty() {
        ScriptedIterator iterator = new ScriptedIterator()
                .page(List.of("a", "b"), List.of(1, 2))
                .page(List.of("c"), List.of(3))
                .page(List.of("d", "e", "f"), List.of(4, 5, 6))
                .page(List.of(), List.of());
        ScrollPageSource source = new ScrollPageSource(start(), iterator);

        List<Page> pages = new ArrayList<>();
        source.forEachRemaining(pages::add);

        assertEquals(3, pages.size());
        assertEquals(List.of("a", "b"), pages.get(0).getValues("title", String.class));
        assertEquals(List.of("c"), pages.get(1).getValues("title", String.class));
        assertEquals(List.of(4, 5, 6), pages.get(2).getValues("year", Integer.class));
        assertEquals(4, source.getFetchCount());
        assertFalse(source.hasNext());
        assertThrows(NoSuchElementException.class, source::next);
    }

    @Test
    @DisplayName("Each fetch receives the cursor returned by the previous one")
    public void testCursorIsThreaded() {
        ScriptedIterator iterator = new ScriptedIterator()
                .page(List.of("a"), List.of(1))
                .page(List.of("b"), List.of(2))
                .page(List.of(), List.of());
        ScrollPageSource source = new ScrollPageSource(start(), iterator);
        source.forEachRemaining(page -> { });

        assertEquals(List.of("scroll-0", "scroll-1", "scroll-2"),
                iterator.seen.stream().map(ScrollCursor::getScrollId).collect(Collectors.toList()));
        assertEquals(1, iterator.released.size());
        assertEquals("scroll-3", iterator.released.get(0).getScrollId());
    }

    @Test
    @DisplayName("Fetching is lazy: nothing is requested before the first pull")
    public void testLazyFetch() {
        ScriptedIterator iterator = new ScriptedIterator()
                .page(List.of("a"), List.of(1))
                .page(List.of(), List.of());
        ScrollPageSource source = new ScrollPageSource(start(), iterator);

        assertEquals(0, source.getFetchCount());
        assertTrue(source.hasNext());
        assertTrue(source.hasNext());
        assertEquals(1, source.getFetchCount());
    }

    @Test
    @DisplayName("A page with unequal column lengths raises CorruptPageException and ends the source")
    public void testCorruptPage() {
        ScriptedIterator iterator = new ScriptedIterator()
                .page(List.of(), List.of(1, 2));
        ScrollPageSource source = new ScrollPageSource(start(), iterator);

        CorruptPageException e = assertThrows(CorruptPageException.class, source::hasNext);
        assertTrue(e.getMessage().contains("year"));
        assertFalse(source.hasNext());
        assertEquals(1, iterator.released.size());
    }

    @Test
    @DisplayName("A fetch failure mid-stream propagates and terminates the source")
    public void testFetchFailure() {
        ScriptedIterator iterator = new ScriptedIterator()
                .page(List.of("a"), List.of(1))
                .failure(FetchException.buildFetchException("http://h:9200/_search/scroll", new IOException("reset")));
        ScrollPageSource source = new ScrollPageSource(start(), iterator);

        assertEquals(List.of("a"), source.next().getValues("title"));
        assertThrows(FetchException.class, source::hasNext);
        assertFalse(source.hasNext());
        assertEquals(2, iterator.seen.size());
    }

    @Test
    @DisplayName("A failing release does not hide the fetch failure")
    public void testReleaseFailureIsSuppressed() {
        ScriptedIterator iterator = new ScriptedIterator() {
            @Override
            public void release(ScrollCursor cursor) {
                throw new IllegalStateException("clear failed");
            }
        }.failure(FetchException.buildFetchException("http://h:9200/_search/scroll", new IOException("reset")));
        ScrollPageSource source = new ScrollPageSource(start(), iterator);

        FetchException e = assertThrows(FetchException.class, source::hasNext);
        assertEquals(1, e.getSuppressed().length);
        assertEquals("clear failed", e.getSuppressed()[0].getMessage());
        assertFalse(source.hasNext());
    }

    @Test
    @DisplayName("Close releases the scroll once and stops further fetches")
    public void testClose() {
        ScriptedIterator iterator = new ScriptedIterator()
                .page(List.of("a"), List.of(1))
                .page(List.of("b"), List.of(2));
        ScrollPageSource source = new ScrollPageSource(start(), iterator);

        assertTrue(source.hasNext());
        source.close();
        source.close();

        assertFalse(source.hasNext());
        assertEquals(1, iterator.released.size());
        assertEquals(1, iterator.seen.size());
    }

    @Test
    @DisplayName("Stream view yields the same pages and closes the source")
    public void testStream() {
        ScriptedIterator iterator = new ScriptedIterator()
                .page(List.of("a", "b"), List.of(1, 2))
                .page(List.of("c"), List.of(3))
                .page(List.of(), List.of());
        ScrollPageSource source = new ScrollPageSource(start(), iterator);

        int rows;
        try (var pages = source.stream()) {
            rows = pages.mapToInt(Page::getRowCount).sum();
        }

        assertEquals(3, rows);
        assertEquals(1, iterator.released.size());
    }
}
