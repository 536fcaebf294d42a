package org.apache.calcite.adapter.scrollreader.source;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.List;
import java.util.Map;

/**
 * Position of a reader inside a server-side scroll.
 * <p>
 * Holds the scroll id issued by the backend and, right after the initial search, the hits
 * that search already returned. Cursors are immutable: each fetch hands back the cursor to
 * use for the following one, so scroll state is passed explicitly rather than hidden in a
 * connection object.
 * </p>
 */
@ToString
@EqualsAndHashCode
public final class ScrollCursor {

    private final String scrollId;
    @ToString.Exclude
    private final List<Map<String, Object>> bufferedHits;

    private ScrollCursor(String scrollId, List<Map<String, Object>> bufferedHits) {
        this.scrollId = scrollId;
        this.bufferedHits = bufferedHits;
    }

    /**
     * Cursor positioned at the start of a scroll.
     *
     * @param scrollId     Scroll id from the initial search response, may be null
     * @param bufferedHits Document sources returned by the initial search, not yet paged out
     */
    public static ScrollCursor initial(String scrollId, List<Map<String, Object>> bufferedHits) {
        return new ScrollCursor(scrollId, List.copyOf(bufferedHits));
    }

    /**
     * Returns the cursor for the request after this one.
     *
     * @param nextScrollId Scroll id from the latest response; null keeps the current id
     */
    public ScrollCursor advance(String nextScrollId) {
        return new ScrollCursor(nextScrollId != null ? nextScrollId : scrollId, List.of());
    }

    public String getScrollId() {
        return scrollId;
    }

    public boolean hasScrollId() {
        return scrollId != null && !scrollId.isEmpty();
    }

    public List<Map<String, Object>> getBufferedHits() {
        return bufferedHits;
    }

    public boolean hasBufferedHits() {
        return !bufferedHits.isEmpty();
    }
}
